package ilhost.runtime.typesystem;

import ilhost.runtime.ExternalMemberNotImplementedException;
import ilhost.runtime.RuntimeOptions;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.TypeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 接口修正测试
 */
class InterfaceFixupTest {

    private RecordingHost host;
    private TypeSystem ts;
    private LoadUnit zoo;

    private void setUp(RuntimeOptions options) {
        host = new RecordingHost();
        ts = CoreLibrary.newSystem(options, host);
        zoo = ts.declareLoadUnit("Zoo");
        ts.makeInterface(zoo, "Zoo.INamed", $ -> {
            $.interfaceMethod("Describe", $.signature("System.String"));
            $.interfaceProperty("Label");
        });
    }

    private void declareClass(String name, Object iface, Consumer<InterfaceBuilder> members) {
        ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, name).interfaces(iface).initializer(members).build());
    }

    @Test
    @DisplayName("已实现的成员得到接口限定别名")
    void testAliases() {
        setUp(RuntimeOptions.defaults());
        declareClass("Zoo.Cat", "Zoo.INamed", $ -> {
            $.method(MemberFlags.PUBLIC_INSTANCE, "Describe", $.signature("System.String"), (self, args) -> "cat");
            $.method(MemberFlags.PUBLIC_INSTANCE, "get_Label", $.signature("System.String"), (self, args) -> "Tom");
        });
        ts.initialize();

        IlObject cat = ts.createInstance(ts.getType(zoo, "Zoo.Cat"));

        assertEquals("cat", cat.invoke("INamed.Describe"));
        assertEquals("Tom", cat.get("INamed.Label"));
        assertThat(host.warnings).isEmpty();
    }

    @Test
    @DisplayName("显式声明的接口限定实现不被覆盖")
    void testExplicitImplementation() {
        setUp(RuntimeOptions.defaults());
        declareClass("Zoo.Owl", "Zoo.INamed", $ -> {
            $.method(MemberFlags.PUBLIC_INSTANCE, "Describe", $.signature("System.String"), (self, args) -> "public");
            $.method(MemberFlags.PRIVATE_INSTANCE, "INamed.Describe", $.signature("System.String"),
                    (self, args) -> "explicit");
            $.property(MemberFlags.PUBLIC_INSTANCE, "Label", "System.String");
            $.method(MemberFlags.PUBLIC_INSTANCE, "get_Label", $.signature("System.String"), (self, args) -> "owl");
        });
        ts.initialize();

        IlObject owl = ts.createInstance(ts.getType(zoo, "Zoo.Owl"));

        assertEquals("explicit", owl.invoke("INamed.Describe"));
        assertEquals("public", owl.invoke("Describe"));
        assertEquals("owl", owl.get("INamed.Label"));
        assertEquals("owl", owl.get("Label"));
        assertThat(host.warnings).isEmpty();
    }

    @Test
    @DisplayName("缺失的成员汇总成一条警告")
    void testMissingMembers() {
        setUp(RuntimeOptions.defaults());
        declareClass("Zoo.Rock", "Zoo.INamed", null);
        ts.initialize();

        ts.getType(zoo, "Zoo.Rock");

        assertThat(host.warnings).containsExactly("Type 'Zoo.Rock' is missing implementation of interface "
                + "member(s): INamed.Describe, INamed.Label");
    }

    @Test
    @DisplayName("quiet 选项关闭缺失成员警告")
    void testQuiet() {
        setUp(RuntimeOptions.quiet());
        declareClass("Zoo.Rock", "Zoo.INamed", null);
        ts.initialize();

        ts.getType(zoo, "Zoo.Rock");

        assertThat(host.warnings).isEmpty();
    }

    @Test
    @DisplayName("占位实现算作缺失，但别名仍然安装")
    void testPlaceholder() {
        setUp(RuntimeOptions.defaults());
        declareClass("Zoo.Ghost", "Zoo.INamed", $ -> {
            $.externalMethod(MemberFlags.PUBLIC_INSTANCE, "Describe", $.signature("System.String"));
            $.method(MemberFlags.PUBLIC_INSTANCE, "get_Label", $.signature("System.String"), (self, args) -> "boo");
        });
        ts.initialize();

        IlObject ghost = ts.createInstance(ts.getType(zoo, "Zoo.Ghost"));

        assertThat(host.warnings).hasSize(1);
        assertThat(host.warnings.get(0)).contains("INamed.Describe").doesNotContain("INamed.Label");
        ExternalMemberNotImplementedException e = assertThrows(ExternalMemberNotImplementedException.class,
                () -> ghost.invoke("INamed.Describe"));
        assertThat(e).hasMessageContaining("Zoo.Ghost");
    }

    @Test
    @DisplayName("继承的接口也被修正")
    void testInheritedInterface() {
        setUp(RuntimeOptions.defaults());
        ts.declare(zoo, TypeDeclaration.builder(TypeKind.INTERFACE, "Zoo.ITitled").interfaces("Zoo.INamed")
                .initializer($ -> $.interfaceMethod("Title", $.signature("System.String"))).build());
        declareClass("Zoo.Knight", "Zoo.ITitled", $ -> {
            $.method(MemberFlags.PUBLIC_INSTANCE, "Describe", $.signature("System.String"), (self, args) -> "knight");
            $.method(MemberFlags.PUBLIC_INSTANCE, "Title", $.signature("System.String"), (self, args) -> "Sir");
            $.method(MemberFlags.PUBLIC_INSTANCE, "get_Label", $.signature("System.String"), (self, args) -> "K");
        });
        ts.initialize();

        IlObject knight = ts.createInstance(ts.getType(zoo, "Zoo.Knight"));

        assertEquals("Sir", knight.invoke("ITitled.Title"));
        assertEquals("knight", knight.invoke("INamed.Describe"));
        assertTrue(ts.checkType(knight, ts.getType(zoo, "Zoo.INamed")));
        assertThat(host.warnings).isEmpty();
    }

    @Test
    @DisplayName("把类列为接口时警告")
    void testNotAnInterface() {
        setUp(RuntimeOptions.quiet());
        ts.makeClass(zoo, "Zoo.Plain", null, null);
        declareClass("Zoo.Odd", "Zoo.Plain", null);
        ts.initialize();

        ts.getType(zoo, "Zoo.Odd");

        assertThat(host.warnings).contains(
                "Type 'Zoo.Odd' lists 'Zoo.Plain' as an interface, but it is not an interface.");
    }
}
