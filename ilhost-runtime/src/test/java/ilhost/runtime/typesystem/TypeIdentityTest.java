package ilhost.runtime.typesystem;

import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型标识测试
 */
class TypeIdentityTest {

    private TypeSystem ts;
    private LoadUnit zoo;

    @BeforeEach
    void setUp() {
        ts = CoreLibrary.newSystem(new RecordingHost());
        zoo = ts.declareLoadUnit("Zoo, Version=1.0.0.0");
    }

    @Test
    @DisplayName("同一单元同一名称总是得到同一标识")
    void testStableId() {
        String first = ts.assignTypeId(zoo, "Zoo.Thing");
        assertEquals(first, ts.assignTypeId(zoo, "Zoo.Thing"));
        assertNotEquals(first, ts.assignTypeId(zoo, "Zoo.Other"));
    }

    @Test
    @DisplayName("不同单元中的同名私有类型标识不同")
    void testDifferentUnits() {
        LoadUnit other = ts.declareLoadUnit("Other");
        assertNotEquals(ts.assignTypeId(zoo, "Shared.Name"), ts.assignTypeId(other, "Shared.Name"));
        assertNotEquals(zoo.getIdPrefix(), other.getIdPrefix());
    }

    @Test
    @DisplayName("核心库别名与核心单元共享标识")
    void testCoreAlias() {
        LoadUnit alias = ts.declareLoadUnit("mscorlib, Version=4.0.0.0");

        assertNotSame(ts.coreUnit(), alias);
        assertEquals(ts.coreUnit().getIdPrefix(), alias.getIdPrefix());
        assertEquals(ts.getType(ts.coreUnit(), "System.Int32").getTypeId(),
                ts.assignTypeId(alias, "System.Int32"));
    }

    @Test
    @DisplayName("公开类型的标识以声明单元为准")
    void testPublicTypeOwner() {
        LoadUnit other = ts.declareLoadUnit("Other");
        TypeHandle handle = ts.makeClass(zoo, "Zoo.Shared", null, null);

        assertEquals(handle.getType().getTypeId(), ts.assignTypeId(other, "Zoo.Shared"));
    }

    @Test
    @DisplayName("私有类型与另一单元的同名公开类型互不混淆")
    void testPrivateShadowsPublic() {
        LoadUnit owner = ts.declareLoadUnit("Owner");
        LoadUnit local = ts.declareLoadUnit("Local");
        LoadUnit client = ts.declareLoadUnit("Client");
        String before = ts.assignTypeId(local, "Shared.Foo");
        TypeDescriptor publicFoo = ts.makeClass(owner, "Shared.Foo", null, null).getType();
        TypeDescriptor privateFoo = ts.declare(local, TypeDeclaration.builder(TypeKind.CLASS, "Shared.Foo")
                .isPublic(false).build()).getType();
        ts.initialize();

        assertNotEquals(publicFoo.getTypeId(), privateFoo.getTypeId());
        assertEquals(before, privateFoo.getTypeId());
        assertEquals(privateFoo.getTypeId(), ts.assignTypeId(local, "Shared.Foo"));
        assertEquals(publicFoo.getTypeId(), ts.assignTypeId(client, "Shared.Foo"));
        assertFalse(ts.isAssignable(privateFoo, publicFoo));
        assertFalse(ts.isAssignable(publicFoo, privateFoo));
    }

    @Test
    @DisplayName("私有类型的基类引用解析到本单元的同名类型")
    void testPrivateBaseReference() {
        LoadUnit owner = ts.declareLoadUnit("Owner");
        LoadUnit local = ts.declareLoadUnit("Local");
        TypeDescriptor publicFoo = ts.makeClass(owner, "Shared.Foo", null, null).getType();
        TypeDescriptor privateFoo = ts.declare(local, TypeDeclaration.builder(TypeKind.CLASS, "Shared.Foo")
                .isPublic(false).build()).getType();
        TypeDescriptor bar = ts.makeClass(local, "Local.Bar", "Shared.Foo", null).getType();
        ts.initialize();

        assertTrue(ts.isAssignable(bar, privateFoo));
        assertFalse(ts.isAssignable(bar, publicFoo));
    }

    @Test
    @DisplayName("描述符的标识与分配的标识一致")
    void testDescriptorId() {
        TypeDescriptor type = ts.makeClass(zoo, "Zoo.Plain", null, null).getType();

        assertEquals(ts.assignTypeId(zoo, "Zoo.Plain"), type.getTypeId());
        assertEquals(type.getTypeId(), type.typeId());
    }

    @Test
    @DisplayName("闭包类型的标识以开放类型标识为前缀")
    void testClosedId() {
        TypeDescriptor open = ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Pair")
                .genericParameters("A", "B").build()).getType();
        TypeDescriptor closed = ts.close(open, "System.Int32", "System.String");

        assertTrue(closed.getTypeId().startsWith(open.getTypeId() + "["));
        assertNotEquals(closed.getTypeId(), ts.close(open, "System.String", "System.Int32").getTypeId());
    }
}
