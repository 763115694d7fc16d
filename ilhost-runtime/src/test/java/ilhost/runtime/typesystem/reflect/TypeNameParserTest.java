package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.NameResolutionException;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.typesystem.CoreLibrary;
import ilhost.runtime.typesystem.RecordingHost;
import ilhost.runtime.typesystem.TypeDeclaration;
import ilhost.runtime.typesystem.TypeSystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 程序集限定类型名解析测试
 */
class TypeNameParserTest {

    @Nested
    @DisplayName("解析")
    class Parsing {

        @Test
        @DisplayName("简单名称没有单元和数组")
        void testSimple() {
            ParsedTypeName name = TypeNameParser.parse("  System.Int32 ");
            assertEquals("System.Int32", name.getTypeName());
            assertNull(name.getLoadUnitName());
            assertEquals(0, name.getArrayRank());
            assertTrue(name.getGenericArguments().isEmpty());
        }

        @Test
        @DisplayName("泛型实参里的逗号不截断单元名")
        void testQualifiedGenericArray() {
            ParsedTypeName name = TypeNameParser.parse("Ns.Box`1[[System.Int32, IlHost.Core]][], Zoo");

            assertEquals("Ns.Box`1", name.getTypeName());
            assertEquals("Zoo", name.getLoadUnitName());
            assertEquals(1, name.getArrayRank());
            assertEquals(1, name.getGenericArguments().size());

            ParsedTypeName argument = name.getGenericArguments().get(0);
            assertEquals("System.Int32", argument.getTypeName());
            assertEquals("IlHost.Core", argument.getLoadUnitName());
            assertEquals("Ns.Box`1[[System.Int32, IlHost.Core]][], Zoo", name.toString());
        }

        @Test
        @DisplayName("多个实参和嵌套实参")
        void testMultipleArguments() {
            ParsedTypeName name = TypeNameParser.parse(
                    "Zoo.Pair[[System.Int32],[Zoo.Box[[System.String, IlHost.Core]][][], Zoo]]");

            assertEquals("Zoo.Pair", name.getTypeName());
            assertEquals(2, name.getGenericArguments().size());
            ParsedTypeName nested = name.getGenericArguments().get(1);
            assertEquals("Zoo.Box", nested.getTypeName());
            assertEquals(2, nested.getArrayRank());
            assertEquals("Zoo", nested.getLoadUnitName());
            assertEquals("IlHost.Core", nested.getGenericArguments().get(0).getLoadUnitName());
        }

        @Test
        @DisplayName("空名称与括号不配对")
        void testMalformed() {
            assertThrows(NameResolutionException.class, () -> TypeNameParser.parse(""));
            assertThrows(NameResolutionException.class, () -> TypeNameParser.parse(null));
            NameResolutionException ex = assertThrows(NameResolutionException.class,
                    () -> TypeNameParser.parse("Ns.Box[System.Int32"));
            assertEquals("Malformed type name 'Ns.Box[System.Int32'", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("按名称取类型")
    class Resolving {

        private TypeSystem newSystem() {
            TypeSystem ts = CoreLibrary.newSystem(new RecordingHost());
            LoadUnit zoo = ts.declareLoadUnit("Zoo, Version=1.0.0.0");
            ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Box")
                    .genericParameters("T")
                    .initializer($ -> $.field(MemberFlags.PUBLIC_INSTANCE, "Value", "!T"))
                    .build());
            ts.initialize();
            return ts;
        }

        @Test
        @DisplayName("未限定名称在核心单元中解析")
        void testCoreName() {
            TypeSystem ts = newSystem();
            TypeDescriptor int32 = ts.getTypeByName("System.Int32");
            assertSame(ts.getType(ts.coreUnit(), "System.Int32"), int32);
            assertTrue(int32.isInitialized());
        }

        @Test
        @DisplayName("限定名称闭包泛型并构造数组")
        void testClosedAndArray() {
            TypeSystem ts = newSystem();
            TypeDescriptor int32 = ts.getTypeByName("System.Int32");
            TypeDescriptor box = ts.getType(ts.getLoadUnit("Zoo"), "Zoo.Box");

            assertSame(ts.close(box, int32), ts.getTypeByName("Zoo.Box[[System.Int32]], Zoo"));
            assertSame(ts.arrayOf(int32), ts.getTypeByName("System.Int32[]"));
            assertEquals("Zoo.Box[System.Int32][]",
                    ts.getTypeByName("Zoo.Box[[System.Int32]][], Zoo").getFullName());
        }

        @Test
        @DisplayName("未声明的单元报错")
        void testUnknownUnit() {
            TypeSystem ts = newSystem();
            NameResolutionException ex = assertThrows(NameResolutionException.class,
                    () -> ts.getTypeByName("Zoo.Box, Farm"));
            assertEquals("The load unit 'Farm' has not been declared.", ex.getMessage());
        }
    }
}
