package ilhost.runtime.typesystem;

import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 可赋值性与类型检查测试
 */
class AssignabilityTest {

    private TypeSystem ts;
    private LoadUnit zoo;
    private TypeDescriptor object;

    @BeforeEach
    void setUp() {
        ts = CoreLibrary.newSystem(new RecordingHost());
        zoo = ts.declareLoadUnit("Zoo");
        ts.makeInterface(zoo, "Zoo.IShape", null);
        ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Polygon").interfaces("Zoo.IShape").build());
        ts.makeClass(zoo, "Zoo.Square", "Zoo.Polygon", null);
        ts.makeClass(zoo, "Zoo.Circle", null, null);
        Map<String, Long> colors = new LinkedHashMap<>();
        colors.put("Red", 0L);
        colors.put("Green", 1L);
        ts.makeEnum(zoo, "Zoo.Color", false, colors);
        ts.initialize();
        object = ts.getType(zoo, "System.Object");
    }

    @Nested
    @DisplayName("类与接口")
    class ClassesAndInterfaces {

        @Test
        @DisplayName("沿基类链与接口传递")
        void testTransitive() {
            TypeDescriptor shape = ts.getType(zoo, "Zoo.IShape");
            TypeDescriptor polygon = ts.getType(zoo, "Zoo.Polygon");
            TypeDescriptor square = ts.getType(zoo, "Zoo.Square");

            assertTrue(ts.isAssignable(square, polygon));
            assertTrue(ts.isAssignable(square, shape));
            assertTrue(ts.isAssignable(square, object));
            assertTrue(ts.isAssignable(polygon, shape));
            assertFalse(ts.isAssignable(polygon, square));
            assertFalse(ts.isAssignable(shape, polygon));
            assertFalse(ts.isAssignable(ts.getType(zoo, "Zoo.Circle"), shape));
        }

        @Test
        @DisplayName("可赋值集合包含自身、基类与接口的标识")
        void testAssignableSet() {
            TypeDescriptor square = ts.getType(zoo, "Zoo.Square");

            assertThat(square.getAssignableTypes()).contains(
                    square.getTypeId(),
                    ts.getType(zoo, "Zoo.Polygon").getTypeId(),
                    ts.getType(zoo, "Zoo.IShape").getTypeId(),
                    object.getTypeId());
        }

        @Test
        @DisplayName("实例按运行时类型检查")
        void testCheckInstance() {
            IlObject square = ts.createInstance(ts.getType(zoo, "Zoo.Square"));

            assertTrue(ts.checkType(square, ts.getType(zoo, "Zoo.IShape")));
            assertTrue(ts.checkType(square, object));
            assertFalse(ts.checkType(square, ts.getType(zoo, "Zoo.Circle")));
            assertFalse(ts.checkType(null, object));
        }

        @Test
        @DisplayName("继承深度")
        void testDepth() {
            assertEquals(1, object.getInheritanceDepth());
            assertEquals(2, ts.getType(zoo, "Zoo.Polygon").getInheritanceDepth());
            assertEquals(3, ts.getType(zoo, "Zoo.Square").getInheritanceDepth());
        }
    }

    @Nested
    @DisplayName("枚举")
    class Enums {

        @Test
        @DisplayName("枚举只可赋值给自身和 System.Enum")
        void testEnumAssignability() {
            TypeDescriptor color = ts.getType(zoo, "Zoo.Color");

            assertTrue(ts.isAssignable(color, ts.getType(zoo, "System.Enum")));
            assertFalse(ts.isAssignable(color, object));
            assertThat(color.getAssignableTypes()).hasSize(2);
        }

        @Test
        @DisplayName("只接受同一枚举类型的值")
        void testEnumCheck() {
            TypeDescriptor color = ts.getType(zoo, "Zoo.Color");

            assertTrue(ts.checkType(color.getPublicInterface().get("Green"), color));
            assertFalse(ts.checkType(1, color));
            assertTrue(color.isValueType());
        }
    }

    @Nested
    @DisplayName("数组与任意类型")
    class ArraysAndAny {

        @Test
        @DisplayName("数组类型按元素驻留")
        void testInterned() {
            TypeDescriptor int32 = ts.getType(zoo, "System.Int32");
            TypeDescriptor array = ts.arrayOf(int32);

            assertSame(array, ts.arrayOf("System.Int32"));
            assertNotSame(array, ts.arrayOf("System.String"));
            assertEquals("System.Int32[]", array.getFullName());
            assertSame(int32, array.getElementType());
        }

        @Test
        @DisplayName("宿主数组和列表都通过数组检查")
        void testArrayCheck() {
            TypeDescriptor array = ts.arrayOf("System.Int32");

            assertTrue(ts.checkType(new int[]{1, 2}, array));
            assertTrue(ts.checkType(Arrays.asList(1, 2), array));
            assertFalse(ts.checkType("not an array", array));
            assertTrue(ts.isAssignable(array, ts.getType(zoo, "System.Array")));
            assertTrue(ts.isAssignable(array, object));
        }

        @Test
        @DisplayName("任意类型接受一切")
        void testAny() {
            TypeDescriptor any = ts.anyType();

            assertSame(any, ts.anyType());
            assertTrue(ts.checkType("x", any));
            assertTrue(ts.checkType(new Object(), any));
            assertTrue(ts.isAssignable(ts.getType(zoo, "Zoo.Circle"), any));
        }
    }
}
