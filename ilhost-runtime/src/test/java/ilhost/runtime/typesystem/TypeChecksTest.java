package ilhost.runtime.typesystem;

import ilhost.runtime.IlHostException;
import ilhost.runtime.InvalidCastException;
import ilhost.runtime.NameResolutionException;
import ilhost.runtime.types.EnumValue;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.TypeDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 运行时类型、转换与默认值测试
 */
class TypeChecksTest {

    private TypeSystem ts;
    private LoadUnit zoo;
    private TypeDescriptor int32;
    private TypeDescriptor string;
    private TypeDescriptor color;

    @BeforeEach
    void setUp() {
        ts = CoreLibrary.newSystem(new RecordingHost());
        zoo = ts.declareLoadUnit("Zoo");
        Map<String, Long> colors = new LinkedHashMap<>();
        colors.put("Red", 0L);
        colors.put("Green", 1L);
        colors.put("Blue", 2L);
        ts.makeEnum(zoo, "Zoo.Color", false, colors);
        ts.makeStruct(zoo, "Zoo.Point", $ -> {
            $.field(MemberFlags.PUBLIC_INSTANCE, "X", "System.Int32");
            $.field(MemberFlags.PUBLIC_INSTANCE, "Y", "System.Int32");
        });
        ts.initialize();
        int32 = ts.getType(zoo, "System.Int32");
        string = ts.getType(zoo, "System.String");
        color = ts.getType(zoo, "Zoo.Color");
    }

    @Nested
    @DisplayName("运行时类型")
    class TypeOf {

        @Test
        @DisplayName("宿主值映射到核心库类型")
        void testHostValues() {
            assertSame(int32, ts.typeOf(5));
            assertSame(string, ts.typeOf("s"));
            assertEquals("System.Int64", ts.typeOf(5L).getFullName());
            assertEquals("System.Double", ts.typeOf(1.5d).getFullName());
            assertEquals("System.Boolean", ts.typeOf(true).getFullName());
            assertNull(ts.typeOf(null));
        }

        @Test
        @DisplayName("未映射的宿主值回落到根类型，数组与列表为 System.Array")
        void testFallbacks() {
            assertEquals("System.Object", ts.typeOf(new Object()).getFullName());
            assertEquals("System.Array", ts.typeOf(new String[0]).getFullName());
            assertEquals("System.Array", ts.typeOf(new ArrayList<Object>()).getFullName());
        }

        @Test
        @DisplayName("类型对象的类型是 RuntimeType")
        void testMetaType() {
            assertEquals("System.RuntimeType", ts.typeOf(int32).getFullName());
            assertSame(ts.typeOf(int32), ts.typeOf(color.getPublicInterface()));
        }

        @Test
        @DisplayName("实例与枚举值报告自身类型")
        void testRuntimeValues() {
            TypeDescriptor point = ts.getType(zoo, "Zoo.Point");

            assertSame(point, ts.typeOf(ts.createInstance(point)));
            assertSame(color, ts.typeOf(color.getPublicInterface().get("Blue")));
        }
    }

    @Nested
    @DisplayName("转换")
    class Casts {

        @Test
        @DisplayName("兼容的值原样返回")
        void testCompatible() {
            assertEquals("s", ts.cast("s", string));
            assertEquals(3, ts.cast(3, int32));
            assertNull(ts.cast(null, string));
        }

        @Test
        @DisplayName("null 不能转换为值类型")
        void testNullToValueType() {
            InvalidCastException e = assertThrows(InvalidCastException.class, () -> ts.cast(null, int32));
            assertEquals("Unable to cast null to type 'System.Int32'.", e.getMessage());
        }

        @Test
        @DisplayName("不兼容的值报告两端类型")
        void testIncompatible() {
            InvalidCastException e = assertThrows(InvalidCastException.class, () -> ts.cast("s", int32));
            assertEquals("Unable to cast object of type 'System.String' to type 'System.Int32'.", e.getMessage());
        }

        @Test
        @DisplayName("数值转换为枚举时向下取整并查找命名值")
        void testNumberToEnum() {
            EnumValue green = (EnumValue) color.getPublicInterface().get("Green");

            assertSame(green, ts.cast(1, color));
            assertSame(green, ts.cast(1.7d, color));

            EnumValue unnamed = (EnumValue) ts.cast(7, color);
            assertEquals(7L, unnamed.getValue());
            assertNull(unnamed.getName());
            assertSame(color, unnamed.getType());
        }

        @Test
        @DisplayName("TryCast 失败返回 null，目标不能是值类型")
        void testTryCast() {
            assertEquals("s", ts.tryCast("s", string));
            assertNull(ts.tryCast(5, string));

            InvalidCastException e = assertThrows(InvalidCastException.class, () -> ts.tryCast(5, int32));
            assertEquals("Cannot TryCast to the value type 'System.Int32'.", e.getMessage());
        }
    }

    @Nested
    @DisplayName("默认值")
    class Defaults {

        @Test
        @DisplayName("基元默认值")
        void testPrimitiveDefaults() {
            assertEquals(0, ts.defaultValue(int32));
            assertEquals(0L, ts.defaultValue(ts.getType(zoo, "System.Int64")));
            assertEquals(0.0d, ts.defaultValue(ts.getType(zoo, "System.Double")));
            assertEquals(Boolean.FALSE, ts.defaultValue(ts.getType(zoo, "System.Boolean")));
        }

        @Test
        @DisplayName("引用类型默认为 null，枚举为 0 值")
        void testReferenceAndEnum() {
            assertNull(ts.defaultValue(string));
            assertNull(ts.defaultValue(null));

            Object red = ts.defaultValue(color);
            assertThat(red).isInstanceOf(EnumValue.class);
            assertEquals("Red", ((EnumValue) red).getName());
        }

        @Test
        @DisplayName("结构默认为新实例")
        void testStructDefault() {
            TypeDescriptor point = ts.getType(zoo, "Zoo.Point");

            Object first = ts.defaultValue(point);
            Object second = ts.defaultValue(point);

            assertThat(first).isInstanceOf(IlObject.class);
            assertNotSame(first, second);
            assertEquals(0, ((IlObject) first).get("X"));
            assertTrue(ts.structEquals(first, second));
        }
    }

    @Nested
    @DisplayName("标志枚举与浅复制")
    class FlagsAndClone {

        private TypeDescriptor access;

        @BeforeEach
        void declareFlags() {
            Map<String, Long> members = new LinkedHashMap<>();
            members.put("None", 0L);
            members.put("Read", 1L);
            members.put("Write", 2L);
            members.put("Execute", 4L);
            ts.makeEnum(zoo, "Zoo.Access", true, members);
            access = ts.getType(zoo, "Zoo.Access");
        }

        @Test
        @DisplayName("组合值按名称渲染")
        void testCombine() {
            EnumValue readWrite = ts.enumFlags(access, "Read", "Write");

            assertEquals(3L, readWrite.getValue());
            assertNull(readWrite.getName());
            assertEquals("Read, Write", readWrite.toString());
            assertTrue(readWrite.hasFlag(access.getEnumValue("Write")));
            assertFalse(readWrite.hasFlag(access.getEnumValue("Execute")));
            assertSame(access.getEnumValue("Read"), ts.enumFlags(access, "Read"));
        }

        @Test
        @DisplayName("未知名称与非标志枚举")
        void testInvalid() {
            assertThrows(NameResolutionException.class, () -> ts.enumFlags(access, "Delete"));
            IlHostException e = assertThrows(IlHostException.class,
                    () -> ts.enumFlags(color, "Red"));
            assertEquals("Type 'Zoo.Color' is not a flags enumeration", e.getMessage());
        }

        @Test
        @DisplayName("浅复制共享模板、字段独立")
        void testMemberwiseClone() {
            IlObject point = ts.createInstance(ts.getType(zoo, "Zoo.Point"));
            point.set("X", 3);

            IlObject copy = point.memberwiseClone();
            copy.set("Y", 9);

            assertEquals(3, copy.get("X"));
            assertEquals(0, point.get("Y"));
            assertSame(point.getType(), copy.getType());
            assertFalse(ts.structEquals(point, copy));
        }
    }
}
