package ilhost.runtime.typesystem;

import ilhost.runtime.IlHostException;
import ilhost.runtime.InvalidGenericArgumentException;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 泛型闭包测试
 */
class GenericClosureTest {

    private RecordingHost host;
    private TypeSystem ts;
    private LoadUnit zoo;
    private TypeDescriptor holder;
    private TypeDescriptor int32;
    private TypeDescriptor string;

    @BeforeEach
    void setUp() {
        host = new RecordingHost();
        ts = CoreLibrary.newSystem(host);
        zoo = ts.declareLoadUnit("Zoo, Version=1.0.0.0");
        ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Holder")
                .genericParameters("T")
                .initializer($ -> {
                    $.field(MemberFlags.PUBLIC_INSTANCE, "Item", "!T");
                    $.method(MemberFlags.PUBLIC_INSTANCE, "Peek", $.signature("!T"),
                            (self, args) -> ((IlObject) self).get("Item"));
                    $.field(MemberFlags.PUBLIC_STATIC, "Created", "System.Int32");
                })
                .build());
        ts.initialize();
        holder = ts.getType(zoo, "Zoo.Holder");
        int32 = ts.getType(zoo, "System.Int32");
        string = ts.getType(zoo, "System.String");
    }

    // ============ 唯一性 ============

    @Nested
    @DisplayName("实例化唯一性")
    class Identity {

        @Test
        @DisplayName("同一实参得到同一描述符")
        void testSameInstance() {
            TypeDescriptor first = ts.close(holder, int32);
            TypeDescriptor second = ts.close(holder, "System.Int32");

            assertSame(first, second);
            assertSame(first, holder.getPublicInterface().of(int32).getType());
            assertNotSame(first, ts.close(holder, string));
        }

        @Test
        @DisplayName("闭包类型记录开放类型与实参")
        void testClosedShape() {
            TypeDescriptor closed = ts.close(holder, int32);

            assertSame(holder, closed.getOpenType());
            assertTrue(closed.isClosed());
            assertFalse(closed.isGenericDefinition());
            assertEquals(Collections.singletonList(int32), closed.getGenericArguments());
            assertEquals("Zoo.Holder[System.Int32]", closed.getFullName());
            assertTrue(closed.isInitialized());
        }

        @Test
        @DisplayName("不初始化的闭包延后初始化")
        void testNoInitialize() {
            PublicInterface pi = holder.getPublicInterface().ofNoInitialize(string);

            assertFalse(pi.getType().isInitialized());
            assertSame(pi, holder.getPublicInterface().of(string));
            assertTrue(pi.getType().isInitialized());
        }

        @Test
        @DisplayName("以泛型参数闭包得到开放实例化")
        void testOpenInstantiation() {
            GenericParameter u = new GenericParameter("U", "Zoo.Elsewhere", zoo);
            TypeDescriptor partial = ts.close(holder, Arrays.asList(u), false);

            assertFalse(partial.isClosed());
            assertSame(holder, partial.getOpenType());
        }
    }

    // ============ 参数检查 ============

    @Nested
    @DisplayName("实参检查")
    class ArgumentChecks {

        @Test
        @DisplayName("实参个数不符")
        void testWrongArity() {
            InvalidGenericArgumentException e = assertThrows(InvalidGenericArgumentException.class,
                    () -> ts.close(holder, int32, string));
            assertThat(e).hasMessageContaining("Zoo.Holder").hasMessageContaining("(got 2, expected 1)");
        }

        @Test
        @DisplayName("null 实参")
        void testNullArgument() {
            InvalidGenericArgumentException e = assertThrows(InvalidGenericArgumentException.class,
                    () -> ts.close(holder, new Object[]{null}));
            assertThat(e).hasMessageContaining("generic argument #0");
        }

        @Test
        @DisplayName("实例化不能再次闭包")
        void testCloseTwice() {
            TypeDescriptor closed = ts.close(holder, int32);
            assertThrows(InvalidGenericArgumentException.class, () -> ts.close(closed, string));
        }

        @Test
        @DisplayName("开放类型不能构造实例")
        void testConstructOpen() {
            assertThrows(IlHostException.class, () -> ts.createInstance(holder));
        }
    }

    // ============ 成员 ============

    @Nested
    @DisplayName("闭包类型的成员")
    class Members {

        @Test
        @DisplayName("签名依赖泛型参数的方法按实参改名")
        void testRenamedMethods() {
            TypeDescriptor closed = ts.close(holder, int32);

            assertThat(closed.getRenamedMethods()).isNotEmpty();
            assertThat(holder.getRenamedMethods()).isEmpty();
        }

        @Test
        @DisplayName("字段默认值按实参类型取得")
        void testFieldDefaults() {
            IlObject ofInt = ts.createInstance(ts.close(holder, int32));
            IlObject ofString = ts.createInstance(ts.close(holder, string));

            assertEquals(0, ofInt.get("Item"));
            assertNull(ofString.get("Item"));
            assertEquals(0, ofInt.invoke("Peek"));
        }

        @Test
        @DisplayName("闭包类型共享开放类型的静态回落，但写入互不影响")
        void testStatics() {
            PublicInterface ofInt = holder.getPublicInterface().of(int32);
            PublicInterface ofString = holder.getPublicInterface().of(string);

            ofInt.set("Created", 3);

            assertEquals(3, ofInt.get("Created"));
            assertEquals(0, ofString.get("Created"));
        }
    }

    // ============ 泛型基类 ============

    @Nested
    @DisplayName("泛型基类")
    class GenericBase {

        private TypeDescriptor labeled;

        @BeforeEach
        void declareDerived() {
            ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Labeled")
                    .genericParameters("U")
                    .baseType(zoo.typeRef("Zoo.Holder", new GenericParameter("U", "Zoo.Labeled", zoo)))
                    .initializer($ -> $.field(MemberFlags.PUBLIC_INSTANCE, "Label", "System.String"))
                    .build());
            labeled = ts.getType(zoo, "Zoo.Labeled");
        }

        @Test
        @DisplayName("闭包派生类型的基类是以同一实参闭包的基类")
        void testClosedBase() {
            TypeDescriptor closed = ts.close(labeled, int32);

            assertSame(ts.close(holder, int32), closed.getBaseType());
            assertTrue(ts.isAssignable(closed, ts.close(holder, int32)));
            assertFalse(ts.isAssignable(closed, ts.close(holder, string)));
            assertEquals(closed.getBaseType().getInheritanceDepth() + 1, closed.getInheritanceDepth());
        }

        @Test
        @DisplayName("开放派生类型的基类是开放实例化")
        void testOpenBase() {
            TypeDescriptor base = labeled.getBaseType();

            assertSame(holder, base.getOpenType());
            assertFalse(base.isClosed());
        }
    }
}
