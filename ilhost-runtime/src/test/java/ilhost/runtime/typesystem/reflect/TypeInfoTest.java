package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.AmbiguousMatchException;
import ilhost.runtime.IlHostException;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.typesystem.CoreLibrary;
import ilhost.runtime.typesystem.RecordingHost;
import ilhost.runtime.typesystem.TypeDeclaration;
import ilhost.runtime.typesystem.TypeSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 反射视图测试
 */
class TypeInfoTest {

    private TypeSystem ts;
    private TypeDescriptor animal;
    private TypeDescriptor dog;
    private TypeDescriptor string;

    @BeforeEach
    void setUp() {
        ts = CoreLibrary.newSystem(new RecordingHost());
        LoadUnit zoo = ts.declareLoadUnit("Zoo");
        ts.makeClass(zoo, "Zoo.Animal", null, $ -> {
            $.field(MemberFlags.PUBLIC_INSTANCE, "Name", "System.String");
            $.field(MemberFlags.of(false, false), "secret", "System.Int32");
            $.field(MemberFlags.of(true, true), "Count", "System.Int32");
            $.constant(true, "MaxAge", "System.Int32", 30);
            $.constructor($.signature(null), (self, args) -> null);
            $.method(MemberFlags.PUBLIC_INSTANCE, "Speak", $.signature("System.String"),
                    (self, args) -> "...");
            $.method(MemberFlags.PUBLIC_INSTANCE, "Speak", $.signature("System.String", "System.String"),
                    (self, args) -> "...:" + args[0]);
            $.method(MemberFlags.of(true, true), "Create", $.signature("Zoo.Animal"),
                    (self, args) -> "created");
            $.method(MemberFlags.PUBLIC_INSTANCE, "get_Label", $.signature("System.String"),
                    (self, args) -> "animal");
            $.property(MemberFlags.PUBLIC_INSTANCE, "Label", "System.String");
        });
        ts.makeClass(zoo, "Zoo.Dog", "Zoo.Animal", $ -> {
            $.constructor($.signature(null, "System.String"), (self, args) -> {
                ((IlObject) self).set("Name", args[0]);
                return null;
            });
            $.method(MemberFlags.PUBLIC_INSTANCE, "Speak", $.signature("System.String"),
                    (self, args) -> "Woof");
        });
        ts.declare(zoo, TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Box")
                .genericParameters("T")
                .initializer($ -> $.field(MemberFlags.PUBLIC_INSTANCE, "Value", "!T"))
                .build());
        ts.initialize();
        animal = ts.getType(zoo, "Zoo.Animal");
        dog = ts.getType(zoo, "Zoo.Dog");
        string = ts.getType(ts.coreUnit(), "System.String");
    }

    private static List<String> names(List<? extends MemberInfo> members) {
        List<String> result = new ArrayList<>();
        for (MemberInfo member : members) {
            result.add(member.getName());
        }
        return result;
    }

    // ============ 类型 ============

    @Nested
    @DisplayName("类型信息")
    class TypeShape {

        @Test
        @DisplayName("名称与程序集限定名")
        void testNames() {
            TypeInfo info = ts.reflect(dog);
            assertEquals("Dog", info.getName());
            assertEquals("Zoo.Dog", info.getFullName());
            assertEquals("Zoo.Dog, Zoo", info.getAssemblyQualifiedName());
            assertEquals("Zoo.Animal", info.getBaseType().getFullName());
            assertTrue(info.isClass());
            assertFalse(info.isValueType());
        }

        @Test
        @DisplayName("同一描述符返回同一视图")
        void testCached() {
            assertSame(ts.reflect(dog), ts.reflect(dog));
            assertSame(ts.reflect(animal), ts.reflect(dog).getBaseType());
        }

        @Test
        @DisplayName("可赋值性与实例检查")
        void testAssignability() {
            TypeInfo animalInfo = ts.reflect(animal);
            TypeInfo dogInfo = ts.reflect(dog);
            assertTrue(animalInfo.isAssignableFrom(dogInfo));
            assertFalse(dogInfo.isAssignableFrom(animalInfo));
            assertFalse(animalInfo.isAssignableFrom(null));

            IlObject rex = ts.createInstance(dog, "Rex");
            assertTrue(animalInfo.isInstanceOfType(rex));
            assertFalse(dogInfo.isInstanceOfType("Rex"));
        }

        @Test
        @DisplayName("泛型定义与闭包")
        void testGenerics() {
            TypeInfo box = ts.reflect(ts.getType(ts.getLoadUnit("Zoo"), "Zoo.Box"));
            assertTrue(box.isGenericTypeDefinition());
            assertTrue(box.isGenericType());
            assertSame(box, box.getGenericTypeDefinition());

            TypeInfo closed = box.makeGenericType(ts.getType(ts.coreUnit(), "System.Int32"));
            assertEquals("Zoo.Box[System.Int32]", closed.getFullName());
            assertFalse(closed.isGenericTypeDefinition());
            assertSame(box, closed.getGenericTypeDefinition());
            assertSame(closed, box.makeGenericType(ts.getType(ts.coreUnit(), "System.Int32")));
        }

        @Test
        @DisplayName("数组类型")
        void testArrays() {
            TypeInfo dogs = ts.reflect(dog).makeArrayType();
            assertTrue(dogs.isArray());
            assertEquals("Zoo.Dog[]", dogs.getFullName());
            assertSame(dog, dogs.getElementType().getType());
            assertNull(ts.reflect(dog).getElementType());
        }
    }

    // ============ 成员 ============

    @Nested
    @DisplayName("成员查询")
    class Members {

        @Test
        @DisplayName("派生成员在前，继承的静态成员和构造器不出现")
        void testMethods() {
            List<MethodInfo> methods = ts.reflect(dog).getMethods();
            List<String> methodNames = names(methods);

            assertEquals("Speak", methods.get(0).getName());
            assertSame(dog, methods.get(0).getDeclaringType());
            assertThat(methodNames).contains("Speak", "get_Label", "ToString")
                    .doesNotContain("Create", ".ctor");
            assertEquals(3, Collections.frequency(methodNames, "Speak"));
        }

        @Test
        @DisplayName("本类型的静态成员可见")
        void testOwnStatics() {
            assertThat(names(ts.reflect(animal).getMethods())).contains("Create");
            assertThat(names(ts.reflect(animal).getMethods(BindingFlag.of(BindingFlag.STATIC))))
                    .containsExactly("Create");
        }

        @Test
        @DisplayName("DECLARED_ONLY 只看本类型")
        void testDeclaredOnly() {
            List<MethodInfo> declared = ts.reflect(dog).getMethods(
                    BindingFlag.of(BindingFlag.DECLARED_ONLY, BindingFlag.PUBLIC, BindingFlag.INSTANCE));
            assertEquals(1, declared.size());
            assertEquals(MemberKind.METHOD, declared.get(0).getMemberKind());
        }

        @Test
        @DisplayName("按可见性过滤字段")
        void testFieldVisibility() {
            TypeInfo info = ts.reflect(animal);
            assertThat(names(info.getFields())).containsExactly("Name", "Count", "MaxAge");
            assertThat(names(info.getFields(BindingFlag.of(BindingFlag.NON_PUBLIC, BindingFlag.INSTANCE))))
                    .containsExactly("secret");
            assertNull(info.getField("secret"));
        }

        @Test
        @DisplayName("构造器只列出本类型自己的")
        void testConstructors() {
            List<ConstructorInfo> constructors = ts.reflect(dog).getConstructors();
            assertEquals(1, constructors.size());
            assertEquals(1, constructors.get(0).getParameters().size());

            IlObject rex = constructors.get(0).newInstance("Rex");
            assertSame(dog, rex.getType());
            assertEquals("Rex", rex.get("Name"));
        }

        @Test
        @DisplayName("参数与返回类型按声明类型解析")
        void testSignatureTypes() {
            MethodInfo speak = ts.reflect(animal).getMethod("Speak", Collections.singletonList(string));
            assertNotNull(speak);
            assertSame(animal, speak.getDeclaringType());
            assertSame(string, speak.getReturnType());
            assertEquals(0, speak.getParameters().get(0).getPosition());
            assertFalse(speak.isGenericMethod());
            assertFalse(speak.isPlaceholder());
        }
    }

    // ============ 方法查找 ============

    @Nested
    @DisplayName("方法查找")
    class MethodLookup {

        @Test
        @DisplayName("同签名的基类方法被隐藏，剩下多个重载时报歧义")
        void testAmbiguous() {
            AmbiguousMatchException ex = assertThrows(AmbiguousMatchException.class,
                    () -> ts.reflect(dog).getMethod("Speak"));
            assertEquals("Multiple methods named 'Speak' were found.", ex.getMessage());
        }

        @Test
        @DisplayName("唯一名称直接返回，缺失返回 null")
        void testSingle() {
            assertNotNull(ts.reflect(dog).getMethod("get_Label"));
            assertNull(ts.reflect(dog).getMethod("Fly"));
        }

        @Test
        @DisplayName("按参数类型精确匹配，隐藏后取派生实现")
        void testByParameterTypes() {
            TypeInfo info = ts.reflect(dog);
            MethodInfo noArgs = info.getMethod("Speak", Collections.<TypeDescriptor>emptyList());
            MethodInfo withString = info.getMethod("Speak", Collections.singletonList(string));

            assertSame(dog, noArgs.getDeclaringType());
            assertSame(animal, withString.getDeclaringType());
            assertNull(info.getMethod("Speak", Arrays.asList(string, string)));
        }
    }

    // ============ 调用与读写 ============

    @Nested
    @DisplayName("调用与读写")
    class Invocation {

        @Test
        @DisplayName("实例方法按目标实例分派到重写")
        void testVirtualInvoke() {
            IlObject rex = ts.createInstance(dog, "Rex");
            MethodInfo baseSpeak = ts.reflect(animal).getMethod("Speak", Collections.<TypeDescriptor>emptyList());

            assertEquals("Woof", baseSpeak.invoke(rex));
            assertEquals("...", baseSpeak.invoke(ts.createInstance(animal)));
            assertEquals("...:hi", ts.reflect(animal)
                    .getMethod("Speak", Collections.singletonList(string)).invoke(rex, "hi"));
        }

        @Test
        @DisplayName("实例方法需要目标，静态方法不需要")
        void testStaticInvoke() {
            assertEquals("created", ts.reflect(animal).getMethod("Create").invoke(null));
            MethodInfo label = ts.reflect(animal).getMethod("get_Label");
            assertThrows(IlHostException.class, () -> label.invoke(null));
        }

        @Test
        @DisplayName("字段读写，常量只读")
        void testFields() {
            TypeInfo info = ts.reflect(animal);
            IlObject rex = ts.createInstance(dog, "Rex");

            FieldInfo name = info.getField("Name");
            assertSame(string, name.getFieldType());
            name.setValue(rex, "Max");
            assertEquals("Max", name.getValue(rex));

            FieldInfo count = info.getField("Count");
            assertEquals(0, count.getValue(null));
            count.setValue(null, 5);
            assertEquals(5, animal.getPublicInterface().get("Count"));

            FieldInfo maxAge = info.getField("MaxAge");
            assertTrue(maxAge.isLiteral());
            assertEquals(30, maxAge.getValue(null));
            IlHostException ex = assertThrows(IlHostException.class, () -> maxAge.setValue(null, 99));
            assertEquals("Cannot set the constant field 'MaxAge'", ex.getMessage());

            assertThrows(IlHostException.class, () -> name.getValue("not an object"));
        }

        @Test
        @DisplayName("属性经 get_ 访问器读取，继承的实例属性可见")
        void testProperties() {
            PropertyInfo label = ts.reflect(dog).getProperty("Label");
            assertNotNull(label);
            assertSame(animal, label.getDeclaringType());
            assertSame(string, label.getPropertyType());
            assertEquals("animal", label.getValue(ts.createInstance(dog, "Rex")));

            IlHostException ex = assertThrows(IlHostException.class,
                    () -> label.setValue(ts.createInstance(dog, "Rex"), "x"));
            assertEquals("Property 'Label' has no setter", ex.getMessage());
        }
    }
}
