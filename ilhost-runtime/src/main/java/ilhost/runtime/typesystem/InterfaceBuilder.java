package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.FieldRecord;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.InterfaceMember;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberDescriptor;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.Names;
import ilhost.runtime.types.PositionalGenericParameter;
import ilhost.runtime.types.PropertyAccessor;
import ilhost.runtime.types.PropertyRecord;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * 类型成员构建器，传给声明中的初始化器。
 *
 * <p>类型引用参数可以是类型名、{@link TypeReference}、{@link PublicInterface} 或 {@link TypeHandle}；
 * 类型名 {@code "!T"} 表示本类型的泛型参数 T，{@code "!!0"} 表示方法的第 0 个泛型参数。</p>
 *
 * <pre>
 * $ -&gt; {
 *     $.field(MemberFlags.PUBLIC_INSTANCE, "Name", "System.String");
 *     $.method(MemberFlags.PUBLIC_INSTANCE, "ToString", $.signature("System.String"), body);
 * }
 * </pre>
 */
public final class InterfaceBuilder {

    private static final Logger LOG = Logger.getLogger(InterfaceBuilder.class.getName());

    private final TypeSystem system;
    private final PublicInterface publicInterface;
    private final TypeDescriptor type;

    InterfaceBuilder(TypeSystem system, PublicInterface publicInterface) {
        this.system = system;
        this.publicInterface = publicInterface;
        this.type = publicInterface.getType();
    }

    public TypeDescriptor getType() {
        return type;
    }

    public PublicInterface getPublicInterface() {
        return publicInterface;
    }

    public LoadUnit getLoadUnit() {
        return type.getContext();
    }

    // ============ 引用与签名 ============

    public TypeRef typeRef(String name, Object... genericArguments) {
        TypeReference[] args = new TypeReference[genericArguments.length];
        for (int i = 0; i < args.length; i++) {
            args[i] = reference(genericArguments[i]);
        }
        return getLoadUnit().typeRef(name, args);
    }

    /** 本类型声明的泛型参数 */
    public GenericParameter genericParameter(String name) {
        for (GenericParameter gp : type.getGenericParameters()) {
            if (gp.getName().equals(name)) return gp;
        }
        throw new RegistrationException("Type '" + type.getFullName() + "' has no generic parameter named '"
                + name + "'");
    }

    public PositionalGenericParameter positional(int index) {
        return new PositionalGenericParameter(index);
    }

    public MethodSignature signature(Object returnType, Object... argumentTypes) {
        return system.signature(getLoadUnit(), type.getFullName(), null, returnType, argumentTypes);
    }

    public MethodSignature genericSignature(List<String> genericParameterNames, Object returnType,
                                            Object... argumentTypes) {
        return system.signature(getLoadUnit(), type.getFullName(), genericParameterNames, returnType, argumentTypes);
    }

    public TypeReference reference(Object reference) {
        return system.reference(getLoadUnit(), type.getFullName(), reference);
    }

    // ============ 方法 ============

    public MethodRecord method(MemberFlags flags, String name, MethodSignature signature, Invokable body) {
        if (type.isInterface()) {
            throw report(new RegistrationException("Interface '" + type.getFullName()
                    + "' cannot declare method bodies; use interfaceMethod for '" + name + "'"));
        }
        if (body == null) {
            throw report(new RegistrationException("Method body of '" + name + "' on '" + type.getFullName()
                    + "' must not be null"));
        }
        MethodRecord record = new MethodRecord(new MemberDescriptor(name, flags), type, signature, false);
        type.addMember(record);
        table(flags.isStatic()).define(record.getMangledName(), body);
        return record;
    }

    public MethodRecord constructor(MemberFlags flags, MethodSignature signature, Invokable body) {
        return method(flags, ".ctor", signature, body);
    }

    /** 公开实例构造器 */
    public MethodRecord constructor(MethodSignature signature, Invokable body) {
        return constructor(MemberFlags.PUBLIC_INSTANCE, signature, body);
    }

    /**
     * 外部方法：实现来自外部实现表；没有时安装占位，
     * 基类已有同一修饰名时占位回退到继承的实现。
     */
    public MethodRecord externalMethod(MemberFlags flags, String name, MethodSignature signature) {
        MethodRecord record = new MethodRecord(new MemberDescriptor(name, flags), type, signature, true);
        type.addMember(record);
        String key = record.getMangledName();
        MemberTable target = table(flags.isStatic());

        Invokable implementation = system.externals().find(type.getFullName(), flags.isStatic(), key);
        if (implementation != null) {
            target.define(key, implementation);
            return record;
        }
        if (target.hasOwn(key)) {
            Object own = target.getOwn(key);
            record.setPlaceholder(own instanceof Invokable && ((Invokable) own).isPlaceholder());
            return record;
        }
        Object inherited = target.getParent() == null ? null : target.getParent().lookup(key);
        target.define(key, new ExternalMemberStub(type.getFullName(), signature.describe(name),
                inherited instanceof Invokable ? (Invokable) inherited : null, system.host()));
        record.setPlaceholder(true);
        return record;
    }

    /** 原始方法：不进入方法组，按名称直接安装 */
    public void rawMethod(boolean isStatic, String name, Invokable body) {
        String key = Names.escape(name);
        Invokable implementation = system.externals().find(type.getFullName(), isStatic, key);
        table(isStatic).define(key, implementation != null ? implementation : body);
        if (isStatic && !type.getRawStaticMethods().contains(key)) {
            type.getRawStaticMethods().add(key);
        }
        if (isStatic && "CheckType".equals(name)) {
            final Invokable check = implementation != null ? implementation : body;
            final PublicInterface self = publicInterface;
            type.setCustomTypeCheck(value -> Boolean.TRUE.equals(check.invoke(self, new Object[]{value})));
        }
    }

    /** 把基类模板上的实现复制到本类型，未找到时警告 */
    public void inheritBaseMethod(String name, MethodSignature signature) {
        String key = signature == null ? Names.escape(name) : signature.key(Names.escape(name));
        MemberTable parent = publicInterface.getTemplate().getParent();
        Object inherited = parent == null ? null : parent.lookup(key);
        if (inherited == null) {
            String message = "Type '" + type.getFullName() + "' has no base method '" + name + "' to inherit";
            LOG.warning(message);
            system.host().warning(message);
            return;
        }
        publicInterface.getTemplate().define(key, inherited);
        if (signature != null) {
            type.addMember(new MethodRecord(new MemberDescriptor(name, MemberFlags.PUBLIC_INSTANCE),
                    type, signature, false));
        }
    }

    public void inheritBaseMethod(String name) {
        inheritBaseMethod(name, null);
    }

    /** 无参构造器：转发到基类的构造方法组，基类没有时什么也不做 */
    public MethodRecord inheritDefaultConstructor() {
        final MemberTable parent = publicInterface.getTemplate().getParent();
        return constructor(signature(null), (self, args) -> {
            Object baseCtor = parent == null ? null : parent.lookup("_ctor");
            return baseCtor instanceof Invokable ? ((Invokable) baseCtor).invoke(self, args) : null;
        });
    }

    // ============ 字段、常量、属性 ============

    public FieldRecord field(MemberFlags flags, String name, Object fieldType) {
        return addField(flags, name, fieldType, null, false);
    }

    /** 带常量默认值的字段 */
    public FieldRecord field(MemberFlags flags, String name, Object fieldType, final Object defaultValue) {
        return addField(flags, name, fieldType, pi -> defaultValue, false);
    }

    /** 默认值在类型初始化时求值 */
    public FieldRecord field(MemberFlags flags, String name, Object fieldType,
                             Function<PublicInterface, Object> defaultValue) {
        return addField(flags, name, fieldType, defaultValue, false);
    }

    /** 常量总是静态的，立即可读 */
    public FieldRecord constant(boolean isPublic, String name, Object fieldType, final Object value) {
        FieldRecord record = addField(MemberFlags.of(true, isPublic), name, fieldType, pi -> value, true);
        publicInterface.getStatics().define(Names.escape(name), value);
        return record;
    }

    private FieldRecord addField(MemberFlags flags, String name, Object fieldType,
                                 Function<PublicInterface, Object> defaultValue, boolean constant) {
        FieldRecord record = new FieldRecord(new MemberDescriptor(name, flags), type, reference(fieldType),
                defaultValue, constant);
        type.addMember(record);
        return record;
    }

    /**
     * 属性：安装转发到 get_/set_ 访问器的槽。
     * 名称可以是接口限定的显式实现，如 {@code "IFoo.Bar"}。
     */
    public PropertyRecord property(MemberFlags flags, String name, Object propertyType) {
        PropertyRecord record = new PropertyRecord(new MemberDescriptor(name, flags), type, reference(propertyType));
        type.addMember(record);
        table(flags.isStatic()).define(Names.escape(name),
                new PropertyAccessor(name, record.getterName(), record.setterName()));
        return record;
    }

    // ============ 接口 ============

    public InterfaceMember interfaceMethod(String name, MethodSignature signature) {
        return addInterfaceMember(new InterfaceMember(name, MemberKind.METHOD, signature));
    }

    public InterfaceMember interfaceProperty(String name) {
        return addInterfaceMember(new InterfaceMember(name, MemberKind.PROPERTY, null));
    }

    private InterfaceMember addInterfaceMember(InterfaceMember member) {
        if (!type.isInterface()) {
            throw report(new RegistrationException("Type '" + type.getFullName()
                    + "' is not an interface and cannot declare interface member '" + member.getName() + "'"));
        }
        type.getInterfaceMembers().put(member.getName(), member);
        return member;
    }

    public void implementInterfaces(Object... interfaces) {
        for (Object iface : interfaces) {
            type.addInterface(reference(iface));
        }
    }

    // ============ 其他 ============

    /** 按名称声明一组原生成员，外部实现表里没有的安装为占位 */
    public void externalMembers(boolean isInstance, String... names) {
        MemberTable target = table(!isInstance);
        for (String name : names) {
            String key = Names.escape(name);
            Invokable implementation = system.externals().find(type.getFullName(), !isInstance, key);
            if (implementation != null) {
                target.define(key, implementation);
            } else if (!target.hasOwn(key)) {
                Object inherited = target.getParent() == null ? null : target.getParent().lookup(key);
                target.define(key, new ExternalMemberStub(type.getFullName(), name,
                        inherited instanceof Invokable ? (Invokable) inherited : null, system.host()));
            }
        }
    }

    public void customTypeCheck(Predicate<Object> check) {
        type.setCustomTypeCheck(check);
    }

    /** 直接写入静态成员 */
    public void setValue(String name, Object value) {
        publicInterface.getStatics().define(Names.escape(name), value);
    }

    /** 在类型初始化时执行 */
    public void addInitializer(Consumer<PublicInterface> initializer) {
        type.getInitializers().add(initializer);
    }

    public List<GenericParameter> genericParameters() {
        return Collections.unmodifiableList(type.getGenericParameters());
    }

    private MemberTable table(boolean isStatic) {
        return isStatic ? publicInterface.getStatics() : publicInterface.getTemplate();
    }

    private RegistrationException report(RegistrationException e) {
        system.host().error(e);
        return e;
    }
}
