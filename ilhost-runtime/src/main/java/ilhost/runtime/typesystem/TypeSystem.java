package ilhost.runtime.typesystem;

import ilhost.runtime.Host;
import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;
import ilhost.runtime.LoggingHost;
import ilhost.runtime.NameResolutionException;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.RuntimeOptions;
import ilhost.runtime.types.DelegateInstance;
import ilhost.runtime.types.EnumValue;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.PositionalGenericParameter;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;
import ilhost.runtime.types.TypeRuntime;
import ilhost.runtime.typesystem.cache.CacheStats;
import ilhost.runtime.typesystem.cache.ResolvedSignatureCache;
import ilhost.runtime.typesystem.reflect.ReflectionCache;
import ilhost.runtime.typesystem.reflect.TypeInfo;
import ilhost.runtime.typesystem.reflect.TypeNameParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * 类型系统：一个独立的类型世界（注册表、标识、闭包缓存、初始化状态）。
 *
 * <p>使用示例：</p>
 * <pre>
 * TypeSystem ts = new TypeSystem();
 * LoadUnit core = ts.coreUnit();
 * ts.makeClass(core, "System.Object", null, $ -&gt; {
 *     $.method(MemberFlags.PUBLIC_INSTANCE, "ToString", $.signature("System.String"),
 *             (self, args) -&gt; "object");
 * });
 * ts.initialize();
 * IlObject obj = ts.resolve(core, "System.Object").get().construct();
 * </pre>
 *
 * <p>构造、闭包与初始化都在同一把可重入锁下进行；同一线程在构造期间再次访问同一类型即递归构造。</p>
 */
public final class TypeSystem implements TypeRuntime {

    private static final Logger LOG = Logger.getLogger(TypeSystem.class.getName());

    private final RuntimeOptions options;
    private final Host host;
    private final ReentrantLock lock = new ReentrantLock();

    private final IdentityTable identities = new IdentityTable();
    private final NameRegistry registry;
    private final ExternalsRegistry externals;
    private final TypeFactory factory;
    private final GenericClosure closure;
    private final MethodGroupBuilder methodGroups;
    private final Assignability assignability;
    private final InterfaceFixup interfaceFixup;
    private final TypeInitializer initializer;
    private final TypeChecks checks;
    private final Instances instances;
    private final ReflectionCache reflection;

    private final ConcurrentMap<String, LoadUnit> loadUnits = new ConcurrentHashMap<>();
    private final LoadUnit coreUnit;

    public TypeSystem() {
        this(RuntimeOptions.defaults());
    }

    public TypeSystem(RuntimeOptions options) {
        this(options, new LoggingHost());
    }

    public TypeSystem(RuntimeOptions options, Host host) {
        this.options = options;
        this.host = host;
        this.coreUnit = new LoadUnit(options.getCoreLoadUnitName(), identities.nextLoadUnitPrefix(), this);
        this.loadUnits.put(coreUnit.getName(), coreUnit);
        this.registry = new NameRegistry(this);
        this.externals = new ExternalsRegistry(this);
        this.factory = new TypeFactory(this, identities);
        this.closure = new GenericClosure(this, new ResolvedSignatureCache(options.getSignatureCacheSize()));
        this.methodGroups = new MethodGroupBuilder(this);
        this.assignability = new Assignability(this);
        this.interfaceFixup = new InterfaceFixup(this);
        this.initializer = new TypeInitializer(this);
        this.checks = new TypeChecks(this);
        this.instances = new Instances(this);
        this.reflection = new ReflectionCache(this);
    }

    // ============ 加载单元 ============

    public LoadUnit coreUnit() {
        return coreUnit;
    }

    /**
     * 声明（或取得已声明的）加载单元。核心库别名与核心单元共享标识前缀。
     */
    public LoadUnit declareLoadUnit(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new RegistrationException("Load unit name must not be empty");
        }
        if (name.equals(coreUnit.getName())) return coreUnit;
        return loadUnits.computeIfAbsent(name, n -> {
            LoadUnit unnamed = new LoadUnit(n, "", this);
            String prefix = options.isCoreAlias(unnamed.getShortName())
                    ? coreUnit.getIdPrefix()
                    : identities.nextLoadUnitPrefix();
            LOG.fine("Declared load unit " + n + " (prefix " + prefix + ")");
            return new LoadUnit(n, prefix, this);
        });
    }

    /** 按全名或短名查找已声明的加载单元 */
    public LoadUnit getLoadUnit(String name) {
        LoadUnit unit = loadUnits.get(name);
        if (unit != null) return unit;
        String shortName = new LoadUnit(name, "", this).getShortName();
        for (LoadUnit candidate : loadUnits.values()) {
            if (candidate.getShortName().equals(shortName)) return candidate;
        }
        throw new NameResolutionException("The load unit '" + name + "' has not been declared.");
    }

    public List<LoadUnit> getLoadUnits() {
        return Collections.unmodifiableList(new ArrayList<>(loadUnits.values()));
    }

    // ============ 声明 ============

    /** 底层注册：创建器与初始化器各在首次访问时恰好运行一次 */
    public TypeHandle registerName(LoadUnit unit, String fullName, boolean isPublic,
                                   Supplier<PublicInterface> creator, Consumer<PublicInterface> initializer) {
        return registry.register(unit, fullName, isPublic, creator, initializer);
    }

    public TypeHandle declare(final LoadUnit unit, final TypeDeclaration declaration) {
        return registry.register(unit, declaration.getFullName(), declaration.isPublic(),
                () -> factory.create(unit, declaration),
                pi -> factory.populate(pi, declaration));
    }

    public TypeHandle makeClass(LoadUnit unit, String fullName, String baseType, Consumer<InterfaceBuilder> initializer) {
        TypeDeclaration.Builder builder = TypeDeclaration.builder(TypeKind.CLASS, fullName).initializer(initializer);
        if (baseType != null) builder.baseType(baseType);
        return declare(unit, builder.build());
    }

    public TypeHandle makeStruct(LoadUnit unit, String fullName, Consumer<InterfaceBuilder> initializer) {
        return declare(unit, TypeDeclaration.builder(TypeKind.STRUCT, fullName).initializer(initializer).build());
    }

    public TypeHandle makeInterface(LoadUnit unit, String fullName, Consumer<InterfaceBuilder> initializer) {
        return declare(unit, TypeDeclaration.builder(TypeKind.INTERFACE, fullName).initializer(initializer).build());
    }

    public TypeHandle makeStaticClass(LoadUnit unit, String fullName, Consumer<InterfaceBuilder> initializer) {
        return declare(unit, TypeDeclaration.builder(TypeKind.STATIC_CLASS, fullName).initializer(initializer).build());
    }

    public TypeHandle makeEnum(LoadUnit unit, String fullName, boolean flags, Map<String, Long> members) {
        return declare(unit, TypeDeclaration.builder(TypeKind.ENUM, fullName)
                .flagsEnum(flags).enumMembers(members).build());
    }

    public TypeHandle makeDelegate(LoadUnit unit, String fullName) {
        return declare(unit, TypeDeclaration.builder(TypeKind.DELEGATE, fullName).build());
    }

    /** 为类型排队原生实现；类型已初始化时报错 */
    public void implementExternals(LoadUnit unit, String typeName, Consumer<ExternalsBuilder> builder) {
        externals.queue(unit, typeName, builder);
    }

    /** 声明稍后才提供实现的外部类型 */
    public TypeHandle declareExternalType(LoadUnit unit, String fullName, boolean isPublic) {
        return registry.registerExternal(unit, fullName, isPublic);
    }

    public void supplyExternalType(final LoadUnit unit, final TypeDeclaration declaration) {
        TypeBinding binding = registry.findOwn(unit, declaration.getFullName());
        if (binding == null || !binding.isExternalPending()) {
            throw new RegistrationException("Type '" + declaration.getFullName()
                    + "' was not declared as an external type in " + unit.getName());
        }
        binding.supply(() -> {
            PublicInterface pi = factory.create(unit, declaration);
            factory.populate(pi, declaration);
            return pi;
        });
    }

    // ============ 生命周期 ============

    /** 封存注册表：此后首次访问类型时在构造之外还会初始化 */
    public void initialize() {
        registry.seal();
        LOG.fine("Type system sealed");
    }

    public boolean isSealed() {
        return registry.isSealed();
    }

    // ============ 解析 ============

    /** 沿命名空间树解析，私有树未命中时查全局命名空间 */
    public TypeHandle resolve(LoadUnit unit, String name) {
        return registry.resolve(unit, name);
    }

    public List<TypeHandle> typesOf(LoadUnit unit) {
        return registry.typesOf(unit);
    }

    @Override
    public TypeDescriptor resolveTypeName(LoadUnit context, String typeName, boolean initialize) {
        TypeHandle handle = registry.find(context, typeName);
        if (handle == null) {
            handle = registry.resolve(context, typeName);
        }
        return handle.get(initialize).getType();
    }

    /** 解析并初始化 */
    public TypeDescriptor getType(LoadUnit unit, String typeName) {
        return resolveTypeName(unit, typeName, true);
    }

    /** 形如 {@code Ns.Name`1[[Arg, Unit]], Unit} 的程序集限定名，没有单元时在核心单元中解析 */
    public TypeDescriptor getTypeByName(String qualifiedName) {
        return TypeNameParser.parse(qualifiedName).resolve(this);
    }

    // ============ 标识 ============

    /** 引用方的标识：名称先解析到声明它的加载单元 */
    @Override
    public String assignTypeId(LoadUnit unit, String typeName) {
        return identities.assignTypeId(registry.declaringUnit(unit, typeName), typeName);
    }

    @Override
    public String genericParameterId(String qualifiedKey) {
        return identities.genericParameterId(qualifiedKey);
    }

    // ============ 闭包 ============

    @Override
    public TypeDescriptor close(TypeDescriptor openType, List<?> arguments, boolean initialize) {
        return closure.close(openType, arguments, initialize);
    }

    /** 闭包并初始化 */
    public TypeDescriptor close(Object openType, Object... arguments) {
        return closure.close(toType(openType), Arrays.asList(arguments), true);
    }

    public TypeDescriptor arrayOf(Object elementType) {
        return factory.arrayOf(toType(elementType));
    }

    public TypeDescriptor anyType() {
        return factory.anyType();
    }

    // ============ 初始化 ============

    @Override
    public void initialize(TypeDescriptor type) {
        initializer.initialize(type);
    }

    // ============ 运行时操作 ============

    public boolean isAssignable(TypeDescriptor from, TypeDescriptor to) {
        return assignability.isAssignable(from, to);
    }

    @Override
    public boolean checkType(Object value, TypeDescriptor expected) {
        return checks.checkType(value, expected);
    }

    /** 值的运行时类型 */
    public TypeDescriptor typeOf(Object value) {
        return checks.typeOf(value);
    }

    public Object cast(Object value, TypeDescriptor target) {
        return checks.cast(value, target);
    }

    public Object tryCast(Object value, TypeDescriptor target) {
        return checks.tryCast(value, target);
    }

    public Object defaultValue(TypeDescriptor type) {
        return checks.defaultValue(type);
    }

    @Override
    public IlObject construct(TypeDescriptor type, Object[] arguments) {
        return instances.construct(type, arguments);
    }

    public IlObject createInstance(TypeDescriptor type, Object... arguments) {
        return instances.construct(type, arguments);
    }

    public DelegateInstance newDelegate(TypeDescriptor delegateType, Object target, Invokable method) {
        if (!delegateType.isDelegate()) {
            throw new IlHostException("Type '" + delegateType.getFullName() + "' is not a delegate type");
        }
        return TypeFactory.newDelegate(delegateType, target, method);
    }

    public EnumValue enumFlags(TypeDescriptor enumType, String... names) {
        return TypeChecks.flags(enumType, names);
    }

    public boolean structEquals(Object a, Object b) {
        return instances.structEquals(a, b);
    }

    // ============ 反射 ============

    public TypeInfo reflect(TypeDescriptor type) {
        return reflection.typeInfo(type);
    }

    /** 方法记录在 context 泛型绑定下的签名 */
    public ResolvedMethod resolveMethod(TypeDescriptor context, MethodRecord record) {
        return new ResolvedMethod(record, context, closure.resolveSignature(context, record.getSignature()));
    }

    /** 在 context 泛型绑定下解析引用（只构造不初始化），无法确定时为 null */
    public TypeDescriptor resolveType(TypeReference reference, TypeDescriptor context) {
        return closure.resolveDescriptor(reference, context);
    }

    // ============ 引用 ============

    /**
     * 转成类型描述符：描述符、公共接口、句柄、前向引用或类型名（核心单元中解析）
     */
    public TypeDescriptor toType(Object type) {
        if (type instanceof TypeDescriptor) return (TypeDescriptor) type;
        if (type instanceof PublicInterface) return ((PublicInterface) type).getType();
        if (type instanceof TypeHandle) return ((TypeHandle) type).get(false).getType();
        if (type instanceof TypeRef) return ((TypeRef) type).resolve(false);
        if (type instanceof String) return resolveTypeName(coreUnit, (String) type, false);
        throw new IlHostException("Value is not a type: " + type);
    }

    /**
     * 成员声明中的类型引用。类型名 {@code "!T"} 是 owner 的泛型参数，{@code "!!N"} 是方法的第 N 个泛型参数。
     */
    TypeReference reference(LoadUnit unit, String owner, Object reference) {
        if (reference == null) return null;
        if (reference instanceof TypeReference) return (TypeReference) reference;
        if (reference instanceof PublicInterface) return ((PublicInterface) reference).getType();
        if (reference instanceof TypeHandle) {
            TypeHandle handle = (TypeHandle) reference;
            LoadUnit context = handle.getLoadUnit() != null ? handle.getLoadUnit() : unit;
            return new TypeRef(context, handle.getName(), Collections.<TypeReference>emptyList());
        }
        if (reference instanceof String) {
            String name = (String) reference;
            if (name.startsWith("!!")) {
                try {
                    return new PositionalGenericParameter(Integer.parseInt(name.substring(2)));
                } catch (NumberFormatException e) {
                    throw new RegistrationException("Invalid positional generic parameter '" + name + "'", e);
                }
            }
            if (name.startsWith("!") && owner != null) {
                return new GenericParameter(name.substring(1), owner, unit);
            }
            return new TypeRef(unit, name, Collections.<TypeReference>emptyList());
        }
        throw new RegistrationException("Not a type reference: " + reference);
    }

    MethodSignature signature(LoadUnit unit, String owner, List<String> genericParameterNames,
                              Object returnType, Object... argumentTypes) {
        List<TypeReference> arguments = new ArrayList<>(argumentTypes.length);
        for (Object argument : argumentTypes) {
            TypeReference resolved = reference(unit, owner, argument);
            if (resolved == null) {
                throw new RegistrationException("Argument types of a signature must not be null");
            }
            arguments.add(resolved);
        }
        return new MethodSignature(reference(unit, owner, returnType), arguments, genericParameterNames);
    }

    /** 按名称查找并构造可选类型，不存在、歧义或正在构造时返回 null */
    TypeDescriptor findType(LoadUnit unit, String name) {
        TypeHandle handle = registry.find(unit, name);
        if (handle == null && unit != coreUnit) {
            handle = registry.find(coreUnit, name);
        }
        if (handle == null || handle instanceof AmbiguousTypeHandle) return null;
        BindingState state = handle.getState();
        if (state == BindingState.CONSTRUCTING || state == BindingState.FAILED) return null;
        if (handle instanceof TypeBinding && ((TypeBinding) handle).isExternalPending()) return null;
        return handle.get(false).getType();
    }

    TypeDescriptor findCoreType(String name) {
        return findType(coreUnit, name);
    }

    // ============ 配置与内部组件 ============

    public RuntimeOptions options() {
        return options;
    }

    @Override
    public Host host() {
        return host;
    }

    public CacheStats getSignatureCacheStats() {
        return closure.getSignatureCache().getStats();
    }

    ReentrantLock lock() {
        return lock;
    }

    NameRegistry registry() { return registry; }
    ExternalsRegistry externals() { return externals; }
    TypeFactory factory() { return factory; }
    GenericClosure closure() { return closure; }
    MethodGroupBuilder methodGroups() { return methodGroups; }
    Assignability assignability() { return assignability; }
    InterfaceFixup interfaceFixup() { return interfaceFixup; }
    TypeChecks checks() { return checks; }
    Instances instances() { return instances; }
}
