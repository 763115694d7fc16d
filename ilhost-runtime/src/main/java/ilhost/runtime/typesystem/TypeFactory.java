package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.DelegateInstance;
import ilhost.runtime.types.EnumValue;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.Names;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * 各种类型的创建器：描述符、公共接口、基类链接、元类型。
 *
 * <p>根类型的初始化器执行完之前，以及反射类型链本身，元类型使用引导占位。</p>
 */
final class TypeFactory {

    private static final Logger LOG = Logger.getLogger(TypeFactory.class.getName());

    static final String RUNTIME_TYPE = "System.RuntimeType";
    static final String VALUE_TYPE = "System.ValueType";
    static final String ENUM = "System.Enum";
    static final String ARRAY = "System.Array";
    static final String DELEGATE = "System.Delegate";
    static final String MULTICAST_DELEGATE = "System.MulticastDelegate";

    private static final List<String> META_CHAIN = Arrays.asList(
            RUNTIME_TYPE, "System.Type", "System.Reflection.MemberInfo");

    private final TypeSystem system;
    private final IdentityTable identities;
    private final Set<String> bootstrapNames;
    private final ConcurrentMap<String, TypeDescriptor> arrays = new ConcurrentHashMap<>();
    private volatile TypeDescriptor bootstrapMetaType;
    private volatile TypeDescriptor anyType;
    private volatile boolean rootReady;

    TypeFactory(TypeSystem system, IdentityTable identities) {
        this.system = system;
        this.identities = identities;
        Set<String> names = new HashSet<>(META_CHAIN);
        names.add(system.options().getRootTypeName());
        this.bootstrapNames = Collections.unmodifiableSet(names);
    }

    // ============ 创建器 ============

    /** 声明的创建阶段：描述符、公共接口、基类与接口列表 */
    PublicInterface create(LoadUnit unit, TypeDeclaration decl) {
        switch (decl.getKind()) {
            case INTERFACE:
                return createInterface(unit, decl);
            case ENUM:
                return createEnum(unit, decl);
            case DELEGATE:
                return createDelegate(unit, decl);
            default:
                return createClass(unit, decl);
        }
    }

    /** 声明的初始化阶段：成员初始化器，然后写入外部实现 */
    void populate(PublicInterface publicInterface, TypeDeclaration decl) {
        Consumer<InterfaceBuilder> initializer = decl.getInitializer();
        if (initializer != null) {
            initializer.accept(new InterfaceBuilder(system, publicInterface));
        }
        TypeDescriptor type = publicInterface.getType();
        system.externals().typeCreated(type);
        if (type.getFullName().equals(system.options().getRootTypeName())) {
            rootReady = true;
            LOG.fine("Root type " + type.getFullName() + " is ready");
        }
    }

    private PublicInterface createClass(LoadUnit unit, TypeDeclaration decl) {
        TypeDescriptor type = newDescriptor(unit, decl);
        TypeDescriptor base = linkBase(type, unit, decl, defaultBaseName(decl));
        PublicInterface pi = new PublicInterface(type, null, base == null ? null : base.getPublicInterface().getTemplate());
        type.setPublicInterface(pi);
        addDeclaredInterfaces(type, unit, decl);
        LOG.fine("Created " + decl.getKind() + " " + type.getFullName() + " (id " + type.getTypeId() + ")");
        return pi;
    }

    private PublicInterface createInterface(LoadUnit unit, TypeDeclaration decl) {
        if (decl.getBaseType() != null) {
            throw new RegistrationException("Interface '" + decl.getFullName() + "' cannot have a base type");
        }
        TypeDescriptor type = newDescriptor(unit, decl);
        type.setInheritanceDepth(1);
        PublicInterface pi = new PublicInterface(type, null, null);
        type.setPublicInterface(pi);
        addDeclaredInterfaces(type, unit, decl);
        return pi;
    }

    private PublicInterface createEnum(LoadUnit unit, TypeDeclaration decl) {
        final TypeDescriptor type = newDescriptor(unit, decl);
        TypeDescriptor base = linkBase(type, unit, decl, ENUM);
        PublicInterface pi = new PublicInterface(type, null, base == null ? null : base.getPublicInterface().getTemplate());
        type.setPublicInterface(pi);
        type.setFlagsEnum(decl.isFlagsEnum());

        Set<String> assignable = new LinkedHashSet<>();
        assignable.add(type.getTypeId());
        assignable.add(identities.assignTypeId(unit, ENUM));
        type.setAssignableTypes(Collections.unmodifiableSet(assignable));
        type.setCustomTypeCheck(value -> value instanceof EnumValue && ((EnumValue) value).getType() == type);

        for (Map.Entry<String, Long> member : decl.getEnumMembers().entrySet()) {
            EnumValue value = new EnumValue(type, member.getValue(), member.getKey());
            type.addEnumValue(value);
            pi.getStatics().define(Names.escape(member.getKey()), value);
        }
        return pi;
    }

    private PublicInterface createDelegate(LoadUnit unit, TypeDeclaration decl) {
        final TypeDescriptor type = newDescriptor(unit, decl);
        String defaultBase = decl.getFullName().equals(MULTICAST_DELEGATE) ? DELEGATE : MULTICAST_DELEGATE;
        if (decl.getFullName().equals(DELEGATE)) defaultBase = system.options().getRootTypeName();
        TypeDescriptor base = linkBase(type, unit, decl, defaultBase);
        PublicInterface pi = new PublicInterface(type, null, base == null ? null : base.getPublicInterface().getTemplate());
        type.setPublicInterface(pi);
        addDeclaredInterfaces(type, unit, decl);
        type.setCustomTypeCheck(delegateCheck(type));

        pi.getStatics().define("New", (Invokable) (self, args) -> {
            TypeDescriptor target = self instanceof PublicInterface ? ((PublicInterface) self).getType() : type;
            return newDelegate(target, args.length > 0 ? args[0] : null, args.length > 1 ? args[1] : null);
        });
        type.getRawStaticMethods().add("New");
        return pi;
    }

    static Predicate<Object> delegateCheck(final TypeDescriptor type) {
        return value -> value instanceof DelegateInstance && ((DelegateInstance) value).getType() == type;
    }

    static DelegateInstance newDelegate(TypeDescriptor type, Object target, Object method) {
        if (!(method instanceof Invokable)) {
            throw new RegistrationException("Delegate of type '" + type.getFullName() + "' requires a callable method");
        }
        return new DelegateInstance(type, target, (Invokable) method);
    }

    // ============ 数组与任意类型 ============

    /** 按元素类型驻留的数组类型 */
    TypeDescriptor arrayOf(TypeDescriptor element) {
        TypeDescriptor existing = arrays.get(element.getTypeId());
        if (existing != null) return existing;

        LoadUnit core = system.coreUnit();
        String id = identities.assignTypeId(core, ARRAY) + "[" + element.getTypeId() + "]";
        TypeDescriptor type = new TypeDescriptor(TypeKind.ARRAY, element.getContext(), element.getFullName() + "[]",
                id, Collections.<String>emptyList());
        type.setElementType(element);
        type.setMetaType(bootstrapMetaType());

        TypeDescriptor base = findType(core, ARRAY);
        if (base == null) base = findType(core, system.options().getRootTypeName());
        if (base != null) {
            type.setBaseType(base);
            type.setBaseReference(base);
            type.setInheritanceDepth(base.getInheritanceDepth() + 1);
        } else {
            type.setInheritanceDepth(1);
        }
        type.setPublicInterface(new PublicInterface(type, null,
                base == null ? null : base.getPublicInterface().getTemplate()));
        type.setCustomTypeCheck(value -> value != null && (value.getClass().isArray() || value instanceof List));
        type.markInitialized();

        TypeDescriptor raced = arrays.putIfAbsent(element.getTypeId(), type);
        return raced != null ? raced : type;
    }

    /** 任何值都通过类型检查的伪类型 */
    TypeDescriptor anyType() {
        TypeDescriptor result = anyType;
        if (result == null) {
            synchronized (this) {
                result = anyType;
                if (result == null) {
                    result = new TypeDescriptor(TypeKind.ANY, system.coreUnit(), "<any>", "any",
                            Collections.<String>emptyList());
                    result.setInheritanceDepth(0);
                    result.setPublicInterface(new PublicInterface(result, null, null));
                    result.markInitialized();
                    anyType = result;
                }
            }
        }
        return result;
    }

    // ============ 元类型 ============

    /** 根类型就绪前使用的 RuntimeType 替身 */
    TypeDescriptor bootstrapMetaType() {
        TypeDescriptor result = bootstrapMetaType;
        if (result == null) {
            synchronized (this) {
                result = bootstrapMetaType;
                if (result == null) {
                    LoadUnit core = system.coreUnit();
                    result = new TypeDescriptor(TypeKind.CLASS, core, RUNTIME_TYPE,
                            identities.assignTypeId(core, RUNTIME_TYPE), Collections.<String>emptyList());
                    result.setInheritanceDepth(1);
                    result.setPublicInterface(new PublicInterface(result, null, null));
                    result.markInitialized();
                    bootstrapMetaType = result;
                }
            }
        }
        return result;
    }

    /** 真实的 RuntimeType，未声明或尚在构造时返回 null */
    TypeDescriptor realMetaType() {
        if (!rootReady) return null;
        return findType(system.coreUnit(), RUNTIME_TYPE);
    }

    private TypeDescriptor metaTypeFor(String typeName) {
        if (!rootReady || bootstrapNames.contains(typeName)) {
            return bootstrapMetaType();
        }
        TypeDescriptor real = realMetaType();
        return real != null ? real : bootstrapMetaType();
    }

    // ============ 内部 ============

    private TypeDescriptor newDescriptor(LoadUnit unit, TypeDeclaration decl) {
        String id = identities.assignTypeId(unit, decl.getFullName());
        TypeDescriptor type = new TypeDescriptor(decl.getKind(), unit, decl.getFullName(), id,
                decl.getGenericParameters());
        type.setMetaType(metaTypeFor(decl.getFullName()));
        return type;
    }

    private String defaultBaseName(TypeDeclaration decl) {
        String root = system.options().getRootTypeName();
        if (decl.getFullName().equals(root)) return null;
        if (decl.getKind() == TypeKind.STRUCT && !decl.getFullName().equals(VALUE_TYPE)) return VALUE_TYPE;
        return root;
    }

    /**
     * 解析基类（只构造不初始化）并继承深度、接口列表、改名表与泛型绑定。
     * 未显式声明时使用默认基类，默认基类不存在则没有基类。
     */
    private TypeDescriptor linkBase(TypeDescriptor type, LoadUnit unit, TypeDeclaration decl, String defaultBase) {
        TypeDescriptor base;
        if (decl.getBaseType() != null) {
            TypeReference reference = system.reference(unit, decl.getFullName(), decl.getBaseType());
            type.setBaseReference(reference);
            base = resolveBase(reference);
        } else if (defaultBase != null && !defaultBase.equals(decl.getFullName())) {
            base = findType(unit, defaultBase);
            if (base == null && decl.getKind() == TypeKind.STRUCT) {
                base = findType(unit, system.options().getRootTypeName());
            }
            type.setBaseReference(base);
        } else {
            base = null;
        }

        if (base == null) {
            type.setInheritanceDepth(1);
            return null;
        }
        if (base.isInterface()) {
            throw new RegistrationException("Type '" + type.getFullName() + "' cannot derive from interface '"
                    + base.getFullName() + "'");
        }
        type.setBaseType(base);
        type.setInheritanceDepth(base.getInheritanceDepth() + 1);
        for (TypeReference iface : base.getInterfaces()) {
            type.addInterface(iface);
        }
        type.getRenamedMethods().putAll(base.getRenamedMethods());
        type.getGenericBindings().putAll(base.getGenericBindings());
        return base;
    }

    private static TypeDescriptor resolveBase(TypeReference reference) {
        if (reference instanceof TypeDescriptor) return (TypeDescriptor) reference;
        if (reference instanceof TypeRef) return ((TypeRef) reference).resolve(false);
        throw new RegistrationException("Base type reference '" + reference.displayName() + "' is not a type");
    }

    private void addDeclaredInterfaces(TypeDescriptor type, LoadUnit unit, TypeDeclaration decl) {
        for (Object iface : decl.getInterfaces()) {
            type.addInterface(system.reference(unit, decl.getFullName(), iface));
        }
    }

    private TypeDescriptor findType(LoadUnit unit, String name) {
        return system.findType(unit, name);
    }
}
