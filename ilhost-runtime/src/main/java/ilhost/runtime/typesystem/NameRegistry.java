package ilhost.runtime.typesystem;

import ilhost.runtime.DuplicateDefinitionException;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.Names;
import ilhost.runtime.types.PublicInterface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * 名称注册表：每个加载单元一棵私有命名空间树，公开类型另外登记到全局命名空间。
 *
 * <p>私有查找未命中时回落到全局命名空间。</p>
 */
final class NameRegistry {

    private static final Logger LOG = Logger.getLogger(NameRegistry.class.getName());

    private final TypeSystem system;
    private final Namespace global = new Namespace("");
    private final ConcurrentMap<LoadUnit, Namespace> privateNamespaces = new ConcurrentHashMap<>();
    private final ConcurrentMap<LoadUnit, ConcurrentMap<String, TypeBinding>> typesByName = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TypeHandle> publicTypes = new ConcurrentHashMap<>();
    private final List<TypeBinding> bindings = new CopyOnWriteArrayList<>();
    private volatile boolean sealed;

    NameRegistry(TypeSystem system) {
        this.system = system;
    }

    // ============ 注册 ============

    TypeHandle register(LoadUnit unit, String fullName, boolean isPublic,
                        Supplier<PublicInterface> creator, Consumer<PublicInterface> initializer) {
        if (creator == null) {
            throw reportInvalid("Type creator for '" + fullName + "' must not be null");
        }
        return install(unit, fullName, isPublic, new TypeBinding(system, unit, fullName, creator, initializer));
    }

    TypeHandle registerExternal(LoadUnit unit, String fullName, boolean isPublic) {
        return install(unit, fullName, isPublic, TypeBinding.external(system, unit, fullName));
    }

    private TypeHandle install(LoadUnit unit, String fullName, boolean isPublic, TypeBinding binding) {
        if (unit == null) {
            throw reportInvalid("Load unit for '" + fullName + "' must not be null");
        }
        if (fullName == null || fullName.trim().isEmpty()) {
            throw reportInvalid("Type name must not be empty");
        }

        ConcurrentMap<String, TypeBinding> unitTypes = unitTypes(unit);
        TypeBinding existing = unitTypes.putIfAbsent(fullName, binding);
        if (existing != null) {
            system.host().error(new DuplicateDefinitionException("Duplicate definition of type '" + fullName
                    + "' in " + unit.getName() + "; the first definition is kept."));
            return existing;
        }

        if (sealed) binding.seal();
        bindings.add(binding);
        List<String> segments = Names.split(fullName);
        privateNamespace(unit).define(segments, binding);

        if (isPublic) {
            definePublic(unit, fullName, segments, binding);
        }
        LOG.fine("Registered " + (isPublic ? "public" : "private") + " type " + fullName + " in " + unit.getName());
        return binding;
    }

    private void definePublic(LoadUnit unit, String fullName, List<String> segments, TypeBinding binding) {
        TypeHandle previous = publicTypes.putIfAbsent(fullName, binding);
        if (previous == null) {
            global.define(segments, binding);
            return;
        }
        AmbiguousTypeHandle ambiguous = previous instanceof AmbiguousTypeHandle
                ? ((AmbiguousTypeHandle) previous).withOwner(unit)
                : new AmbiguousTypeHandle(fullName, Arrays.asList(previous.getLoadUnit(), unit));
        publicTypes.put(fullName, ambiguous);
        global.define(segments, ambiguous);

        List<String> owners = new ArrayList<>();
        for (LoadUnit owner : ambiguous.getOwners()) owners.add(owner.getName());
        system.host().warning("Type '" + fullName + "' is declared public in multiple load units: " + owners);
    }

    private RegistrationException reportInvalid(String message) {
        RegistrationException e = new RegistrationException(message);
        system.host().error(e);
        return e;
    }

    // ============ 查找 ============

    /** 沿命名空间树解析，私有树未命中时查全局 */
    TypeHandle resolve(LoadUnit context, String name) {
        List<String> segments = Names.split(name);
        if (context != null) {
            TypeHandle local = privateNamespace(context).find(segments);
            if (local != null) return local;
        }
        return global.resolve(segments);
    }

    /** 按全名查找（先本单元再公开类型），不存在返回 null */
    TypeHandle find(LoadUnit unit, String fullName) {
        if (unit != null) {
            TypeBinding local = unitTypes(unit).get(fullName);
            if (local != null) return local;
        }
        return publicTypes.get(fullName);
    }

    /**
     * 名称的声明单元：本单元声明了该名称时是本单元，否则是唯一公开声明它的单元；
     * 尚未声明或有歧义时仍为 context
     */
    LoadUnit declaringUnit(LoadUnit context, String fullName) {
        if (context != null && unitTypes(context).containsKey(fullName)) return context;
        TypeHandle handle = publicTypes.get(fullName);
        if (handle instanceof TypeBinding) return handle.getLoadUnit();
        return context;
    }

    /** 本单元声明的绑定（不含回落） */
    TypeBinding findOwn(LoadUnit unit, String fullName) {
        return unitTypes(unit).get(fullName);
    }

    List<TypeHandle> typesOf(LoadUnit unit) {
        return new ArrayList<TypeHandle>(unitTypes(unit).values());
    }

    // ============ 封存 ============

    void seal() {
        sealed = true;
        for (TypeBinding binding : bindings) {
            binding.seal();
        }
    }

    boolean isSealed() {
        return sealed;
    }

    private Namespace privateNamespace(LoadUnit unit) {
        return privateNamespaces.computeIfAbsent(unit, u -> new Namespace(""));
    }

    private ConcurrentMap<String, TypeBinding> unitTypes(LoadUnit unit) {
        return typesByName.computeIfAbsent(unit, u -> new ConcurrentHashMap<>());
    }
}
