package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberDescriptor;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * 外部实现表：按类型名排队的原生替身，在类型创建时取出并写入成员表。
 */
final class ExternalsRegistry {

    private static final Logger LOG = Logger.getLogger(ExternalsRegistry.class.getName());

    private final TypeSystem system;
    private final ConcurrentMap<String, List<Pending>> queued = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, Entry>> implemented = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TypeDescriptor> liveTypes = new ConcurrentHashMap<>();

    ExternalsRegistry(TypeSystem system) {
        this.system = system;
    }

    static String entryKey(boolean isStatic, String key) {
        return (isStatic ? "" : "instance$") + key;
    }

    void queue(LoadUnit unit, String typeName, Consumer<ExternalsBuilder> builder) {
        if (builder == null) {
            RegistrationException e = new RegistrationException("Externals builder for '" + typeName + "' must not be null");
            system.host().error(e);
            throw e;
        }
        TypeDescriptor live = liveTypes.get(typeName);
        if (live != null && live.isInitialized()) {
            RegistrationException e = new RegistrationException("Type '" + typeName
                    + "' has already been initialized; externals can no longer be applied.");
            system.host().error(e);
            throw e;
        }
        queued.computeIfAbsent(typeName, k -> new CopyOnWriteArrayList<>()).add(new Pending(unit, builder));
        if (live != null) {
            apply(live);
        }
    }

    /** 类型创建时调用：登记为活动类型并写入已收集的外部实现 */
    void typeCreated(TypeDescriptor type) {
        liveTypes.putIfAbsent(type.getFullName(), type);
        apply(type);
    }

    /** 查找外部实现，没有则返回 null */
    Invokable find(String typeName, boolean isStatic, String key) {
        drain(typeName);
        Map<String, Entry> entries = implemented.get(typeName);
        if (entries == null) return null;
        synchronized (entries) {
            Entry entry = entries.get(entryKey(isStatic, key));
            return entry == null ? null : entry.body;
        }
    }

    void apply(TypeDescriptor type) {
        drain(type.getFullName());
        Map<String, Entry> entries = implemented.get(type.getFullName());
        if (entries == null) return;
        List<Entry> snapshot;
        synchronized (entries) {
            snapshot = new ArrayList<>(entries.values());
        }
        PublicInterface pi = type.getPublicInterface();
        for (Entry entry : snapshot) {
            MemberTable target = entry.isStatic ? pi.getStatics() : pi.getTemplate();
            target.define(entry.key, entry.body);
            if (entry.descriptor == null) {
                if (entry.isStatic && !type.getRawStaticMethods().contains(entry.key)) {
                    type.getRawStaticMethods().add(entry.key);
                }
                if (entry.isStatic && "CheckType".equals(entry.key)) {
                    final Invokable check = entry.body;
                    type.setCustomTypeCheck(value -> Boolean.TRUE.equals(check.invoke(pi, new Object[]{value})));
                }
                continue;
            }
            MethodRecord declared = findDeclared(type, entry);
            if (declared != null) {
                declared.setPlaceholder(false);
            } else {
                type.addMember(new MethodRecord(entry.descriptor, type, entry.signature, true));
            }
        }
        LOG.fine("Applied " + snapshot.size() + " external member(s) to " + type.getFullName());
    }

    private static MethodRecord findDeclared(TypeDescriptor type, Entry entry) {
        for (MemberRecord record : type.getMembers()) {
            if (!(record instanceof MethodRecord)) continue;
            MethodRecord method = (MethodRecord) record;
            if (method.isStatic() == entry.isStatic && method.getMangledName().equals(entry.key)) {
                return method;
            }
        }
        return null;
    }

    private void drain(String typeName) {
        List<Pending> pending = queued.remove(typeName);
        if (pending == null) return;
        Map<String, Entry> entries = implemented.computeIfAbsent(typeName,
                k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        for (Pending p : pending) {
            p.builder.accept(new ExternalsBuilder(system, p.unit, typeName, entries));
        }
    }

    private static final class Pending {
        final LoadUnit unit;
        final Consumer<ExternalsBuilder> builder;

        Pending(LoadUnit unit, Consumer<ExternalsBuilder> builder) {
            this.unit = unit;
            this.builder = builder;
        }
    }

    static final class Entry {
        final boolean isStatic;
        final String key;
        final MemberDescriptor descriptor;
        final MethodSignature signature;
        final Invokable body;

        Entry(boolean isStatic, String key, MemberDescriptor descriptor, MethodSignature signature, Invokable body) {
            this.isStatic = isStatic;
            this.key = key;
            this.descriptor = descriptor;
            this.signature = signature;
            this.body = body;
        }
    }
}
