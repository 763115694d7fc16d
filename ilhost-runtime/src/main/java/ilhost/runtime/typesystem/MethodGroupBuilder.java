package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.types.LazySlot;
import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * 为闭包类型的每个方法名生成分派入口。
 *
 * <p>候选：本类型声明的静态方法，继承链上的全部实例方法（构造器除外），本类型声明的构造器。
 * 隐藏之后只剩一个非泛型方法时直接安装其实现，否则安装 {@link OverloadDispatcher}。</p>
 */
final class MethodGroupBuilder {

    private static final Logger LOG = Logger.getLogger(MethodGroupBuilder.class.getName());

    private final TypeSystem system;

    MethodGroupBuilder(TypeSystem system) {
        this.system = system;
    }

    void build(final TypeDescriptor type) {
        Map<String, List<ResolvedMethod>> partitions = new LinkedHashMap<>();
        for (MemberRecord record : type.getMembers()) {
            if (record instanceof MethodRecord && (record.isStatic()
                    || record.getKind() == MemberKind.CONSTRUCTOR)) {
                add(partitions, type, (MethodRecord) record);
            }
        }
        for (TypeDescriptor t = type; t != null; t = t.getBaseType()) {
            for (MemberRecord record : t.getMembers()) {
                if (record instanceof MethodRecord && !record.isStatic()
                        && record.getKind() != MemberKind.CONSTRUCTOR) {
                    add(partitions, t, (MethodRecord) record);
                }
            }
        }

        PublicInterface pi = type.getPublicInterface();
        int installed = 0;
        for (Map.Entry<String, List<ResolvedMethod>> partition : partitions.entrySet()) {
            List<ResolvedMethod> methods = partition.getValue();
            final ResolvedMethod first = methods.get(0);
            final boolean isStatic = first.getRecord().isStatic();
            final String key = first.getRecord().getDescriptor().getEscapedName();
            MemberTable target = isStatic ? pi.getStatics() : pi.getTemplate();

            Object own = target.getOwn(key);
            if (target.hasOwn(key) && !(own instanceof Invokable && ((Invokable) own).isPlaceholder())) {
                continue;
            }
            final List<ResolvedMethod> survivors = MemberHiding.hide(methods, this::isPlaceholder);
            if (system.options().isLazyMethodGroups()) {
                target.defineLazy(key, new LazySlot(() -> makeGroup(first.getName(), survivors), system.host()));
            } else {
                target.define(key, makeGroup(first.getName(), survivors));
            }
            installed++;
        }
        LOG.fine("Installed " + installed + " method group(s) on " + type.getFullName());
    }

    private void add(Map<String, List<ResolvedMethod>> partitions, TypeDescriptor context, MethodRecord record) {
        ResolvedMethod method = new ResolvedMethod(record, context,
                system.closure().resolveSignature(context, record.getSignature()));
        List<ResolvedMethod> partition = partitions.get(record.getDescriptor().partitionKey());
        if (partition == null) {
            partition = new ArrayList<>();
            partitions.put(record.getDescriptor().partitionKey(), partition);
        }
        partition.add(method);
    }

    /** 实现当前在成员表中的值，缺失时得到调用即报错的替身 */
    Invokable implementationOf(ResolvedMethod method) {
        PublicInterface pi = method.getContext().getPublicInterface();
        MemberTable table = method.getRecord().isStatic() ? pi.getStatics() : pi.getTemplate();
        Object implementation = table.lookup(method.getTableKey());
        if (implementation instanceof Invokable) {
            return (Invokable) implementation;
        }
        return Invokables.missing(method.describe());
    }

    boolean isPlaceholder(ResolvedMethod method) {
        return method.getRecord().isPlaceholder() || implementationOf(method).isPlaceholder();
    }

    private Object makeGroup(String name, List<ResolvedMethod> methods) {
        if (methods.size() == 1 && !methods.get(0).getSignature().isGeneric()) {
            return implementationOf(methods.get(0));
        }
        Map<Integer, List<OverloadCandidate>> fixed = new TreeMap<>();
        Map<Integer, Map<Integer, List<OverloadCandidate>>> generic = new TreeMap<>();
        for (ResolvedMethod method : methods) {
            OverloadCandidate candidate = new OverloadCandidate(system, method, implementationOf(method));
            int argc = method.getSignature().getArgumentCount();
            if (method.getSignature().isGeneric()) {
                int arity = method.getSignature().getGenericArity();
                Map<Integer, List<OverloadCandidate>> byCount = generic.get(arity);
                if (byCount == null) {
                    byCount = new TreeMap<>();
                    generic.put(arity, byCount);
                }
                bucket(byCount, argc).add(candidate);
            } else {
                bucket(fixed, argc).add(candidate);
            }
        }

        Map<Integer, RuntimeOverloadGroup> fixedGroups = new TreeMap<>();
        for (Map.Entry<Integer, List<OverloadCandidate>> entry : fixed.entrySet()) {
            fixedGroups.put(entry.getKey(), new RuntimeOverloadGroup(entry.getValue(), 0));
        }
        Map<Integer, GenericMethodGroup> genericGroups = new TreeMap<>();
        for (Map.Entry<Integer, Map<Integer, List<OverloadCandidate>>> entry : generic.entrySet()) {
            genericGroups.put(entry.getKey(), new GenericMethodGroup(name, entry.getKey(), entry.getValue()));
        }
        return new OverloadDispatcher(name, fixedGroups, genericGroups);
    }

    private static List<OverloadCandidate> bucket(Map<Integer, List<OverloadCandidate>> buckets, int key) {
        List<OverloadCandidate> list = buckets.get(key);
        if (list == null) {
            list = new ArrayList<>();
            buckets.put(key, list);
        }
        return list;
    }
}
