package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.NameResolutionException;
import ilhost.runtime.types.InterfaceMember;
import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.Names;
import ilhost.runtime.types.PropertyAccessor;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeReference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * 接口一致性修正：为每个接口成员在实例模板上安装接口限定的别名，
 * 缺失（或仍是占位）的成员汇总成一条警告。
 */
final class InterfaceFixup {

    private static final Logger LOG = Logger.getLogger(InterfaceFixup.class.getName());

    private final TypeSystem system;

    InterfaceFixup(TypeSystem system) {
        this.system = system;
    }

    void fixup(TypeDescriptor type) {
        MemberTable template = type.getPublicInterface().getTemplate();
        List<String> missing = new ArrayList<>();

        for (TypeDescriptor iface : interfacesOf(type)) {
            TypeDescriptor open = iface.getOpenType() != null ? iface.getOpenType() : iface;
            String interfaceName = open.getShortName();

            for (InterfaceMember member : iface.getInterfaceMembers().values()) {
                String qualifiedKey = Names.escape(interfaceName + "." + member.getName());
                Object qualified = template.lookup(qualifiedKey);
                if (isImplementation(qualified, member)) continue;

                Object implementation = template.lookup(Names.escape(member.getName()));
                if (implementation == null && member.getKind() == MemberKind.PROPERTY
                        && template.lookup(Names.escape("get_" + member.getName())) != null) {
                    implementation = new PropertyAccessor(member.getName(),
                            Names.escape("get_" + member.getName()), Names.escape("set_" + member.getName()));
                }
                if (implementation == null) {
                    missing.add(interfaceName + "." + member.getName());
                    continue;
                }
                if (!isImplementation(implementation, member)) {
                    missing.add(interfaceName + "." + member.getName());
                }
                // 占位也安装别名，调用时由占位报告缺失
                template.define(qualifiedKey, implementation);
            }
        }

        if (!missing.isEmpty() && !system.options().isSuppressInterfaceWarnings()) {
            warn("Type '" + type.getFullName() + "' is missing implementation of interface member(s): "
                    + String.join(", ", missing));
        }
    }

    /** 直接声明的接口及其继承的接口，去重后按广度优先顺序 */
    private List<TypeDescriptor> interfacesOf(TypeDescriptor type) {
        List<TypeDescriptor> result = new ArrayList<>();
        Deque<TypeReference[]> queue = new ArrayDeque<>();
        for (TypeReference reference : type.getInterfaces()) {
            queue.add(new TypeReference[]{reference, type});
        }
        while (!queue.isEmpty()) {
            TypeReference[] next = queue.poll();
            TypeDescriptor iface = resolve(type, next[0], (TypeDescriptor) next[1]);
            if (iface == null || result.contains(iface)) continue;
            if (!iface.isInterface()) {
                warn("Type '" + type.getFullName() + "' lists '" + iface.getFullName()
                        + "' as an interface, but it is not an interface.");
                continue;
            }
            result.add(iface);
            for (TypeReference inherited : iface.getInterfaces()) {
                queue.add(new TypeReference[]{inherited, iface});
            }
        }
        return result;
    }

    private static boolean isImplementation(Object slot, InterfaceMember member) {
        if (slot == null) return false;
        if (slot instanceof Invokable) return !((Invokable) slot).isPlaceholder();
        return member.getKind() == MemberKind.PROPERTY;
    }

    private TypeDescriptor resolve(TypeDescriptor type, TypeReference reference, TypeDescriptor context) {
        try {
            return system.closure().resolveDescriptor(reference, context);
        } catch (NameResolutionException e) {
            warn("Type '" + type.getFullName() + "' implements interface '" + reference.displayName()
                    + "', which could not be found: " + e.getMessage());
            return null;
        }
    }

    private void warn(String message) {
        LOG.warning(message);
        system.host().warning(message);
    }
}
