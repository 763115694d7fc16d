package ilhost.runtime.typesystem;

import ilhost.runtime.NameResolutionException;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeReference;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 可赋值集合：沿基类与接口做广度优先遍历得到的类型标识闭包。
 */
final class Assignability {

    private static final Logger LOG = Logger.getLogger(Assignability.class.getName());

    private final TypeSystem system;

    Assignability(TypeSystem system) {
        this.system = system;
    }

    Set<String> buildAssignableSet(TypeDescriptor type) {
        Set<String> result = new LinkedHashSet<>();
        Set<TypeDescriptor> visited = Collections.newSetFromMap(new IdentityHashMap<TypeDescriptor, Boolean>());
        Deque<TypeDescriptor> queue = new ArrayDeque<>();
        queue.add(type);
        while (!queue.isEmpty()) {
            TypeDescriptor current = queue.poll();
            if (!visited.add(current)) continue;
            result.add(current.getTypeId());
            if (current.getBaseType() != null) {
                queue.add(current.getBaseType());
            }
            for (TypeReference reference : current.getInterfaces()) {
                TypeDescriptor iface = resolveInterface(type, current, reference);
                if (iface != null) queue.add(iface);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private TypeDescriptor resolveInterface(TypeDescriptor owner, TypeDescriptor context, TypeReference reference) {
        try {
            return system.closure().resolveDescriptor(reference, context);
        } catch (NameResolutionException e) {
            String message = "Interface '" + reference.displayName() + "' of type '" + owner.getFullName()
                    + "' could not be resolved: " + e.getMessage();
            LOG.warning(message);
            system.host().warning(message);
            return null;
        }
    }

    /** 集合尚未计算时先计算并记在 from 上 */
    boolean isAssignable(TypeDescriptor from, TypeDescriptor to) {
        if (to.getKind() == TypeKind.ANY || from == to) return true;
        Set<String> assignable = from.getAssignableTypes();
        if (assignable == null) {
            assignable = buildAssignableSet(from);
            from.setAssignableTypes(assignable);
        }
        return assignable.contains(to.getTypeId());
    }
}
