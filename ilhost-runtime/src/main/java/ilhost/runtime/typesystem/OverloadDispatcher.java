package ilhost.runtime.typesystem;

import ilhost.runtime.GenericInvokable;
import ilhost.runtime.Invokable;
import ilhost.runtime.NoApplicableOverloadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 方法组入口：先按实参个数找固定元数的重载，
 * 没有这一元数或其中没有候选匹配时，再按同一个数找泛型方法组，返回绑定了这些泛型实参的方法。
 */
final class OverloadDispatcher implements Invokable, GenericInvokable {

    private final String name;
    private final Map<Integer, RuntimeOverloadGroup> fixed;
    private final Map<Integer, GenericMethodGroup> generic;

    OverloadDispatcher(String name, Map<Integer, RuntimeOverloadGroup> fixed, Map<Integer, GenericMethodGroup> generic) {
        this.name = name;
        this.fixed = Collections.unmodifiableMap(new TreeMap<>(fixed));
        this.generic = Collections.unmodifiableMap(new TreeMap<>(generic));
    }

    @Override
    public Object invoke(Object self, Object[] args) {
        RuntimeOverloadGroup group = fixed.get(args.length);
        if (group != null) {
            OverloadCandidate candidate = group.select(args);
            if (candidate != null) {
                return candidate.getImplementation().invoke(self, args);
            }
        }
        GenericMethodGroup genericGroup = generic.get(args.length);
        if (genericGroup != null) {
            return new BoundGenericMethod(genericGroup, self, args);
        }
        if (group != null) {
            throw NoApplicableOverloadException.noMatch(group.describe());
        }
        throw NoApplicableOverloadException.noArity(name, args.length, describe());
    }

    @Override
    public int getGenericArity() {
        return generic.isEmpty() ? 0 : generic.keySet().iterator().next();
    }

    @Override
    public Invokable bindGenericArguments(Object self, Object[] genericArguments) {
        GenericMethodGroup genericGroup = generic.get(genericArguments.length);
        if (genericGroup == null) {
            throw NoApplicableOverloadException.noArity(name + "<>", genericArguments.length, describe());
        }
        return new BoundGenericMethod(genericGroup, self, genericArguments);
    }

    String getName() {
        return name;
    }

    List<String> describe() {
        List<String> result = new ArrayList<>();
        for (RuntimeOverloadGroup group : fixed.values()) {
            result.addAll(group.describe());
        }
        for (GenericMethodGroup group : generic.values()) {
            result.addAll(group.describe());
        }
        return result;
    }

    @Override
    public String toString() {
        return "<MethodGroup " + name + ">";
    }
}
