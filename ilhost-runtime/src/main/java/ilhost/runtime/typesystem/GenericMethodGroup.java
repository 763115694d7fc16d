package ilhost.runtime.typesystem;

import ilhost.runtime.NoApplicableOverloadException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 同一泛型参数个数的泛型方法，按调用实参个数再分组。
 */
final class GenericMethodGroup {

    private final String name;
    private final int genericArity;
    private final Map<Integer, RuntimeOverloadGroup> byArgumentCount = new TreeMap<>();

    GenericMethodGroup(String name, int genericArity, Map<Integer, List<OverloadCandidate>> candidates) {
        this.name = name;
        this.genericArity = genericArity;
        for (Map.Entry<Integer, List<OverloadCandidate>> entry : candidates.entrySet()) {
            byArgumentCount.put(entry.getKey(), new RuntimeOverloadGroup(entry.getValue(), genericArity));
        }
    }

    int getGenericArity() {
        return genericArity;
    }

    /** 实参数组 = 泛型实参 + 调用实参 */
    Object invoke(Object self, Object[] genericArguments, Object[] args) {
        RuntimeOverloadGroup group = byArgumentCount.get(args.length);
        if (group == null) {
            throw NoApplicableOverloadException.noArity(name + "<" + genericArity + ">", args.length, describe());
        }
        return group.invoke(self, Invokables.concat(genericArguments, args));
    }

    List<String> describe() {
        List<String> result = new ArrayList<>();
        for (RuntimeOverloadGroup group : byArgumentCount.values()) {
            result.addAll(group.describe());
        }
        return result;
    }
}
