package ilhost.runtime.typesystem;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 按签名隐藏：同一哈希只保留一个方法，真实实现优先于占位，派生更深的优先。
 */
public final class MemberHiding {

    private MemberHiding() {}

    /**
     * @param isPlaceholder 判断候选当前是否为占位
     * @return 幸存者，保持输入顺序
     */
    public static List<ResolvedMethod> hide(List<ResolvedMethod> methods, Predicate<ResolvedMethod> isPlaceholder) {
        Map<String, ResolvedMethod> best = new LinkedHashMap<>();
        for (ResolvedMethod method : methods) {
            String hash = method.getSignature().hash();
            ResolvedMethod current = best.get(hash);
            if (current == null || preferred(method, current, isPlaceholder)) {
                best.put(hash, method);
            }
        }
        Map<ResolvedMethod, Boolean> survivors = new IdentityHashMap<>();
        for (ResolvedMethod method : best.values()) survivors.put(method, Boolean.TRUE);

        List<ResolvedMethod> result = new ArrayList<>(best.size());
        for (ResolvedMethod method : methods) {
            if (survivors.containsKey(method)) result.add(method);
        }
        return result;
    }

    private static boolean preferred(ResolvedMethod candidate, ResolvedMethod current,
                                     Predicate<ResolvedMethod> isPlaceholder) {
        boolean candidatePlaceholder = isPlaceholder.test(candidate);
        boolean currentPlaceholder = isPlaceholder.test(current);
        if (candidatePlaceholder != currentPlaceholder) return !candidatePlaceholder;
        return candidate.getContext().getInheritanceDepth() > current.getContext().getInheritanceDepth();
    }
}
