package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.NoApplicableOverloadException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 同一实参数量的重载集合，按顺序取第一个结构匹配的候选。
 *
 * <p>首次分派时排序一次：严格更具体的签名排在它细化的签名之前，其余保持声明顺序。
 * 固定元数的集合只有一个候选时不做类型检查，直接调用。</p>
 */
final class RuntimeOverloadGroup implements Invokable {

    private final List<OverloadCandidate> declared;
    private final int offset;
    private volatile List<OverloadCandidate> ordered;

    /**
     * @param offset 实参数组前部的方法泛型实参个数
     */
    RuntimeOverloadGroup(List<OverloadCandidate> candidates, int offset) {
        this.declared = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.offset = offset;
    }

    @Override
    public Object invoke(Object self, Object[] args) {
        OverloadCandidate candidate = select(args);
        if (candidate == null) {
            throw NoApplicableOverloadException.noMatch(describe());
        }
        return candidate.getImplementation().invoke(self, args);
    }

    /**
     * 选出处理这组实参的候选
     *
     * @return 没有候选匹配时返回 null
     */
    OverloadCandidate select(Object[] args) {
        if (offset == 0 && declared.size() == 1) {
            return declared.get(0);
        }
        for (OverloadCandidate candidate : ordered()) {
            if (candidate.matches(args, offset)) {
                return candidate;
            }
        }
        return null;
    }

    List<OverloadCandidate> ordered() {
        List<OverloadCandidate> result = ordered;
        if (result == null) {
            List<OverloadCandidate> sorted = new ArrayList<>(declared.size());
            for (OverloadCandidate candidate : declared) {
                int position = sorted.size();
                for (int i = 0; i < sorted.size(); i++) {
                    if (candidate.isMoreSpecificThan(sorted.get(i))) {
                        position = i;
                        break;
                    }
                }
                sorted.add(position, candidate);
            }
            result = Collections.unmodifiableList(sorted);
            ordered = result;
        }
        return result;
    }

    List<String> describe() {
        List<String> descriptions = new ArrayList<>(declared.size());
        for (OverloadCandidate candidate : declared) {
            descriptions.add(candidate.describe());
        }
        return descriptions;
    }

    @Override
    public String toString() {
        return "<OverloadGroup " + describe() + ">";
    }
}
