package ilhost.runtime;

import java.util.Collections;
import java.util.List;

/**
 * 方法组中没有与实参匹配的重载。
 *
 * <p>异常消息和 {@link #getCandidates()} 都包含全部候选签名，便于诊断。</p>
 */
public class NoApplicableOverloadException extends IlHostException {

    private final List<String> candidates;

    public NoApplicableOverloadException(String message, List<String> candidates) {
        super(message);
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }

    /** 固定元数候选全部不匹配 */
    public static NoApplicableOverloadException noMatch(List<String> candidates) {
        StringBuilder sb = new StringBuilder();
        sb.append(candidates.size()).append(" candidate(s) for method invocation:");
        for (String candidate : candidates) {
            sb.append('\n').append(candidate);
        }
        return new NoApplicableOverloadException(sb.toString(), candidates);
    }

    /** 没有任何候选接受该实参数量 */
    public static NoApplicableOverloadException noArity(String methodName, int argumentCount,
                                                        List<String> candidates) {
        return new NoApplicableOverloadException(
                "No overload of " + methodName + " can accept " + argumentCount + " argument(s).",
                candidates);
    }
}
