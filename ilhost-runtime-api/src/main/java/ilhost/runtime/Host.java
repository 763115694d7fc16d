package ilhost.runtime;

/**
 * 宿主回调：错误/警告汇报与延迟执行。
 *
 * <p>{@link #runLater(Runnable)} 只用于可有可无的清理工作（例如把记忆化的槽降级为普通值），
 * 类型模型的正确性从不依赖它被执行。</p>
 */
public interface Host {

    /** 可恢复的降级情况（缺少接口成员、占位回退等） */
    void warning(String message);

    /** 构造期、静态构造器中捕获的错误 */
    void error(Throwable error);

    /** 延迟到空闲时执行 */
    void runLater(Runnable action);

    /** 执行所有排队的延迟任务，返回执行数量 */
    int runPending();
}
