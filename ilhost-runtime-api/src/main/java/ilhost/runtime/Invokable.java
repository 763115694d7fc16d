package ilhost.runtime;

/**
 * 运行时调用约定。
 *
 * <p>实例成员收到实例作为 {@code self}，静态成员收到所属类型的公共接口。
 * 泛型方法的实现把泛型实参放在 {@code args} 的最前面。</p>
 */
@FunctionalInterface
public interface Invokable {

    Object invoke(Object self, Object[] args);

    /** 是否为尚未实现的外部成员占位 */
    default boolean isPlaceholder() {
        return false;
    }
}
