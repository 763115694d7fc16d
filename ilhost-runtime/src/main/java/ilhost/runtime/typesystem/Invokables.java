package ilhost.runtime.typesystem;

import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;

/**
 * Invokable 工具方法
 */
final class Invokables {

    private Invokables() {}

    /** 固定 self 的包装，调用时忽略传入的 self */
    static Invokable bindSelf(final Invokable target, final Object self) {
        if (target instanceof BoundInvokable && ((BoundInvokable) target).self == self) return target;
        Invokable unwrapped = target instanceof BoundInvokable ? ((BoundInvokable) target).target : target;
        return new BoundInvokable(unwrapped, self);
    }

    /** 缺少实现的成员：调用时报错 */
    static Invokable missing(final String description) {
        return (self, args) -> {
            throw new IlHostException("No implementation was provided for " + description);
        };
    }

    static Object[] concat(Object[] head, Object[] tail) {
        Object[] result = new Object[head.length + tail.length];
        System.arraycopy(head, 0, result, 0, head.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }

    private static final class BoundInvokable implements Invokable {
        private final Invokable target;
        private final Object self;

        BoundInvokable(Invokable target, Object self) {
            this.target = target;
            this.self = self;
        }

        @Override
        public Object invoke(Object ignored, Object[] args) {
            return target.invoke(self, args);
        }

        @Override
        public boolean isPlaceholder() {
            return target.isPlaceholder();
        }
    }
}
