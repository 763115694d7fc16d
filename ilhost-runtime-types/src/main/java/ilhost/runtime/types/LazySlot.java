package ilhost.runtime.types;

import ilhost.runtime.Host;

import java.util.function.Supplier;

/**
 * 记忆化槽位：首次读取时求值一次。
 */
public final class LazySlot {

    private final Supplier<Object> supplier;
    private final Host host;
    private volatile boolean evaluated;
    private Object value;

    public LazySlot(Supplier<Object> supplier, Host host) {
        this.supplier = supplier;
        this.host = host;
    }

    public Object get() {
        if (!evaluated) {
            synchronized (this) {
                if (!evaluated) {
                    value = supplier.get();
                    evaluated = true;
                }
            }
        }
        return value;
    }

    public boolean isEvaluated() {
        return evaluated;
    }

    Host getHost() {
        return host;
    }
}
