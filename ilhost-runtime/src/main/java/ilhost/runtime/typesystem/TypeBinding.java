package ilhost.runtime.typesystem;

import ilhost.runtime.ExternalMemberNotImplementedException;
import ilhost.runtime.RecursiveConstructionException;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.TypeInitializationException;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.PublicInterface;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * 延迟名称绑定：首次访问时恰好运行一次构造器与初始化器。
 *
 * <p>构造期间同一线程再次访问即递归构造，立即失败；其他线程在类型系统锁上等待。
 * 构造失败后绑定停在 {@link BindingState#FAILED}，不保留半成品。</p>
 */
final class TypeBinding implements TypeHandle {

    private static final Logger LOG = Logger.getLogger(TypeBinding.class.getName());

    private final TypeSystem system;
    private final LoadUnit unit;
    private final String name;
    private volatile Supplier<PublicInterface> creator;
    private final Consumer<PublicInterface> initializer;
    private volatile boolean externalPending;

    private volatile BindingState state = BindingState.UNCONSTRUCTED;
    private volatile boolean sealed;
    private volatile PublicInterface value;
    private volatile RuntimeException failure;

    TypeBinding(TypeSystem system, LoadUnit unit, String name,
                Supplier<PublicInterface> creator, Consumer<PublicInterface> initializer) {
        this.system = system;
        this.unit = unit;
        this.name = name;
        this.creator = creator;
        this.initializer = initializer;
    }

    /** 外部类型：实现稍后通过 {@link #supply(Supplier)} 提供 */
    static TypeBinding external(TypeSystem system, LoadUnit unit, String name) {
        TypeBinding binding = new TypeBinding(system, unit, name, null, null);
        binding.externalPending = true;
        return binding;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public LoadUnit getLoadUnit() {
        return unit;
    }

    @Override
    public BindingState getState() {
        return state;
    }

    boolean isSealed() {
        return sealed;
    }

    void seal() {
        sealed = true;
    }

    boolean isExternalPending() {
        return externalPending;
    }

    void supply(Supplier<PublicInterface> externalCreator) {
        if (!externalPending) {
            throw new RegistrationException("Type '" + name + "' is not an external type awaiting implementation");
        }
        this.creator = externalCreator;
        this.externalPending = false;
    }

    @Override
    public PublicInterface get() {
        return get(true);
    }

    @Override
    public PublicInterface get(boolean initialize) {
        BindingState current = state;
        if (current == BindingState.INITIALIZED) return value;
        if (current == BindingState.CONSTRUCTED && !(initialize && sealed)) return value;

        ReentrantLock lock = system.lock();
        lock.lock();
        try {
            switch (state) {
                case CONSTRUCTING:
                    RecursiveConstructionException recursion = new RecursiveConstructionException(
                            "Recursive construction of type '" + name + "' detected.");
                    system.host().error(recursion);
                    throw recursion;
                case FAILED:
                    throw new TypeInitializationException(name, failure);
                case UNCONSTRUCTED:
                    construct();
                    break;
                default:
                    break;
            }
            if (initialize && sealed && state == BindingState.CONSTRUCTED) {
                state = BindingState.INITIALIZED;
                try {
                    system.initialize(value.getType());
                } catch (TypeInitializationException e) {
                    fail(e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : e);
                    throw e;
                }
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    private void construct() {
        if (externalPending) {
            throw new ExternalMemberNotImplementedException(
                    "The external type '" + name + "' has not been implemented.");
        }
        state = BindingState.CONSTRUCTING;
        try {
            PublicInterface result = creator.get();
            if (result == null) {
                throw new RegistrationException("Type creator for '" + name + "' returned null");
            }
            value = result;
            if (initializer != null) {
                initializer.accept(result);
            }
            state = BindingState.CONSTRUCTED;
            LOG.fine("Constructed type " + name);
        } catch (RecursiveConstructionException e) {
            fail(e);
            throw e;
        } catch (TypeInitializationException e) {
            fail(e);
            throw new TypeInitializationException(name, e);
        } catch (RuntimeException e) {
            fail(e);
            system.host().error(e);
            throw new TypeInitializationException(name, e);
        }
    }

    private void fail(RuntimeException cause) {
        value = null;
        failure = cause;
        state = BindingState.FAILED;
    }

    @Override
    public String toString() {
        return "<TypeHandle " + name + " " + state + ">";
    }
}
