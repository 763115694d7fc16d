package ilhost.runtime.types;

import ilhost.runtime.Invokable;

/**
 * 委托实例：委托类型 + 绑定的目标对象 + 方法。
 */
public final class DelegateInstance implements Invokable {

    private final TypeDescriptor type;
    private final Object target;
    private final Invokable method;

    public DelegateInstance(TypeDescriptor type, Object target, Invokable method) {
        this.type = type;
        this.target = target;
        this.method = method;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public Object getTarget() {
        return target;
    }

    public Invokable getMethod() {
        return method;
    }

    /** 忽略传入的 self，使用绑定的目标 */
    @Override
    public Object invoke(Object self, Object[] args) {
        return method.invoke(target, args);
    }

    @Override
    public String toString() {
        return type.getFullName();
    }
}
