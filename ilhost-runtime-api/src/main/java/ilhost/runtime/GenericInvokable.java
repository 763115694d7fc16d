package ilhost.runtime;

/**
 * 泛型方法入口：先绑定泛型实参，得到可直接调用的方法。
 */
public interface GenericInvokable {

    /** 方法级泛型参数个数 */
    int getGenericArity();

    Invokable bindGenericArguments(Object self, Object[] genericArguments);
}
