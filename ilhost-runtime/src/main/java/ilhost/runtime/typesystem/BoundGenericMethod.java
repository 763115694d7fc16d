package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;

import java.util.Arrays;

/**
 * 已绑定泛型实参和接收者的泛型方法。
 */
final class BoundGenericMethod implements Invokable {

    private final GenericMethodGroup group;
    private final Object self;
    private final Object[] genericArguments;

    BoundGenericMethod(GenericMethodGroup group, Object self, Object[] genericArguments) {
        this.group = group;
        this.self = self;
        this.genericArguments = genericArguments.clone();
    }

    /** 忽略传入的 self，使用绑定时的接收者 */
    @Override
    public Object invoke(Object ignored, Object[] args) {
        return group.invoke(self, genericArguments, args);
    }

    @Override
    public String toString() {
        return "<BoundGenericMethod " + Arrays.toString(genericArguments) + ">";
    }
}
