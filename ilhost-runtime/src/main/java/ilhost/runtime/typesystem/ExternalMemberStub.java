package ilhost.runtime.typesystem;

import ilhost.runtime.ExternalMemberNotImplementedException;
import ilhost.runtime.Host;
import ilhost.runtime.Invokable;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 未提供原生实现的外部成员占位。
 *
 * <p>基类已有同名成员时，首次调用警告一次并转发到继承的实现；否则调用即报错。</p>
 */
final class ExternalMemberStub implements Invokable {

    private final String typeName;
    private final String memberDescription;
    private final Invokable inherited;
    private final Host host;
    private final AtomicBoolean warned = new AtomicBoolean();

    ExternalMemberStub(String typeName, String memberDescription, Invokable inherited, Host host) {
        this.typeName = typeName;
        this.memberDescription = memberDescription;
        this.inherited = inherited;
        this.host = host;
    }

    @Override
    public Object invoke(Object self, Object[] args) {
        if (inherited == null) {
            throw new ExternalMemberNotImplementedException("The external method '" + memberDescription
                    + "' of type '" + typeName + "' has not been implemented.");
        }
        if (warned.compareAndSet(false, true)) {
            host.warning("The external method '" + memberDescription + "' of type '" + typeName
                    + "' has not been implemented; calling inherited method.");
        }
        return inherited.invoke(self, args);
    }

    @Override
    public boolean isPlaceholder() {
        return true;
    }

    @Override
    public String toString() {
        return "<External " + typeName + "::" + memberDescription + ">";
    }
}
