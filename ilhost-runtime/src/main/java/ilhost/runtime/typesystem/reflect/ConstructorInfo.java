package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.types.IlObject;
import ilhost.runtime.typesystem.ResolvedMethod;
import ilhost.runtime.typesystem.TypeSystem;

/**
 * 反射构造器。
 */
public final class ConstructorInfo extends MethodInfo {

    ConstructorInfo(TypeSystem system, ResolvedMethod method) {
        super(system, method);
    }

    /** 分配实例并经构造方法组选择与实参匹配的重载 */
    public IlObject newInstance(Object... args) {
        return system.createInstance(getDeclaringType(), args);
    }
}
