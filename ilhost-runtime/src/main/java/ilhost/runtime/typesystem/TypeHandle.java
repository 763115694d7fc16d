package ilhost.runtime.typesystem;

import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;

/**
 * 声明后立即可用的类型句柄，首次解引用时才构造类型。
 */
public interface TypeHandle {

    String getName();

    LoadUnit getLoadUnit();

    BindingState getState();

    /** 构造；注册表封存后还会初始化 */
    PublicInterface get();

    /**
     * @param initialize false 时只构造，不触发初始化
     */
    PublicInterface get(boolean initialize);

    default TypeDescriptor getType() {
        return get().getType();
    }
}
