package ilhost.runtime.typesystem;

/**
 * 名称绑定的生命周期
 */
public enum BindingState {
    /** 已注册，尚未访问 */
    UNCONSTRUCTED,
    /** 构造器或初始化器正在运行，此时再次访问即递归构造 */
    CONSTRUCTING,
    /** 描述符已创建，成员已声明 */
    CONSTRUCTED,
    /** 方法组、接口、可赋值集合均已就绪 */
    INITIALIZED,
    /** 构造失败，绑定不持有任何值 */
    FAILED
}
