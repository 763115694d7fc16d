package ilhost.runtime.typesystem.reflect;

import java.util.EnumSet;
import java.util.Set;

/** 成员查询过滤条件 */
public enum BindingFlag {
    /** 只返回本类型声明的成员 */
    DECLARED_ONLY,
    INSTANCE,
    STATIC,
    PUBLIC,
    NON_PUBLIC;

    /** 未指定任何条件时使用：公开的静态与实例成员 */
    public static Set<BindingFlag> defaults() {
        return EnumSet.of(PUBLIC, INSTANCE, STATIC);
    }

    public static Set<BindingFlag> of(BindingFlag first, BindingFlag... rest) {
        return EnumSet.of(first, rest);
    }
}
