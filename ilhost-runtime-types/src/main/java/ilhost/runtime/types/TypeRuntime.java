package ilhost.runtime.types;

import ilhost.runtime.Host;

import java.util.List;

/**
 * 类型数据模型回调运行时的入口。
 *
 * <p>前向引用解析、泛型闭包、实例构造都依赖注册表与初始化流程，
 * 由 {@code ilhost-runtime} 中的类型系统实现。</p>
 */
public interface TypeRuntime {

    String assignTypeId(LoadUnit unit, String typeName);

    String genericParameterId(String qualifiedKey);

    /**
     * 按名称解析类型
     *
     * @param initialize 为 true 时已封存的类型会被初始化，否则只构造
     */
    TypeDescriptor resolveTypeName(LoadUnit context, String typeName, boolean initialize);

    TypeDescriptor close(TypeDescriptor openType, List<?> arguments, boolean initialize);

    void initialize(TypeDescriptor type);

    IlObject construct(TypeDescriptor type, Object[] arguments);

    boolean checkType(Object value, TypeDescriptor expected);

    Host host();
}
