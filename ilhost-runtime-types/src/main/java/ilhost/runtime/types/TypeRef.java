package ilhost.runtime.types;

import ilhost.runtime.InvalidGenericArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 延迟解析的类型前向引用：上下文加载单元 + 类型名 + 泛型实参。
 *
 * <p>计算标识键不需要解析目标类型，所以签名可以在目标类型声明之前构造。</p>
 */
public final class TypeRef implements TypeReference {

    private final LoadUnit context;
    private final String typeName;
    private final List<TypeReference> genericArguments;
    private volatile TypeDescriptor cached;

    public TypeRef(LoadUnit context, String typeName, List<? extends TypeReference> genericArguments) {
        if (context == null) {
            throw new IllegalArgumentException("TypeRef context must not be null");
        }
        for (int i = 0; i < genericArguments.size(); i++) {
            if (genericArguments.get(i) == null) {
                throw new InvalidGenericArgumentException(
                        "Undefined or null passed as generic argument #" + i + " of TypeRef '" + typeName + "'");
            }
        }
        this.context = context;
        this.typeName = typeName;
        this.genericArguments = Collections.unmodifiableList(new ArrayList<>(genericArguments));
    }

    public LoadUnit getContext() {
        return context;
    }

    public String getTypeName() {
        return typeName;
    }

    public List<TypeReference> getGenericArguments() {
        return genericArguments;
    }

    @Override
    public String typeId() {
        String id = context.getRuntime().assignTypeId(context, typeName);
        if (genericArguments.isEmpty()) return id;
        return id + "[" + TypeIds.hashArguments(genericArguments) + "]";
    }

    /** 解析并初始化 */
    public TypeDescriptor get() {
        TypeDescriptor result = cached;
        if (result == null) {
            result = resolve(true);
            cached = result;
        }
        return result;
    }

    /**
     * 解析目标类型
     *
     * @param initialize false 时只构造不初始化，用于初始化过程中的签名解析
     */
    public TypeDescriptor resolve(boolean initialize) {
        TypeDescriptor result = cached;
        if (result != null) return result;
        TypeRuntime runtime = context.getRuntime();
        TypeDescriptor open = runtime.resolveTypeName(context, typeName, initialize);
        if (genericArguments.isEmpty()) {
            result = open;
        } else {
            result = runtime.close(open, genericArguments, initialize);
        }
        if (initialize) cached = result;
        return result;
    }

    /** 替换泛型实参后得到新引用，自身不变 */
    public TypeRef withGenericArguments(List<? extends TypeReference> arguments) {
        return new TypeRef(context, typeName, arguments);
    }

    @Override
    public String displayName() {
        if (genericArguments.isEmpty()) return typeName;
        StringBuilder sb = new StringBuilder(typeName).append('[');
        for (int i = 0; i < genericArguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(genericArguments.get(i).displayName());
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return "ref " + displayName();
    }
}
