package ilhost.runtime.types;

import java.util.Arrays;

/**
 * 加载单元（程序集）：类型声明与私有命名空间的作用域。
 *
 * <p>核心库别名与核心单元共享 {@link #getIdPrefix()}，
 * 因此两个版本的标准库声明的同名类型得到相同的标识。</p>
 */
public final class LoadUnit {

    private final String name;
    private final String shortName;
    private final String idPrefix;
    private final TypeRuntime runtime;

    public LoadUnit(String name, String idPrefix, TypeRuntime runtime) {
        this.name = name;
        int comma = name.indexOf(',');
        this.shortName = comma < 0 ? name : name.substring(0, comma).trim();
        this.idPrefix = idPrefix;
        this.runtime = runtime;
    }

    public String getName() {
        return name;
    }

    public String getShortName() {
        return shortName;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public TypeRuntime getRuntime() {
        return runtime;
    }

    /** 创建指向本单元上下文的前向引用 */
    public TypeRef typeRef(String typeName, TypeReference... genericArguments) {
        return new TypeRef(this, typeName, Arrays.asList(genericArguments));
    }

    @Override
    public String toString() {
        return "<LoadUnit " + name + ">";
    }
}
