package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.types.TypeReference;

/**
 * 方法参数：位置与声明的类型引用。
 */
public final class ParameterInfo {

    private final int position;
    private final TypeReference parameterType;

    ParameterInfo(int position, TypeReference parameterType) {
        this.position = position;
        this.parameterType = parameterType;
    }

    public int getPosition() {
        return position;
    }

    public TypeReference getParameterType() {
        return parameterType;
    }

    @Override
    public String toString() {
        return parameterType.displayName() + " #" + position;
    }
}
