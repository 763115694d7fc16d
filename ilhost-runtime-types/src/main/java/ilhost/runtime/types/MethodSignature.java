package ilhost.runtime.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法签名：返回类型（null 表示 void）、参数类型、方法级泛型参数名。
 *
 * <p>哈希由参数与返回类型的标识拼接而成并按签名缓存，
 * 既是分派键，也是判断隐藏关系的唯一键。格式：
 * {@code [`N]$arg1,arg2=ret}，无参数时参数部分为 {@code void}，无返回值时为 {@code =void}。</p>
 */
public final class MethodSignature {

    private final TypeReference returnType;
    private final List<TypeReference> argumentTypes;
    private final List<String> genericParameterNames;
    private volatile String hash;

    public MethodSignature(TypeReference returnType, List<? extends TypeReference> argumentTypes,
                           List<String> genericParameterNames) {
        this.returnType = returnType;
        this.argumentTypes = Collections.unmodifiableList(new ArrayList<>(argumentTypes));
        this.genericParameterNames = genericParameterNames == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(genericParameterNames));
    }

    public MethodSignature(TypeReference returnType, List<? extends TypeReference> argumentTypes) {
        this(returnType, argumentTypes, null);
    }

    public TypeReference getReturnType() {
        return returnType;
    }

    public List<TypeReference> getArgumentTypes() {
        return argumentTypes;
    }

    public List<String> getGenericParameterNames() {
        return genericParameterNames;
    }

    public int getArgumentCount() {
        return argumentTypes.size();
    }

    public int getGenericArity() {
        return genericParameterNames.size();
    }

    public boolean isGeneric() {
        return !genericParameterNames.isEmpty();
    }

    public String hash() {
        String h = hash;
        if (h == null) {
            StringBuilder sb = new StringBuilder();
            if (!genericParameterNames.isEmpty()) {
                sb.append('`').append(genericParameterNames.size());
            }
            sb.append('$').append(TypeIds.hashArguments(argumentTypes));
            if (returnType == null) {
                sb.append("=void");
            } else {
                sb.append('=').append(returnType.typeId());
            }
            h = sb.toString();
            hash = h;
        }
        return h;
    }

    /** 成员表中的修饰名：转义名 + 哈希 */
    public String key(String escapedName) {
        return escapedName + hash();
    }

    /** 同一组泛型参数名下换成新的返回/参数类型 */
    public MethodSignature withTypes(TypeReference newReturnType, List<? extends TypeReference> newArgumentTypes) {
        return new MethodSignature(newReturnType, newArgumentTypes, genericParameterNames);
    }

    /** 形如 {@code String Name<T>(Int32, T)} 的可读签名 */
    public String describe(String name) {
        StringBuilder sb = new StringBuilder();
        sb.append(returnType == null ? "void" : returnType.displayName()).append(' ').append(name);
        if (!genericParameterNames.isEmpty()) {
            sb.append('<').append(String.join(", ", genericParameterNames)).append('>');
        }
        sb.append('(');
        for (int i = 0; i < argumentTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(argumentTypes.get(i).displayName());
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return describe("method");
    }
}
