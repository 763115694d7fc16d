package ilhost.runtime.types;

import java.util.ArrayList;
import java.util.List;

/**
 * 枚举值：所属枚举类型 + 数值 + 名称（组合的标志值没有名称）。
 */
public final class EnumValue {

    private final TypeDescriptor type;
    private final long value;
    private final String name;

    public EnumValue(TypeDescriptor type, long value, String name) {
        this.type = type;
        this.value = value;
        this.name = name;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public long getValue() {
        return value;
    }

    /** 具名值的名称，组合值或未命名数值为 null */
    public String getName() {
        return name;
    }

    public boolean hasFlag(EnumValue flag) {
        return (value & flag.value) == flag.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumValue)) return false;
        EnumValue other = (EnumValue) o;
        return type == other.type && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(type) + Long.hashCode(value);
    }

    @Override
    public String toString() {
        if (name != null) return name;
        if (type.isFlagsEnum()) {
            List<String> parts = new ArrayList<>();
            for (EnumValue named : type.getEnumValues()) {
                if (named.value != 0 && hasFlag(named)) parts.add(named.name);
            }
            if (!parts.isEmpty()) return String.join(", ", parts);
        }
        return Long.toString(value);
    }
}
