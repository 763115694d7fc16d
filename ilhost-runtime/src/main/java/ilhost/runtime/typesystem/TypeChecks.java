package ilhost.runtime.typesystem;

import ilhost.runtime.IlHostException;
import ilhost.runtime.InvalidCastException;
import ilhost.runtime.NameResolutionException;
import ilhost.runtime.types.DelegateInstance;
import ilhost.runtime.types.EnumValue;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 运行时类型检查、宿主值到类型的映射、转换与默认值。
 */
final class TypeChecks {

    private static final Map<Class<?>, String> HOST_TYPES = new HashMap<>();
    private static final Map<String, Object> NUMERIC_DEFAULTS = new HashMap<>();

    static {
        HOST_TYPES.put(String.class, "System.String");
        HOST_TYPES.put(Integer.class, "System.Int32");
        HOST_TYPES.put(Long.class, "System.Int64");
        HOST_TYPES.put(Short.class, "System.Int16");
        HOST_TYPES.put(Byte.class, "System.Byte");
        HOST_TYPES.put(Double.class, "System.Double");
        HOST_TYPES.put(Float.class, "System.Single");
        HOST_TYPES.put(Boolean.class, "System.Boolean");
        HOST_TYPES.put(Character.class, "System.Char");

        NUMERIC_DEFAULTS.put("System.Byte", (byte) 0);
        NUMERIC_DEFAULTS.put("System.SByte", (byte) 0);
        NUMERIC_DEFAULTS.put("System.Int16", (short) 0);
        NUMERIC_DEFAULTS.put("System.UInt16", 0);
        NUMERIC_DEFAULTS.put("System.Int32", 0);
        NUMERIC_DEFAULTS.put("System.UInt32", 0L);
        NUMERIC_DEFAULTS.put("System.Int64", 0L);
        NUMERIC_DEFAULTS.put("System.UInt64", 0L);
        NUMERIC_DEFAULTS.put("System.Single", 0.0f);
        NUMERIC_DEFAULTS.put("System.Double", 0.0d);
        NUMERIC_DEFAULTS.put("System.Decimal", 0.0d);
        NUMERIC_DEFAULTS.put("System.Boolean", Boolean.FALSE);
        NUMERIC_DEFAULTS.put("System.Char", '\0');
    }

    private final TypeSystem system;

    TypeChecks(TypeSystem system) {
        this.system = system;
    }

    // ============ 检查 ============

    boolean checkType(Object value, TypeDescriptor expected) {
        if (value == null || expected == null) return false;
        if (expected.getKind() == TypeKind.ANY) return true;
        if (expected.getCustomTypeCheck() != null) {
            return expected.getCustomTypeCheck().test(value);
        }
        TypeDescriptor actual = typeOf(value);
        if (actual != null && system.isAssignable(actual, expected)) return true;

        // 模板链上直接出现 expected 的实例（例如部分构造的类型）
        if (value instanceof IlObject) {
            for (MemberTable t = ((IlObject) value).getTemplate(); t != null; t = t.getParent()) {
                if (t.getOwner() == expected) return true;
            }
        }
        return false;
    }

    /** 值的运行时类型，宿主值映射到核心库类型，未声明时回落到根类型 */
    TypeDescriptor typeOf(Object value) {
        if (value == null) return null;
        if (value instanceof IlObject) return ((IlObject) value).getType();
        if (value instanceof EnumValue) return ((EnumValue) value).getType();
        if (value instanceof DelegateInstance) return ((DelegateInstance) value).getType();
        if (value instanceof TypeDescriptor || value instanceof PublicInterface) {
            TypeDescriptor type = value instanceof PublicInterface
                    ? ((PublicInterface) value).getType() : (TypeDescriptor) value;
            return metaTypeOf(type);
        }
        String coreName = HOST_TYPES.get(value.getClass());
        if (coreName == null && (value.getClass().isArray() || value instanceof List)) {
            coreName = TypeFactory.ARRAY;
        }
        TypeDescriptor mapped = coreName == null ? null : system.findCoreType(coreName);
        return mapped != null ? mapped : system.findCoreType(system.options().getRootTypeName());
    }

    /** 类型对象的元类型，根类型就绪后以真实的 RuntimeType 替换引导占位 */
    TypeDescriptor metaTypeOf(TypeDescriptor type) {
        TypeDescriptor meta = type.getMetaType();
        if (meta == null || meta == system.factory().bootstrapMetaType()) {
            TypeDescriptor real = system.factory().realMetaType();
            if (real != null) {
                type.setMetaType(real);
                return real;
            }
            return system.factory().bootstrapMetaType();
        }
        return meta;
    }

    // ============ 转换 ============

    Object cast(Object value, TypeDescriptor target) {
        if (value == null) {
            if (target.isValueType()) {
                throw new InvalidCastException("Unable to cast null to type '" + target.getFullName() + "'.");
            }
            return null;
        }
        if (target.isEnum() && value instanceof Number) {
            return enumValue(target, (long) Math.floor(((Number) value).doubleValue()));
        }
        if (checkType(value, target)) return value;
        throw new InvalidCastException("Unable to cast object of type '" + describe(value)
                + "' to type '" + target.getFullName() + "'.");
    }

    /** 值类型不能作为 as 转换的目标 */
    Object tryCast(Object value, TypeDescriptor target) {
        if (target.isValueType()) {
            throw new InvalidCastException("Cannot TryCast to the value type '" + target.getFullName() + "'.");
        }
        return checkType(value, target) ? value : null;
    }

    static EnumValue enumValue(TypeDescriptor enumType, long value) {
        EnumValue named = enumType.findEnumValue(value);
        return named != null ? named : new EnumValue(enumType, value, null);
    }

    /** 按名称组合标志枚举的值，结果名称为 null，按数值渲染为 "A, B" */
    static EnumValue flags(TypeDescriptor enumType, String... names) {
        if (!enumType.isFlagsEnum()) {
            throw new IlHostException("Type '" + enumType.getFullName() + "' is not a flags enumeration");
        }
        long value = 0;
        for (String name : names) {
            EnumValue named = enumType.getEnumValue(name);
            if (named == null) {
                throw new NameResolutionException("Enumeration '" + enumType.getFullName()
                        + "' has no member named '" + name + "'");
            }
            value |= named.getValue();
        }
        return enumValue(enumType, value);
    }

    private String describe(Object value) {
        TypeDescriptor type = typeOf(value);
        if (value instanceof IlObject || value instanceof EnumValue || HOST_TYPES.containsKey(value.getClass())) {
            return type != null ? type.getFullName() : value.getClass().getName();
        }
        return value.getClass().getName();
    }

    // ============ 默认值 ============

    /** 基元值类型（数值、布尔、字符）的默认值是宿主值而不是结构实例 */
    boolean hasPrimitiveDefault(TypeDescriptor type) {
        return type != null && NUMERIC_DEFAULTS.containsKey(type.getFullName());
    }

    /** Char 为 '\0'，数值为 0，枚举为 0 值，结构为新实例，引用类型为 null */
    Object defaultValue(TypeDescriptor type) {
        if (type == null) return null;
        Object numeric = NUMERIC_DEFAULTS.get(type.getFullName());
        if (numeric != null) return numeric;
        if (type.isEnum()) return enumValue(type, 0);
        if (type.getKind() == TypeKind.STRUCT) return system.instances().construct(type, new Object[0]);
        return null;
    }
}
