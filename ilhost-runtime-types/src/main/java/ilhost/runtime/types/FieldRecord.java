package ilhost.runtime.types;

import java.util.function.Function;

/**
 * 字段记录：字段类型与默认值（常量或在类型初始化时求值的表达式）。
 */
public final class FieldRecord extends MemberRecord {

    private final TypeReference fieldType;
    private final Function<PublicInterface, Object> defaultValue;
    private final boolean constant;

    public FieldRecord(MemberDescriptor descriptor, TypeDescriptor declaringType, TypeReference fieldType,
                       Function<PublicInterface, Object> defaultValue, boolean constant) {
        super(MemberKind.FIELD, descriptor, declaringType);
        this.fieldType = fieldType;
        this.defaultValue = defaultValue;
        this.constant = constant;
    }

    public TypeReference getFieldType() {
        return fieldType;
    }

    /** 可能为 null：此时使用字段类型的默认值 */
    public Function<PublicInterface, Object> getDefaultValue() {
        return defaultValue;
    }

    public boolean isConstant() {
        return constant;
    }
}
