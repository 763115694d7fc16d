package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.IlHostException;
import ilhost.runtime.types.FieldRecord;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.typesystem.TypeSystem;

/**
 * 反射字段。
 */
public final class FieldInfo extends MemberInfo {

    private final FieldRecord field;

    FieldInfo(TypeSystem system, TypeDescriptor declaringType, FieldRecord field) {
        super(system, declaringType, field);
        this.field = field;
    }

    public TypeDescriptor getFieldType() {
        return system.resolveType(field.getFieldType(), getDeclaringType());
    }

    public boolean isLiteral() {
        return field.isConstant();
    }

    public Object getValue(Object target) {
        if (isStatic()) {
            return getDeclaringType().getPublicInterface().get(getName());
        }
        return instance(target).get(getName());
    }

    public void setValue(Object target, Object value) {
        if (field.isConstant()) {
            throw new IlHostException("Cannot set the constant field '" + getName() + "'");
        }
        if (isStatic()) {
            getDeclaringType().getPublicInterface().set(getName(), value);
        } else {
            instance(target).set(getName(), value);
        }
    }

    private IlObject instance(Object target) {
        if (!(target instanceof IlObject)) {
            throw new IlHostException("Field '" + getName() + "' requires an instance target");
        }
        return (IlObject) target;
    }
}
