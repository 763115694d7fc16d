package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.IlHostException;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.PropertyRecord;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.typesystem.TypeSystem;

/**
 * 反射属性，读写经由 get_/set_ 访问器。
 */
public final class PropertyInfo extends MemberInfo {

    private final PropertyRecord property;

    PropertyInfo(TypeSystem system, TypeDescriptor declaringType, PropertyRecord property) {
        super(system, declaringType, property);
        this.property = property;
    }

    public TypeDescriptor getPropertyType() {
        return system.resolveType(property.getPropertyType(), getDeclaringType());
    }

    public Object getValue(Object target) {
        if (isStatic()) {
            return getDeclaringType().getPublicInterface().get(getName());
        }
        return instance(target).get(getName());
    }

    public void setValue(Object target, Object value) {
        if (isStatic()) {
            getDeclaringType().getPublicInterface().set(getName(), value);
        } else {
            instance(target).set(getName(), value);
        }
    }

    private IlObject instance(Object target) {
        if (!(target instanceof IlObject)) {
            throw new IlHostException("Property '" + getName() + "' requires an instance target");
        }
        return (IlObject) target;
    }
}
