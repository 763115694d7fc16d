package ilhost.runtime.typesystem;

import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;
import ilhost.runtime.NoApplicableOverloadException;
import ilhost.runtime.types.FieldRecord;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.Objects;

/**
 * 实例构造与结构值语义。
 */
final class Instances {

    private final TypeSystem system;

    Instances(TypeSystem system) {
        this.system = system;
    }

    IlObject construct(TypeDescriptor type, Object[] args) {
        Object[] arguments = args == null ? new Object[0] : args;
        if (type.isInterface()) {
            throw new IlHostException("Cannot construct an instance of an interface");
        }
        if (type.getKind() == TypeKind.STATIC_CLASS) {
            throw new IlHostException("Cannot construct an instance of a static class");
        }
        if (type.isGenericDefinition() || !type.isClosed()) {
            throw new IlHostException("Cannot construct an instance of an open type");
        }
        if (!type.getKind().isConstructible()) {
            throw new IlHostException("Cannot construct an instance of type '" + type.getFullName()
                    + "' of kind " + type.getKind());
        }
        system.initialize(type);

        IlObject instance = new IlObject(type.getPublicInterface().getTemplate());
        populateStructFields(type, instance);
        if (type.getKind() == TypeKind.STRUCT && arguments.length == 0) {
            return instance;
        }
        Object constructor = type.getPublicInterface().getTemplate().lookup("_ctor");
        if (constructor instanceof Invokable) {
            ((Invokable) constructor).invoke(instance, arguments);
        } else if (arguments.length > 0) {
            throw NoApplicableOverloadException.noArity(type.getFullName() + "::.ctor", arguments.length,
                    Collections.<String>emptyList());
        }
        return instance;
    }

    /** 值类型字段每个实例各有一份新的结构值 */
    private void populateStructFields(TypeDescriptor type, IlObject instance) {
        for (TypeDescriptor t = type; t != null; t = t.getBaseType()) {
            for (MemberRecord record : t.getMembers()) {
                if (!(record instanceof FieldRecord) || record.isStatic()) continue;
                FieldRecord field = (FieldRecord) record;
                if (field.getDefaultValue() != null) continue;
                TypeDescriptor fieldType = system.closure().resolveDescriptor(field.getFieldType(), t);
                if (fieldType != null && fieldType.getKind() == TypeKind.STRUCT && fieldType != type
                        && !system.checks().hasPrimitiveDefault(fieldType)) {
                    instance.set(record.getName(), construct(fieldType, new Object[0]));
                }
            }
        }
    }

    /** 同类型的结构按字段逐一比较（未写过的字段取模板默认值），嵌套结构递归比较 */
    boolean structEquals(Object a, Object b) {
        if (a == b) return true;
        if (!(a instanceof IlObject) || !(b instanceof IlObject)) return Objects.equals(a, b);
        IlObject left = (IlObject) a;
        IlObject right = (IlObject) b;
        if (left.getType() != right.getType() || left.getType() == null || left.getType().isReferenceType()) {
            return false;
        }
        Set<String> names = new LinkedHashSet<>(left.getFields().keySet());
        names.addAll(right.getFields().keySet());
        for (String name : names) {
            Object mine = left.get(name);
            Object other = right.get(name);
            if (mine instanceof IlObject && other instanceof IlObject) {
                if (!structEquals(mine, other)) return false;
            } else if (!Objects.equals(mine, other)) {
                return false;
            }
        }
        return true;
    }
}
