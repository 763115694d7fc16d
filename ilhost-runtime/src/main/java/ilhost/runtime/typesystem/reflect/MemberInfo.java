package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.typesystem.TypeSystem;

/**
 * 反射成员的公共部分。声明类型是继承链上找到该成员的类型（闭包类型时为闭包实例化）。
 */
public abstract class MemberInfo {

    protected final TypeSystem system;
    private final TypeDescriptor declaringType;
    private final MemberRecord record;

    protected MemberInfo(TypeSystem system, TypeDescriptor declaringType, MemberRecord record) {
        this.system = system;
        this.declaringType = declaringType;
        this.record = record;
    }

    public String getName() {
        return record.getName();
    }

    public TypeDescriptor getDeclaringType() {
        return declaringType;
    }

    public boolean isStatic() {
        return record.isStatic();
    }

    public boolean isPublic() {
        return record.isPublic();
    }

    public MemberKind getMemberKind() {
        return record.getKind();
    }

    public MemberRecord getRecord() {
        return record;
    }

    @Override
    public String toString() {
        return declaringType.getFullName() + "::" + getName();
    }
}
