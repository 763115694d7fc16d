package ilhost.runtime.types;

/**
 * 注册期收集的原始成员记录
 */
public abstract class MemberRecord {

    private final MemberKind kind;
    private final MemberDescriptor descriptor;
    private final TypeDescriptor declaringType;

    protected MemberRecord(MemberKind kind, MemberDescriptor descriptor, TypeDescriptor declaringType) {
        this.kind = kind;
        this.descriptor = descriptor;
        this.declaringType = declaringType;
    }

    public MemberKind getKind() {
        return kind;
    }

    public MemberDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.getName();
    }

    public TypeDescriptor getDeclaringType() {
        return declaringType;
    }

    public boolean isStatic() {
        return descriptor.isStatic();
    }

    public boolean isPublic() {
        return descriptor.isPublic();
    }

    @Override
    public String toString() {
        return kind + " " + declaringType.getFullName() + "::" + descriptor.getName();
    }
}
