package ilhost.runtime.types;

/**
 * 方法或构造器记录。实现按 {@link #getMangledName()} 存放在声明类型的成员表中。
 */
public final class MethodRecord extends MemberRecord {

    private final MethodSignature signature;
    private final String mangledName;
    private final boolean external;
    private volatile boolean placeholder;

    public MethodRecord(MemberDescriptor descriptor, TypeDescriptor declaringType,
                        MethodSignature signature, boolean external) {
        super(Names.isConstructorName(descriptor.getName()) ? MemberKind.CONSTRUCTOR : MemberKind.METHOD,
                descriptor, declaringType);
        this.signature = signature;
        this.mangledName = signature.key(descriptor.getEscapedName());
        this.external = external;
    }

    public MethodSignature getSignature() {
        return signature;
    }

    public String getMangledName() {
        return mangledName;
    }

    public boolean isExternal() {
        return external;
    }

    /** 当前实现是否仍是未提供原生实现的占位 */
    public boolean isPlaceholder() {
        return placeholder;
    }

    public void setPlaceholder(boolean placeholder) {
        this.placeholder = placeholder;
    }

    public String describe() {
        return signature.describe(getDeclaringType().getFullName() + "::" + getName());
    }
}
