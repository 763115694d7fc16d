package ilhost.runtime.types;

/**
 * 接口声明的成员：方法带签名，属性不带。
 */
public final class InterfaceMember {

    private final String name;
    private final MemberKind kind;
    private final MethodSignature signature;

    public InterfaceMember(String name, MemberKind kind, MethodSignature signature) {
        this.name = name;
        this.kind = kind;
        this.signature = signature;
    }

    public String getName() { return name; }
    public MemberKind getKind() { return kind; }
    public MethodSignature getSignature() { return signature; }

    @Override
    public String toString() {
        return signature == null ? name : signature.describe(name);
    }
}
