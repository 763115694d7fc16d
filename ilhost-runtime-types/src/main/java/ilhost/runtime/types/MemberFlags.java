package ilhost.runtime.types;

/**
 * 成员的静态/公开标志
 */
public final class MemberFlags {

    public static final MemberFlags PUBLIC_INSTANCE = new MemberFlags(false, true);
    public static final MemberFlags PUBLIC_STATIC = new MemberFlags(true, true);
    public static final MemberFlags PRIVATE_INSTANCE = new MemberFlags(false, false);
    public static final MemberFlags PRIVATE_STATIC = new MemberFlags(true, false);

    private final boolean isStatic;
    private final boolean isPublic;

    private MemberFlags(boolean isStatic, boolean isPublic) {
        this.isStatic = isStatic;
        this.isPublic = isPublic;
    }

    public static MemberFlags of(boolean isStatic, boolean isPublic) {
        if (isStatic) return isPublic ? PUBLIC_STATIC : PRIVATE_STATIC;
        return isPublic ? PUBLIC_INSTANCE : PRIVATE_INSTANCE;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isPublic() {
        return isPublic;
    }

    @Override
    public String toString() {
        return (isPublic ? "public" : "private") + (isStatic ? " static" : "");
    }
}
