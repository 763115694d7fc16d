package ilhost.runtime.types;

/**
 * 成员描述：原名、转义名、静态/公开标志、是否特殊名称。
 */
public final class MemberDescriptor {

    private final String name;
    private final String escapedName;
    private final boolean isStatic;
    private final boolean isPublic;
    private final boolean specialName;

    public MemberDescriptor(String name, MemberFlags flags) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("member name must not be empty");
        }
        this.name = name;
        this.escapedName = Names.escape(name);
        this.isStatic = flags.isStatic();
        this.isPublic = flags.isPublic();
        this.specialName = Names.isSpecialName(name);
    }

    public String getName() { return name; }
    public String getEscapedName() { return escapedName; }
    public boolean isStatic() { return isStatic; }
    public boolean isPublic() { return isPublic; }
    public boolean isSpecialName() { return specialName; }

    /** 方法组分区键 */
    public String partitionKey() {
        return (isStatic ? "static$" : "instance$") + escapedName;
    }

    @Override
    public String toString() {
        return MemberFlags.of(isStatic, isPublic) + " " + name;
    }
}
