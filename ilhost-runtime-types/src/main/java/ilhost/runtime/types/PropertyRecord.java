package ilhost.runtime.types;

/**
 * 属性记录。访问器是同一成员表中的 {@code get_Name} / {@code set_Name}。
 */
public final class PropertyRecord extends MemberRecord {

    private final TypeReference propertyType;

    public PropertyRecord(MemberDescriptor descriptor, TypeDescriptor declaringType, TypeReference propertyType) {
        super(MemberKind.PROPERTY, descriptor, declaringType);
        this.propertyType = propertyType;
    }

    public TypeReference getPropertyType() {
        return propertyType;
    }

    /** 显式接口实现的属性名 "IFoo.Bar" 的访问器为 "IFoo.get_Bar" */
    public String getterName() {
        return accessorName("get_");
    }

    public String setterName() {
        return accessorName("set_");
    }

    private String accessorName(String prefix) {
        String name = getName();
        String local = Names.localName(name);
        String parent = Names.parentName(name);
        return Names.escape(parent.isEmpty() ? prefix + local : parent + "." + prefix + local);
    }
}
