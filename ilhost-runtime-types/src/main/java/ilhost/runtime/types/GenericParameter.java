package ilhost.runtime.types;

/**
 * 绑定到所属类型的具名泛型参数。
 *
 * <p>在闭包类型的泛型绑定表中按 {@link #getKey()} 查找实参；解析只产生新引用，从不修改自身。</p>
 */
public final class GenericParameter implements TypeReference {

    private final String name;
    private final String ownerName;
    private final String key;
    private final LoadUnit context;
    private volatile String typeId;

    public GenericParameter(String name, String ownerName, LoadUnit context) {
        this.name = name;
        this.ownerName = ownerName;
        this.key = Names.escape(ownerName) + "$" + Names.escape(name);
        this.context = context;
    }

    public String getName() {
        return name;
    }

    public String getOwnerName() {
        return ownerName;
    }

    /** 绑定表键：转义的所属类型名 + "$" + 参数名 */
    public String getKey() {
        return key;
    }

    @Override
    public String typeId() {
        String id = typeId;
        if (id == null) {
            id = context.getRuntime().genericParameterId(key);
            typeId = id;
        }
        return id;
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public String toString() {
        return "<GP " + ownerName + "." + name + ">";
    }
}
