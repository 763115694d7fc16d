package ilhost.runtime.types;

/**
 * 方法级的位置泛型参数 {@code !!N}，只在调用时由调用方提供的泛型实参解析。
 */
public final class PositionalGenericParameter implements TypeReference {

    private final int index;
    private final String id;

    public PositionalGenericParameter(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        this.index = index;
        this.id = "!!" + index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String typeId() {
        return id;
    }

    @Override
    public String displayName() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
