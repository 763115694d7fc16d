package ilhost.runtime.types;

/** 类型种类 */
public enum TypeKind {
    CLASS,
    STRUCT,
    INTERFACE,
    ENUM,
    STATIC_CLASS,
    DELEGATE,
    ARRAY,
    /** 任意值都通过检查的伪类型 */
    ANY;

    /** 能否作为 {@code new} 的目标 */
    public boolean isConstructible() {
        return this == CLASS || this == STRUCT;
    }
}
