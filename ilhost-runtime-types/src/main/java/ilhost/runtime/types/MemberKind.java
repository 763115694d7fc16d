package ilhost.runtime.types;

/** 成员种类 */
public enum MemberKind {
    FIELD,
    METHOD,
    CONSTRUCTOR,
    PROPERTY
}
