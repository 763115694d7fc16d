package ilhost.runtime.types;

/**
 * 签名与声明中出现的类型引用：已解析的类型、前向引用或泛型参数。
 */
public interface TypeReference {

    /** 标识键，签名哈希由它拼接而成 */
    String typeId();

    /** 诊断用的可读名称 */
    String displayName();
}
