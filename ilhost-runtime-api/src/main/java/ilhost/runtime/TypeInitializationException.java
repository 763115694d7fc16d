package ilhost.runtime;

/**
 * 类型构造器或初始化器抛出异常。
 *
 * <p>失败的绑定不会缓存半成品，之后每次访问都会重新抛出此异常。</p>
 */
public class TypeInitializationException extends IlHostException {

    private final String typeName;

    public TypeInitializationException(String typeName, Throwable cause) {
        super("Type initialization failed for '" + typeName + "'", cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
