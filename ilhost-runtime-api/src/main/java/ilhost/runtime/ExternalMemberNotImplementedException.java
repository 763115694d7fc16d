package ilhost.runtime;

/**
 * 调用了尚未提供原生实现的外部成员占位
 */
public class ExternalMemberNotImplementedException extends IlHostException {

    public ExternalMemberNotImplementedException(String message) {
        super(message);
    }

    public ExternalMemberNotImplementedException(String message, Throwable cause) {
        super(message, cause);
    }
}
