package ilhost.runtime;

/**
 * 值无法转换为目标类型
 */
public class InvalidCastException extends IlHostException {

    public InvalidCastException(String message) {
        super(message);
    }

    public InvalidCastException(String message, Throwable cause) {
        super(message, cause);
    }
}
