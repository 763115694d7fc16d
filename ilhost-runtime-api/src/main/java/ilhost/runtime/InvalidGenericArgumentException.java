package ilhost.runtime;

/**
 * 泛型实参数量错误或实参为空
 */
public class InvalidGenericArgumentException extends IlHostException {

    public InvalidGenericArgumentException(String message) {
        super(message);
    }

    public InvalidGenericArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
