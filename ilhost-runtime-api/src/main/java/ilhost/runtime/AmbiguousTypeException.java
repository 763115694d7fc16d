package ilhost.runtime;

/**
 * 公共名称在多个加载单元中定义，必须通过具体加载单元访问
 */
public class AmbiguousTypeException extends IlHostException {

    public AmbiguousTypeException(String message) {
        super(message);
    }

    public AmbiguousTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
