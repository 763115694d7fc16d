package ilhost.runtime;

/**
 * 同一加载单元内重复定义同名类型（非致命，先定义者生效）
 */
public class DuplicateDefinitionException extends IlHostException {

    public DuplicateDefinitionException(String message) {
        super(message);
    }

    public DuplicateDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
