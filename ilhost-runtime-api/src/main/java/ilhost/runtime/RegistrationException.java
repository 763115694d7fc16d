package ilhost.runtime;

/**
 * 注册调用格式错误（缺少 thunk、空名称、对已初始化类型追加外部实现等）
 */
public class RegistrationException extends IlHostException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
