package ilhost.runtime;

/**
 * 命名空间路径中某一段无法解析
 */
public class NameResolutionException extends IlHostException {

    public NameResolutionException(String message) {
        super(message);
    }

    public NameResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
