package ilhost.runtime;

/**
 * 类型构造过程中再次访问自身绑定
 */
public class RecursiveConstructionException extends IlHostException {

    public RecursiveConstructionException(String message) {
        super(message);
    }

    public RecursiveConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
