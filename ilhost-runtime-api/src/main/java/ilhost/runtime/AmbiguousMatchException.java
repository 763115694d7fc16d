package ilhost.runtime;

/**
 * 反射按名称查找成员时匹配到多个结果
 */
public class AmbiguousMatchException extends IlHostException {

    public AmbiguousMatchException(String message) {
        super(message);
    }
}
