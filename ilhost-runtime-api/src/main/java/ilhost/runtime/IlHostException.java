package ilhost.runtime;

/**
 * IlHost 类型模型的基础运行时异常。
 *
 * <p>所有注册、解析、闭包、分派、转换错误都继承此类，
 * 调用方可以统一捕获。</p>
 */
public class IlHostException extends RuntimeException {

    public IlHostException(String message) {
        super(message);
    }

    public IlHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
