package common.exception;

/**
 * 业务异常
 * 请求层面的拒绝，消息直接返回给调用方
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
