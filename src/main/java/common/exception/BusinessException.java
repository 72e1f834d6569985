package common.exception;

/**
 * 业务异常 请求参数或业务规则校验失败时抛出
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
