package common.exception;

/**
 * 远程订单服务调用异常
 * message 保留远程返回的原始错误信息 供操作员直接查看
 */
public class RemoteServiceException extends RuntimeException {
    // HTTP 状态码 网络异常时为 0
    private final int httpStatus;

    public RemoteServiceException(String message, int httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public RemoteServiceException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
