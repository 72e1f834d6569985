package common.exception;

import common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.dispatch.BatchErrorLog;

/**
 * 全局异常处理器
 * 单行错误已在编排层转换为行结果 能到这里的只有请求级错误 (参数错误 快照拉取失败等)
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final BatchErrorLog errorLog;

    public GlobalExceptionHandler(BatchErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result<Void> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return Result.badRequest(e.getMessage());
    }

    /**
     * 处理订单服务异常 (批次开始前的快照拉取)
     */
    @ExceptionHandler(RemoteServiceException.class)
    public Result<Void> handleRemoteException(RemoteServiceException e) {
        log.error("订单服务异常: status={}, message={}", e.getHttpStatus(), e.getMessage());
        errorLog.recordRequestError("订单服务异常: " + e.getMessage(), e);
        return Result.badGateway("订单服务异常: " + e.getMessage());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result<Void> handleException(Exception e) {
        log.error("系统异常", e);
        errorLog.recordRequestError("系统异常: " + e.getClass().getSimpleName(), e);
        return Result.error("系统内部错误: " + e.getMessage());
    }
}
