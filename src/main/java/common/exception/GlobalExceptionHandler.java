package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.route.impl.RouteErrorLog;

/**
 * 全局异常处理器
 * 捕获所有异常，记录日志，并以 Result 返回给调用方
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final RouteErrorLog errorLog;

    public GlobalExceptionHandler(RouteErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        errorLog.recordUnexpectedError("业务异常: " + e.getMessage(), e);
        return Result.error(400, e.getMessage());
    }

    /**
     * 请求体不是合法 JSON 或字段类型不匹配
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("请求体解析失败: {}", e.getMessage());
        return Result.error(400, ErrorCodes.MALFORMED_BODY);
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        errorLog.recordUnexpectedError("系统异常: " + e.getClass().getSimpleName(), e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
