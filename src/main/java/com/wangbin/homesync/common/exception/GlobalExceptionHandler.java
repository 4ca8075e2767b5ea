package com.wangbin.homesync.common.exception;

import com.wangbin.homesync.common.web.result.ApiResult;
import com.wangbin.homesync.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理同步异常
     */
    @ExceptionHandler(SyncException.class)
    public ApiResult<?> handleSyncException(SyncException e, HttpServletRequest request) {
        log.error("同步异常 - 类型: {}, 设备: {}, 信息: {}", e.getErrorType(), e.getDeviceId(), e.getMessage());
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("errorType", e.getErrorType().name());
        if (e.getDeviceId() != null) {
            result.addExtra("deviceId", e.getDeviceId());
        }
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.warn("业务异常: {} - {}", e.getCode(), e.getMessage());
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理请求体解析异常
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ApiResult<?> handleMessageNotReadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("请求体解析失败: {} {}", request.getRequestURI(), e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), "请求体格式错误");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ApiResult<?> handleMissingParameter(MissingServletRequestParameterException e, HttpServletRequest request) {
        log.warn("缺少请求参数: {}", e.getParameterName());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), "缺少请求参数: " + e.getParameterName());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        String requestURI = request.getRequestURI();
        String method = request.getMethod();

        log.error("请求地址: {}, 请求方法: {}, 异常信息: {}", requestURI, method, e.getMessage(), e);

        // 生产环境隐藏详细错误信息
        String message = "系统内部错误，请联系管理员";
        if (isDevEnvironment()) {
            message = e.getMessage();
        }
        return ApiResult.error(ResultCode.SYSTEM_ERROR.getCode(), message);
    }

    /**
     * 判断是否为开发环境
     */
    private boolean isDevEnvironment() {
        String activeProfile = System.getProperty("spring.profiles.active");
        return "dev".equals(activeProfile) || "test".equals(activeProfile);
    }
}
