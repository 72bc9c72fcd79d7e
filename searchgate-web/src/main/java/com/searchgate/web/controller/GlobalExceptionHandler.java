package com.searchgate.web.controller;

import com.searchgate.common.dto.ApiResponse;
import com.searchgate.common.exception.InvalidRequestException;
import com.searchgate.common.exception.NoEligibleKeyException;
import com.searchgate.common.exception.NotFoundException;
import com.searchgate.common.exception.SearchGateException;
import com.searchgate.common.exception.UnauthorizedException;
import com.searchgate.common.exception.UpstreamException;
import com.searchgate.common.exception.UsageSyncException;
import com.searchgate.dispatcher.quota.QuotaVerdict;
import com.searchgate.dispatcher.quota.TokenQuotaExceededException;
import com.searchgate.dispatcher.quota.WindowUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 令牌超额：返回超限窗口及三个窗口的用量，方便调用方退避。
     */
    @ExceptionHandler(TokenQuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTokenQuota(TokenQuotaExceededException e) {
        QuotaVerdict verdict = e.getVerdict();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "quota_exceeded");
        body.put("message", e.getMessage());
        body.put("window", verdict.quotaState());
        body.put("hourly", usage(verdict.getHourly()));
        body.put("daily", usage(verdict.getDaily()));
        body.put("monthly", usage(verdict.getMonthly()));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }

    @ExceptionHandler(NoEligibleKeyException.class)
    public ResponseEntity<Map<String, Object>> handleNoEligibleKey(NoEligibleKeyException e) {
        log.warn("没有可用 Key: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "quota_exhausted");
        body.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }

    @ExceptionHandler(UnauthorizedException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ApiResponse<Void> handleUnauthorized(UnauthorizedException e) {
        log.debug("鉴权失败: {}", e.getMessage());
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNotFound(NotFoundException e) {
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({UpstreamException.class, UsageSyncException.class})
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ApiResponse<Void> handleUpstream(SearchGateException e) {
        log.warn("上游调用失败: [{}] {}", e.getErrorCode(), e.getMessage());
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleInvalid(InvalidRequestException e) {
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(SearchGateException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleSearchGateException(SearchGateException e) {
        log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleBadParameter(Exception e) {
        return ApiResponse.error("INVALID_REQUEST", "请求参数不合法: " + e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNoResourceFound(NoResourceFoundException e) {
        log.debug("资源未找到: {}", e.getResourcePath());
        return ApiResponse.error("NOT_FOUND", "资源不存在");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ApiResponse.error("SYSTEM_ERROR", "系统内部错误，请稍后重试");
    }

    private static Map<String, Object> usage(WindowUsage usage) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("limit", usage.getLimit());
        m.put("used", usage.getUsed());
        m.put("reset_at", usage.getResetAt());
        return m;
    }
}
