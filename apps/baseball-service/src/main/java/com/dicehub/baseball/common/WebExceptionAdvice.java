package com.dicehub.baseball.common;

import com.dicehub.web.common.ApiResponse;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 规则校验异常：按错误码映射 HTTP 状态。
     */
    @ExceptionHandler(GameRuleException.class)
    public ResponseEntity<ApiResponse<Object>> rule(GameRuleException e) {
        ErrorCode code = e.getErrorCode();
        if (code == ErrorCode.INTERNAL_ERROR) {
            log.error("内部错误: {}", e.getMessage(), e);
        }
        return ResponseEntity.status(code.status())
                .body(ApiResponse.error(code.status().value(), code.code(), e.getMessage()));
    }

    /**
     * 参数不合法（IllegalArgumentException），HTTP 400。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest("请求体格式错误"));
    }

    /**
     * 业务状态冲突（IllegalStateException），HTTP 409。
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 存储 / 下游服务故障：记录日志，对外只返回通用错误。
     */
    @ExceptionHandler({DataAccessException.class, FeignException.class})
    public ResponseEntity<ApiResponse<Object>> infrastructure(RuntimeException e) {
        log.error("基础设施调用失败", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError("服务暂时不可用，请稍后重试"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> unexpected(Exception e) {
        log.error("未处理的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError("服务器内部错误，请稍后再试"));
    }
}
