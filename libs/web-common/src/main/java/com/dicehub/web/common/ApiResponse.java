package com.dicehub.web.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    /**
     * 响应状态码（与 HTTP 状态一致）
     * 200 成功 / 400 参数错误 / 403 无权限 / 404 不存在 / 409 业务冲突 / 500 服务器错误
     */
    int code,

    /**
     * 业务错误码（如 not_your_turn），成功时为空
     */
    String error,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, null, "success", data);
    }

    /**
     * 失败响应，带业务错误码
     */
    public static <T> ApiResponse<T> error(int code, String error, String message) {
        return new ApiResponse<>(code, error, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, "validation_error", message, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, "conflict", message, null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, "internal_error", message, null);
    }

    /**
     * 是否成功（code == 200）
     */
    @JsonIgnore
    public boolean isSuccess() {
        return code == 200;
    }
}
