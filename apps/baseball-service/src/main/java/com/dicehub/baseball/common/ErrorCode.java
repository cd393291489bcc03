package com.dicehub.baseball.common;

import org.springframework.http.HttpStatus;

/**
 * 业务错误码，对外（REST 响应与 WS error 事件）使用 {@link #code()} 的小写形式。
 */
public enum ErrorCode {

    SESSION_NOT_FOUND("session_not_found", HttpStatus.NOT_FOUND),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN),
    NOT_YOUR_TURN("not_your_turn", HttpStatus.CONFLICT),
    INVALID_STATE("invalid_state", HttpStatus.CONFLICT),
    SELF_JOIN("self_join", HttpStatus.CONFLICT),
    CONFLICT("conflict", HttpStatus.CONFLICT),
    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
