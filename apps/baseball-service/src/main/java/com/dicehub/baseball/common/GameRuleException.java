package com.dicehub.baseball.common;

/**
 * 对局规则/状态校验失败。
 * 抛出时会话状态保持不变；调用方按错误码决定 HTTP 状态或 WS error 事件。
 */
public class GameRuleException extends IllegalStateException {

    private final ErrorCode errorCode;

    public GameRuleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GameRuleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
