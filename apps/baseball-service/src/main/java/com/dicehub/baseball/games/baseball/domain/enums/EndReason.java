package com.dicehub.baseball.games.baseball.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局结束原因
 */
public enum EndReason {

    /** 正常打完 */
    COMPLETED("completed"),
    /** 主动认输 */
    FORFEIT("forfeit"),
    /** 断线超时判负 */
    DISCONNECT_TIMEOUT("disconnect_timeout"),
    /** 创建者取消 */
    ABANDONED("abandoned");

    private final String wireName;

    EndReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 该原因对应的会话终态 */
    public SessionStatus terminalStatus() {
        switch (this) {
            case COMPLETED:
                return SessionStatus.COMPLETED;
            case ABANDONED:
                return SessionStatus.ABANDONED;
            default:
                return SessionStatus.FORFEIT;
        }
    }
}
