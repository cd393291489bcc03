package com.dicehub.baseball.games.baseball.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 对局会话生命周期。
 * WAITING → ACTIVE | ABANDONED；ACTIVE → COMPLETED | FORFEIT | ABANDONED；终态不可再迁移。
 */
public enum SessionStatus {

    WAITING("waiting"),
    ACTIVE("active"),
    COMPLETED("completed"),
    FORFEIT("forfeit"),
    ABANDONED("abandoned");

    /** 创建/加入前检查“已有对局”时使用的状态集合 */
    public static final Set<SessionStatus> LIVE = EnumSet.of(WAITING, ACTIVE);

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FORFEIT || this == ABANDONED;
    }

    public boolean canTransitionTo(SessionStatus next) {
        switch (this) {
            case WAITING:
                return next == ACTIVE || next == ABANDONED;
            case ACTIVE:
                return next == COMPLETED || next == FORFEIT || next == ABANDONED;
            default:
                return false;
        }
    }
}
