package com.dicehub.baseball.games.baseball.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 半局：上半局客队进攻，下半局主队进攻
 */
public enum Half {

    TOP("top"),
    BOTTOM("bottom");

    private final String wireName;

    Half(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 该半局的进攻方 */
    public Seat battingSeat() {
        return this == TOP ? Seat.VISITOR : Seat.HOME;
    }
}
