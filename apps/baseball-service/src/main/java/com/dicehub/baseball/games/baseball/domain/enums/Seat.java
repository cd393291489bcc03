package com.dicehub.baseball.games.baseball.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 座位：创建者为主队（HOME），加入者为客队（VISITOR）
 */
public enum Seat {

    HOME("home"),
    VISITOR("visitor");

    private final String wireName;

    Seat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Seat opponent() {
        return this == HOME ? VISITOR : HOME;
    }
}
