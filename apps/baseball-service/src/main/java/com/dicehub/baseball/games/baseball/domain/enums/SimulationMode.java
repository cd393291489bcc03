package com.dicehub.baseball.games.baseball.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 随机模式：default 为实时随机，deterministic 为带种子的可复现模式
 */
public enum SimulationMode {

    DEFAULT("default"),
    DETERMINISTIC("deterministic");

    private final String wireName;

    SimulationMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
