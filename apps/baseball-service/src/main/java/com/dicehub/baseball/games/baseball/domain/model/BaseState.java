package com.dicehub.baseball.games.baseball.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 垒包占用情况（一垒、二垒、三垒）
 */
public record BaseState(boolean first, boolean second, boolean third) {

    public static final BaseState EMPTY = new BaseState(false, false, false);
    public static final BaseState LOADED = new BaseState(true, true, true);

    @JsonIgnore
    public int runnersOn() {
        return (first ? 1 : 0) + (second ? 1 : 0) + (third ? 1 : 0);
    }

    @JsonIgnore
    public boolean isLoaded() {
        return first && second && third;
    }
}
