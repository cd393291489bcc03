package com.dicehub.baseball.games.baseball.domain.enums;

/**
 * 局面状态机的三个状态
 */
public enum InningPhase {
    TOP_HALF,
    BOTTOM_HALF,
    GAME_OVER
}
