package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BaseState;

/**
 * 跑垒结果
 */
public record BaseAdvance(BaseState bases, int runsScored) {
}
