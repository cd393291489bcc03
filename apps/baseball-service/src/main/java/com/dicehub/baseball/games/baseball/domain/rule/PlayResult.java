package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.PlayerRef;

/**
 * 单个打席的完整结果
 */
public record PlayResult(
        DiceRoll diceRoll,
        Outcome outcome,
        int runsScored,
        int outsRecorded,
        String description,
        PlayerRef batter,
        PlayerRef pitcher,
        GameState newState
) {
}
