package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.enums.Half;
import com.dicehub.baseball.games.baseball.domain.rule.Outcome;

/**
 * 走子记录（追加写入，创建后不再修改）
 *
 * @param moveNumber     对局内序号，从 1 开始
 * @param userId         掷骰的用户
 * @param inning         打席发生时的局数
 * @param half           打席发生时的半局
 * @param resultingState 打席后的局面快照
 * @param createdAt      epoch ms
 */
public record Move(
        int moveNumber,
        String userId,
        int inning,
        Half half,
        DiceRoll diceRoll,
        Outcome outcome,
        int runsScored,
        int outsRecorded,
        String description,
        PlayerRef batter,
        PlayerRef pitcher,
        GameState resultingState,
        long createdAt
) {
}
