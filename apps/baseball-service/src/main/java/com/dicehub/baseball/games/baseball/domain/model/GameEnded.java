package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.enums.EndReason;

/**
 * 对局结束结果
 *
 * @param visitorScore 最终比分（客队）
 * @param homeScore    最终比分（主队）
 */
public record GameEnded(
        String sessionId,
        String winnerId,
        String loserId,
        EndReason reason,
        int visitorScore,
        int homeScore
) {
}
