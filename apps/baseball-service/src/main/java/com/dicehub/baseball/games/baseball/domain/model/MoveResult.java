package com.dicehub.baseball.games.baseball.domain.model;

/**
 * 走子结果：更新后的会话快照、本次走子记录，以及对局因此结束时的结果（否则为 null）
 */
public record MoveResult(GameSession session, Move move, GameEnded ended) {

    public boolean gameEnded() {
        return ended != null;
    }
}
