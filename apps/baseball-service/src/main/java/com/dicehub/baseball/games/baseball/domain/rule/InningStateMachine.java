package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.enums.Half;
import com.dicehub.baseball.games.baseball.domain.model.GameState;

/**
 * 局数状态机：TOP_HALF ⇄ BOTTOM_HALF → GAME_OVER。
 *
 * 每个打席后调用一次：
 * - 下半局、第 9 局及以后主队领先：立即结束（再见安打），不必打满三出局；
 * - 否则出局数到 3：清垒、出局归零；上半局换下半局；
 *   下半局且第 9 局及以后比分不同则结束，否则进入下一局上半（平局继续延长）。
 */
public final class InningStateMachine {

    public static final int REGULATION_INNINGS = 9;
    public static final int OUTS_PER_HALF = 3;

    private InningStateMachine() {
    }

    /**
     * @param state        已更新垒况的局面
     * @param outsRecorded 本打席出局数
     * @param runsScored   本打席得分（记给进攻方）
     */
    public static GameState apply(GameState state, int outsRecorded, int runsScored) {
        if (state.gameOver()) {
            throw new IllegalStateException("game is already over");
        }
        GameState next = state.withRunsForBattingTeam(runsScored);

        if (isWalkOff(next)) {
            return next.finished(next.leader());
        }

        int outs = next.outs() + outsRecorded;
        if (outs < OUTS_PER_HALF) {
            return next.withOuts(outs);
        }

        if (next.half() == Half.TOP) {
            return next.nextHalf(next.inning(), Half.BOTTOM);
        }
        GameState cleared = next.nextHalf(next.inning(), Half.BOTTOM);
        if (next.inning() >= REGULATION_INNINGS && next.leader() != null) {
            return cleared.finished(next.leader());
        }
        return next.nextHalf(next.inning() + 1, Half.TOP);
    }

    private static boolean isWalkOff(GameState state) {
        return state.half() == Half.BOTTOM
                && state.inning() >= REGULATION_INNINGS
                && state.homeScore() > state.visitorScore();
    }
}
