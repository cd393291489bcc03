package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.engine.random.RandomSource;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.LineupSlot;
import com.dicehub.baseball.games.baseball.domain.model.TeamLineup;

/**
 * 打席流水线：结果引擎 → 跑垒 → 局数状态机 → 文字播报。
 * 随机源的消耗顺序固定（先抽结果，再挑描述），保证带种子的对局可复现。
 */
public class AtBatResolver {

    private final OutcomeEngine outcomeEngine;

    public AtBatResolver(OutcomeEngine outcomeEngine) {
        this.outcomeEngine = outcomeEngine;
    }

    public OutcomeEngine getOutcomeEngine() {
        return outcomeEngine;
    }

    /**
     * @param batting  进攻方打线
     * @param fielding 防守方（提供投手）
     */
    public PlayResult play(GameState state, TeamLineup batting, TeamLineup fielding,
                           DiceRoll dice, RandomSource random) {
        LineupSlot slot = batting.batterAt(state.battingIndexOf(state.battingSeat()));

        Outcome outcome = outcomeEngine.resolve(slot.batting(), fielding.pitching(), dice, random.nextDouble());
        BaseAdvance advance = BaseRunningResolver.advance(state.bases(), outcome);

        GameState moved = state.withBases(advance.bases()).withNextBatter();
        GameState next = InningStateMachine.apply(moved, outcome.outsRecorded(), advance.runsScored());

        String description = PlayDescriber.describe(outcome, slot.player().name(),
                fielding.startingPitcher().name(), advance.runsScored(), random);
        return new PlayResult(dice, outcome, advance.runsScored(), outcome.outsRecorded(), description,
                slot.player(), fielding.startingPitcher(), next);
    }
}
