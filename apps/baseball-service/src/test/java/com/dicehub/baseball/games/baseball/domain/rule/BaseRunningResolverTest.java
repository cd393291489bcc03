package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BaseState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BaseRunningResolverTest {

    private static final BaseState FIRST = new BaseState(true, false, false);
    private static final BaseState FIRST_AND_THIRD = new BaseState(true, false, true);
    private static final BaseState SECOND_AND_THIRD = new BaseState(false, true, true);

    // ── home run / triple ───────────────────────────────────────────────────

    @Test
    void soloHomeRunScoresOne() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.EMPTY, Outcome.HOME_RUN);
        assertThat(a.bases()).isEqualTo(BaseState.EMPTY);
        assertThat(a.runsScored()).isEqualTo(1);
    }

    @Test
    void grandSlamClearsBases() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.LOADED, Outcome.HOME_RUN);
        assertThat(a.bases()).isEqualTo(BaseState.EMPTY);
        assertThat(a.runsScored()).isEqualTo(4);
    }

    @Test
    void tripleScoresEveryRunnerAndLeavesBatterOnThird() {
        BaseAdvance a = BaseRunningResolver.advance(FIRST_AND_THIRD, Outcome.TRIPLE);
        assertThat(a.bases()).isEqualTo(new BaseState(false, false, true));
        assertThat(a.runsScored()).isEqualTo(2);
    }

    // ── double / single ─────────────────────────────────────────────────────

    @Test
    void doubleScoresFromSecondAndSendsFirstToThird() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.LOADED, Outcome.DOUBLE);
        assertThat(a.bases()).isEqualTo(new BaseState(false, true, true));
        assertThat(a.runsScored()).isEqualTo(2);
    }

    @Test
    void doubleWithEmptyBases() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.EMPTY, Outcome.DOUBLE);
        assertThat(a.bases()).isEqualTo(new BaseState(false, true, false));
        assertThat(a.runsScored()).isZero();
    }

    @Test
    void singleScoresRunnerFromThirdOnly() {
        BaseAdvance a = BaseRunningResolver.advance(SECOND_AND_THIRD, Outcome.SINGLE);
        assertThat(a.bases()).isEqualTo(new BaseState(true, false, true));
        assertThat(a.runsScored()).isEqualTo(1);
    }

    @Test
    void singleWithLoadedBases() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.LOADED, Outcome.SINGLE);
        assertThat(a.bases()).isEqualTo(BaseState.LOADED);
        assertThat(a.runsScored()).isEqualTo(1);
    }

    // ── walk ────────────────────────────────────────────────────────────────

    @Test
    void walkOnlyPushesForcedRunners() {
        BaseAdvance a = BaseRunningResolver.advance(new BaseState(false, true, false), Outcome.WALK);
        assertThat(a.bases()).isEqualTo(new BaseState(true, true, false));
        assertThat(a.runsScored()).isZero();
    }

    @Test
    void walkWithCornersOccupiedLoadsBases() {
        BaseAdvance a = BaseRunningResolver.advance(FIRST_AND_THIRD, Outcome.WALK);
        assertThat(a.bases()).isEqualTo(BaseState.LOADED);
        assertThat(a.runsScored()).isZero();
    }

    @Test
    void basesLoadedWalkForcesInARun() {
        BaseAdvance a = BaseRunningResolver.advance(BaseState.LOADED, Outcome.WALK);
        assertThat(a.bases()).isEqualTo(BaseState.LOADED);
        assertThat(a.runsScored()).isEqualTo(1);
    }

    // ── outs ────────────────────────────────────────────────────────────────

    @Test
    void outsLeaveRunnersInPlace() {
        for (Outcome out : new Outcome[]{Outcome.STRIKEOUT, Outcome.GROUND_OUT, Outcome.FLY_OUT}) {
            BaseAdvance a = BaseRunningResolver.advance(FIRST_AND_THIRD, out);
            assertThat(a.bases()).isEqualTo(FIRST_AND_THIRD);
            assertThat(a.runsScored()).isZero();
        }
    }

    @Test
    void runnersOnCountsOccupiedBases() {
        assertThat(FIRST.runnersOn()).isEqualTo(1);
        assertThat(BaseState.LOADED.isLoaded()).isTrue();
    }
}
