package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.enums.Half;
import com.dicehub.baseball.games.baseball.domain.enums.InningPhase;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.model.BaseState;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InningStateMachineTest {

    private static GameState state(int inning, Half half, int outs, int visitor, int home, BaseState bases) {
        return new GameState(inning, half, outs, visitor, home, bases, 0, 0, false, null);
    }

    // ── outs within a half ──────────────────────────────────────────────────

    @Test
    void outAccumulatesWithinHalf() {
        GameState next = InningStateMachine.apply(GameState.initial(), 1, 0);
        assertThat(next.outs()).isEqualTo(1);
        assertThat(next.half()).isEqualTo(Half.TOP);
    }

    @Test
    void runsGoToBattingTeam() {
        GameState top = InningStateMachine.apply(GameState.initial(), 0, 2);
        assertThat(top.visitorScore()).isEqualTo(2);
        assertThat(top.homeScore()).isZero();

        GameState bottom = InningStateMachine.apply(state(3, Half.BOTTOM, 0, 0, 0, BaseState.EMPTY), 0, 1);
        assertThat(bottom.homeScore()).isEqualTo(1);
    }

    // ── half transitions ────────────────────────────────────────────────────

    @Test
    void thirdOutInTopFlipsToBottomAndClearsBases() {
        GameState next = InningStateMachine.apply(state(4, Half.TOP, 2, 1, 0, BaseState.LOADED), 1, 0);

        assertThat(next.inning()).isEqualTo(4);
        assertThat(next.half()).isEqualTo(Half.BOTTOM);
        assertThat(next.outs()).isZero();
        assertThat(next.bases()).isEqualTo(BaseState.EMPTY);
        assertThat(next.phase()).isEqualTo(InningPhase.BOTTOM_HALF);
    }

    @Test
    void thirdOutInBottomAdvancesInning() {
        GameState next = InningStateMachine.apply(state(4, Half.BOTTOM, 2, 1, 0, BaseState.EMPTY), 1, 0);

        assertThat(next.inning()).isEqualTo(5);
        assertThat(next.half()).isEqualTo(Half.TOP);
        assertThat(next.gameOver()).isFalse();
    }

    @Test
    void topOfNinthAlwaysFlipsEvenWhenHomeLeads() {
        GameState next = InningStateMachine.apply(state(9, Half.TOP, 2, 1, 5, BaseState.EMPTY), 1, 0);

        assertThat(next.gameOver()).isFalse();
        assertThat(next.half()).isEqualTo(Half.BOTTOM);
    }

    // ── game end ────────────────────────────────────────────────────────────

    @Test
    void ninthEndsWithVisitorAhead() {
        GameState next = InningStateMachine.apply(state(9, Half.BOTTOM, 2, 4, 2, BaseState.EMPTY), 1, 0);

        assertThat(next.gameOver()).isTrue();
        assertThat(next.winner()).isEqualTo(Seat.VISITOR);
        assertThat(next.phase()).isEqualTo(InningPhase.GAME_OVER);
    }

    @Test
    void tieAfterNinthGoesToExtras() {
        GameState next = InningStateMachine.apply(state(9, Half.BOTTOM, 2, 3, 3, BaseState.EMPTY), 1, 0);

        assertThat(next.gameOver()).isFalse();
        assertThat(next.inning()).isEqualTo(10);
        assertThat(next.half()).isEqualTo(Half.TOP);
    }

    @Test
    void walkOffEndsImmediatelyWithoutThirdOut() {
        GameState next = InningStateMachine.apply(state(9, Half.BOTTOM, 0, 3, 3, BaseState.LOADED), 0, 1);

        assertThat(next.gameOver()).isTrue();
        assertThat(next.winner()).isEqualTo(Seat.HOME);
        assertThat(next.homeScore()).isEqualTo(4);
        assertThat(next.outs()).isZero();
    }

    @Test
    void walkOffInExtraInnings() {
        GameState next = InningStateMachine.apply(state(12, Half.BOTTOM, 1, 5, 5, BaseState.EMPTY), 0, 1);

        assertThat(next.gameOver()).isTrue();
        assertThat(next.winner()).isEqualTo(Seat.HOME);
    }

    @Test
    void homeLeadBeforeNinthDoesNotEndGame() {
        GameState next = InningStateMachine.apply(state(5, Half.BOTTOM, 0, 0, 0, BaseState.EMPTY), 0, 3);

        assertThat(next.gameOver()).isFalse();
        assertThat(next.homeScore()).isEqualTo(3);
    }

    @Test
    void rejectsMovesAfterGameOver() {
        GameState over = GameState.initial().finished(Seat.HOME);

        assertThatThrownBy(() -> InningStateMachine.apply(over, 1, 0))
                .isInstanceOf(IllegalStateException.class);
    }
}
