package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.enums.Half;
import com.dicehub.baseball.games.baseball.domain.enums.InningPhase;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 比赛局面（不可变）。只由走子流程产生新的实例。
 *
 * @param inning             局数，从 1 开始
 * @param half               上/下半局
 * @param outs               出局数，进行中为 0..2
 * @param visitorScore       客队得分
 * @param homeScore          主队得分
 * @param bases              垒包
 * @param visitorBatterIndex 客队打序计数
 * @param homeBatterIndex    主队打序计数
 * @param gameOver           是否已结束
 * @param winner             胜方座位，未结束为 null
 */
public record GameState(
        int inning,
        Half half,
        int outs,
        int visitorScore,
        int homeScore,
        BaseState bases,
        int visitorBatterIndex,
        int homeBatterIndex,
        boolean gameOver,
        Seat winner
) {

    public GameState {
        if (inning < 1) {
            throw new IllegalArgumentException("inning must be >= 1");
        }
        if (outs < 0 || outs > 2) {
            throw new IllegalArgumentException("outs must be within [0,3): " + outs);
        }
        if (half == null || bases == null) {
            throw new IllegalArgumentException("half and bases are required");
        }
    }

    public static GameState initial() {
        return new GameState(1, Half.TOP, 0, 0, 0, BaseState.EMPTY, 0, 0, false, null);
    }

    @JsonIgnore
    public InningPhase phase() {
        if (gameOver) {
            return InningPhase.GAME_OVER;
        }
        return half == Half.TOP ? InningPhase.TOP_HALF : InningPhase.BOTTOM_HALF;
    }

    /** 当前进攻方 */
    @JsonIgnore
    public Seat battingSeat() {
        return half.battingSeat();
    }

    @JsonIgnore
    public int battingIndexOf(Seat seat) {
        return seat == Seat.HOME ? homeBatterIndex : visitorBatterIndex;
    }

    @JsonIgnore
    public int scoreOf(Seat seat) {
        return seat == Seat.HOME ? homeScore : visitorScore;
    }

    /** 当前领先方，平局返回 null */
    @JsonIgnore
    public Seat leader() {
        if (homeScore == visitorScore) {
            return null;
        }
        return homeScore > visitorScore ? Seat.HOME : Seat.VISITOR;
    }

    public GameState withBases(BaseState newBases) {
        return new GameState(inning, half, outs, visitorScore, homeScore, newBases,
                visitorBatterIndex, homeBatterIndex, gameOver, winner);
    }

    /** 进攻方加分 */
    public GameState withRunsForBattingTeam(int runs) {
        if (runs == 0) {
            return this;
        }
        return half == Half.TOP
                ? new GameState(inning, half, outs, visitorScore + runs, homeScore, bases,
                visitorBatterIndex, homeBatterIndex, gameOver, winner)
                : new GameState(inning, half, outs, visitorScore, homeScore + runs, bases,
                visitorBatterIndex, homeBatterIndex, gameOver, winner);
    }

    /** 进攻方打序前进一位 */
    public GameState withNextBatter() {
        return half == Half.TOP
                ? new GameState(inning, half, outs, visitorScore, homeScore, bases,
                visitorBatterIndex + 1, homeBatterIndex, gameOver, winner)
                : new GameState(inning, half, outs, visitorScore, homeScore, bases,
                visitorBatterIndex, homeBatterIndex + 1, gameOver, winner);
    }

    public GameState withOuts(int newOuts) {
        return new GameState(inning, half, newOuts, visitorScore, homeScore, bases,
                visitorBatterIndex, homeBatterIndex, gameOver, winner);
    }

    /** 换半局：清垒、出局归零 */
    public GameState nextHalf(int newInning, Half newHalf) {
        return new GameState(newInning, newHalf, 0, visitorScore, homeScore, BaseState.EMPTY,
                visitorBatterIndex, homeBatterIndex, false, null);
    }

    public GameState finished(Seat winningSeat) {
        return new GameState(inning, half, outs, visitorScore, homeScore, bases,
                visitorBatterIndex, homeBatterIndex, true, winningSeat);
    }
}
