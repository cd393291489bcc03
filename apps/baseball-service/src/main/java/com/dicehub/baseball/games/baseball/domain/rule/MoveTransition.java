package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.engine.random.RandomSource;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;

/**
 * 走子的状态迁移函数：(会话当前状态, 用户, 骰子) → 新局面 或 拒绝。
 * 本类不修改会话；拒绝时抛出 {@link GameRuleException}，会话保持原样。
 *
 * 轮次规则：上半局只有客队（加入者）能掷骰，下半局只有主队（创建者）能掷骰。
 */
public final class MoveTransition {

    private MoveTransition() {
    }

    /**
     * 只做校验，返回行动方座位
     */
    public static Seat validate(GameSession session, String userId) {
        Seat seat = session.seatOf(userId);
        if (seat == null) {
            throw new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.NOT_A_PARTICIPANT);
        }
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.SESSION_NOT_ACTIVE);
        }
        GameState state = session.getState();
        if (state.gameOver()) {
            throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.GAME_ALREADY_OVER);
        }
        Seat onTurn = state.battingSeat();
        if (seat != onTurn) {
            throw new GameRuleException(ErrorCode.NOT_YOUR_TURN, GameMessages.formatNotYourTurn(onTurn.wireName()));
        }
        return seat;
    }

    /**
     * 校验并计算打席结果
     */
    public static PlayResult apply(GameSession session, String userId, DiceRoll dice,
                                   AtBatResolver resolver, RandomSource random) {
        if (dice == null) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.INVALID_DICE);
        }
        Seat seat = validate(session, userId);
        return resolver.play(session.getState(), session.lineup(seat), session.lineup(seat.opponent()), dice, random);
    }
}
