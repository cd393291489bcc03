package com.dicehub.baseball.games.baseball.service;

import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.MoveResult;
import com.dicehub.baseball.games.baseball.domain.model.SimulationSettings;

import java.util.List;
import java.util.Set;

/**
 * 对局会话协调服务：房间创建/加入、轮次校验、走子、认输、取消、结束。
 * 所有方法返回的 {@link GameSession} 都是拷贝快照，修改它不会影响房间状态。
 * 校验失败抛出 {@link com.dicehub.baseball.common.GameRuleException}，会话保持原样。
 */
public interface SessionCoordinator {

    /**
     * 创建对局（创建者为主队），状态 WAITING
     */
    GameSession create(String userId, String rosterId, SimulationSettings simulation);

    /**
     * 按会话ID加入（加入者为客队），成功后状态 ACTIVE
     */
    GameSession join(String sessionId, String userId, String rosterId);

    /**
     * 按邀请码加入（不区分大小写）
     */
    GameSession joinByCode(String joinCode, String userId, String rosterId);

    /**
     * 使用调用方给出的骰子走一步
     */
    MoveResult applyMove(String sessionId, String userId, DiceRoll diceRoll);

    /**
     * 由服务端掷骰后走一步
     */
    MoveResult roll(String sessionId, String userId);

    /**
     * 主动认输，胜者为对手
     */
    GameEnded forfeit(String sessionId, String userId);

    /**
     * 以指定原因判负（断线超时等）
     */
    GameEnded forfeit(String sessionId, String userId, EndReason reason);

    /**
     * 创建者取消等待中的对局
     */
    GameSession cancel(String sessionId, String userId);

    /**
     * 以指定胜者结束进行中的对局
     */
    GameEnded complete(String sessionId, String winnerId);

    /**
     * 查询对局（仅参与者可见）
     */
    GameSession getSession(String sessionId, String userId);

    /**
     * 查询用户在给定状态下的对局，按创建时间倒序
     */
    List<GameSession> listSessions(String userId, Set<SessionStatus> statuses);
}
