package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.Move;

/**
 * 向客户端推送对局事件。实现不得在房间锁内被调用。
 */
public interface GameEventPublisher {

    /** 当前局面（发给单个用户） */
    void state(String sessionId, String userId, GameSession snapshot);

    /** 当前局面（广播给房间） */
    void stateToRoom(String sessionId, GameSession snapshot);

    void rollResult(String sessionId, Move move);

    void ended(String sessionId, GameEnded ended);

    void opponentConnected(String sessionId, String toUserId, String userId);

    void opponentDisconnected(String sessionId, String toUserId, String userId, long timeoutSeconds);

    void error(String sessionId, String userId, String code, String message);
}
