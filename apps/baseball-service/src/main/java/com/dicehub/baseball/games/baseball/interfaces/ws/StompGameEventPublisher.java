package com.dicehub.baseball.games.baseball.interfaces.ws;

import com.dicehub.baseball.games.baseball.application.GameEventPublisher;
import com.dicehub.baseball.games.baseball.domain.dto.SessionView;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.Move;
import com.dicehub.baseball.games.baseball.interfaces.ws.dto.BaseballMessages;
import com.dicehub.baseball.games.baseball.interfaces.ws.dto.BaseballMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 通过 STOMP 推送对局事件。
 * 房间广播：/topic/baseball.{sessionId}；单人消息：/user/{userId}/queue/baseball。
 */
@Component
@RequiredArgsConstructor
public class StompGameEventPublisher implements GameEventPublisher {

    static final String USER_QUEUE = "/queue/baseball";

    private final SimpMessagingTemplate messaging;

    public static String topic(String sessionId) {
        return "/topic/baseball." + sessionId;
    }

    @Override
    public void state(String sessionId, String userId, GameSession snapshot) {
        toUser(userId, BroadcastEvent.of(sessionId, BaseballMessages.STATE, SessionView.of(snapshot)));
    }

    @Override
    public void stateToRoom(String sessionId, GameSession snapshot) {
        messaging.convertAndSend(topic(sessionId),
                BroadcastEvent.of(sessionId, BaseballMessages.STATE, SessionView.of(snapshot)));
    }

    @Override
    public void rollResult(String sessionId, Move move) {
        messaging.convertAndSend(topic(sessionId),
                BroadcastEvent.of(sessionId, BaseballMessages.ROLL_RESULT, BaseballMessages.RollResultPayload.of(move)));
    }

    @Override
    public void ended(String sessionId, GameEnded ended) {
        messaging.convertAndSend(topic(sessionId), BroadcastEvent.of(sessionId, BaseballMessages.ENDED, ended));
    }

    @Override
    public void opponentConnected(String sessionId, String toUserId, String userId) {
        toUser(toUserId, BroadcastEvent.of(sessionId, BaseballMessages.OPPONENT_CONNECTED,
                new BaseballMessages.OpponentPayload(userId, null)));
    }

    @Override
    public void opponentDisconnected(String sessionId, String toUserId, String userId, long timeoutSeconds) {
        toUser(toUserId, BroadcastEvent.of(sessionId, BaseballMessages.OPPONENT_DISCONNECTED,
                new BaseballMessages.OpponentPayload(userId, timeoutSeconds)));
    }

    @Override
    public void error(String sessionId, String userId, String code, String message) {
        toUser(userId, BroadcastEvent.of(sessionId, BaseballMessages.ERROR,
                new BaseballMessages.ErrorPayload(code, message)));
    }

    private void toUser(String userId, BroadcastEvent evt) {
        if (userId != null) {
            messaging.convertAndSendToUser(userId, USER_QUEUE, evt);
        }
    }
}
