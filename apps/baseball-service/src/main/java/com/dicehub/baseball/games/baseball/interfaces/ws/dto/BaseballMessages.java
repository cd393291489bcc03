package com.dicehub.baseball.games.baseball.interfaces.ws.dto;

import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.Move;
import com.dicehub.baseball.games.baseball.domain.model.PlayerRef;
import com.dicehub.baseball.games.baseball.domain.rule.Outcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 → 后端：/app/baseball.join、/app/baseball.roll、/app/baseball.forfeit，载荷均为 {@link SessionCmd}；
 * 后端 → 前端：统一的 {@link BroadcastEvent}，房间广播走 /topic/baseball.{sessionId}，单人消息走 /user/queue/baseball。
 */
public class BaseballMessages {

    /** 事件类型 */
    public static final String STATE = "state";
    public static final String ROLL_RESULT = "rollResult";
    public static final String ENDED = "ended";
    public static final String OPPONENT_CONNECTED = "opponentConnected";
    public static final String OPPONENT_DISCONNECTED = "opponentDisconnected";
    public static final String ERROR = "error";

    /**
     * 会话指令（客户端 → 服务端）
     */
    @Data
    public static class SessionCmd {
        private String sessionId;
    }

    /**
     * 推送事件（服务端 → 客户端）
     */
    @Data
    public static class BroadcastEvent {
        private String sessionId;
        private String type;
        private Object payload;

        public static BroadcastEvent of(String sessionId, String type, Object payload) {
            BroadcastEvent evt = new BroadcastEvent();
            evt.setSessionId(sessionId);
            evt.setType(type);
            evt.setPayload(payload);
            return evt;
        }
    }

    /** 一次掷骰的结果 */
    public record RollResultPayload(
            int moveNumber,
            String userId,
            DiceRoll diceRoll,
            Outcome outcome,
            int runsScored,
            int outsRecorded,
            String description,
            PlayerRef batter,
            PlayerRef pitcher,
            GameState newState
    ) {
        public static RollResultPayload of(Move m) {
            return new RollResultPayload(m.moveNumber(), m.userId(), m.diceRoll(), m.outcome(), m.runsScored(),
                    m.outsRecorded(), m.description(), m.batter(), m.pitcher(), m.resultingState());
        }
    }

    /** 对手上线/掉线（上线时没有 timeoutSeconds） */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OpponentPayload(String userId, Long timeoutSeconds) {
    }

    /** 错误 */
    public record ErrorPayload(String code, String message) {
    }
}
