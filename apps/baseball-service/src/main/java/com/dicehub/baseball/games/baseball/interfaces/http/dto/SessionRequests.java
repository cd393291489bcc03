package com.dicehub.baseball.games.baseball.interfaces.http.dto;

import com.dicehub.baseball.games.baseball.domain.enums.SimulationMode;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.SimulationSettings;

/**
 * REST 请求体
 */
public final class SessionRequests {

    private SessionRequests() {
    }

    /**
     * 创建对局
     *
     * @param simulation 可空，缺省为实时随机
     */
    public record CreateSessionRequest(String rosterId, SimulationRequest simulation) {

        public SimulationSettings simulationSettings() {
            if (simulation == null || simulation.mode() == null) {
                return SimulationSettings.LIVE;
            }
            return new SimulationSettings(simulation.mode(), simulation.seed());
        }
    }

    public record SimulationRequest(SimulationMode mode, String seed) {
    }

    /** 按邀请码加入 */
    public record JoinByCodeRequest(String joinCode, String rosterId) {
    }

    /** 按会话ID加入 */
    public record JoinRequest(String rosterId) {
    }

    /** 提交骰子点数 [d1, d2] */
    public record MoveRequest(DiceRoll diceRoll) {
    }
}
