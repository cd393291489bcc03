package com.dicehub.baseball.games.baseball.domain.dto;

import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.enums.SimulationMode;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.Move;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 对外返回的会话视图（REST 响应与 WS state 事件共用）。
 * 不包含随机源状态；邀请码只在等待中返回。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        String id,
        String joinCode,
        SessionStatus status,
        PlayerView home,
        PlayerView visitor,
        GameState state,
        String battingUserId,
        List<Move> moves,
        SimulationMode simulationMode,
        String seed,
        String winnerId,
        EndReason endReason,
        long createdAt,
        Long startedAt,
        Long endedAt
) {

    public static SessionView of(GameSession s) {
        GameState state = s.getState();
        String batting = s.getStatus() == SessionStatus.ACTIVE && !state.gameOver()
                ? s.userAt(state.battingSeat())
                : null;
        return new SessionView(
                s.getId(),
                s.getStatus() == SessionStatus.WAITING ? s.getJoinCode() : null,
                s.getStatus(),
                PlayerView.of(s.getHome()),
                PlayerView.of(s.getVisitor()),
                state,
                batting,
                List.copyOf(s.getMoves()),
                s.getSimulationMode(),
                s.getSeed(),
                s.getWinnerId(),
                s.getEndReason(),
                s.getCreatedAt(),
                s.getStartedAt(),
                s.getEndedAt());
    }

    /** 座位视图 */
    public record PlayerView(String userId, String rosterId, String teamName, boolean ready, boolean connected,
                             long lastActiveAt) {

        static PlayerView of(PlayerSlot slot) {
            if (slot == null) {
                return null;
            }
            return new PlayerView(slot.getUserId(), slot.getRosterId(), slot.getTeamName(), slot.isReady(),
                    slot.isConnected(), slot.getLastActiveAt());
        }
    }
}
