package com.dicehub.baseball.games.baseball.interfaces.ws;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.application.ConnectionSupervisor;
import com.dicehub.baseball.games.baseball.application.GameEventPublisher;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.Half;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.Move;
import com.dicehub.baseball.games.baseball.domain.model.MoveResult;
import com.dicehub.baseball.games.baseball.domain.model.PlayerRef;
import com.dicehub.baseball.games.baseball.domain.rule.Outcome;
import com.dicehub.baseball.games.baseball.interfaces.ws.dto.BaseballMessages.SessionCmd;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaseballWsControllerTest {

    private static final String USER = "user-visitor";
    private static final String SESSION = "session-1";
    private static final String SOCKET = "socket-1";

    @Mock
    private SessionCoordinator coordinator;
    @Mock
    private ConnectionSupervisor supervisor;
    @Mock
    private GameEventPublisher events;

    private BaseballWsController controller;
    private SimpMessageHeaderAccessor sha;

    @BeforeEach
    void setUp() {
        controller = new BaseballWsController(coordinator, supervisor, events);
        sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId(SOCKET);
        sha.setUser(() -> USER);
    }

    private static SessionCmd cmd(String sessionId) {
        SessionCmd cmd = new SessionCmd();
        cmd.setSessionId(sessionId);
        return cmd;
    }

    private static Move move() {
        return new Move(1, USER, 1, Half.TOP, new DiceRoll(2, 2), Outcome.STRIKEOUT, 0, 1,
                "K!", new PlayerRef("b1", "Batter"), new PlayerRef("sp", "Ace"), GameState.initial(), 1L);
    }

    // ── join ────────────────────────────────────────────────────────────────

    @Test
    void joinBindsSocketToSession() {
        when(coordinator.getSession(SESSION, USER)).thenReturn(new GameSession());

        controller.join(cmd(SESSION), sha);

        verify(supervisor).connected(SESSION, USER, SOCKET);
    }

    @Test
    void joinByStrangerSendsForbiddenError() {
        when(coordinator.getSession(SESSION, USER))
                .thenThrow(new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.NOT_A_PARTICIPANT));

        controller.join(cmd(SESSION), sha);

        verify(events).error(SESSION, USER, "forbidden", GameMessages.NOT_A_PARTICIPANT);
        verifyNoInteractions(supervisor);
    }

    // ── roll ────────────────────────────────────────────────────────────────

    @Test
    void rollBroadcastsResult() {
        Move move = move();
        when(coordinator.roll(SESSION, USER)).thenReturn(new MoveResult(new GameSession(), move, null));

        controller.roll(cmd(SESSION), sha);

        verify(events).rollResult(SESSION, move);
        verify(events, never()).ended(anyString(), any(GameEnded.class));
    }

    @Test
    void finalRollSendsResultBeforeEnded() {
        Move move = move();
        GameEnded ended = new GameEnded(SESSION, "user-home", USER, EndReason.COMPLETED, 1, 2);
        when(coordinator.roll(SESSION, USER)).thenReturn(new MoveResult(new GameSession(), move, ended));

        controller.roll(cmd(SESSION), sha);

        InOrder order = inOrder(events);
        order.verify(events).rollResult(SESSION, move);
        order.verify(events).ended(SESSION, ended);
    }

    @Test
    void outOfTurnRollOnlyAnswersSender() {
        when(coordinator.roll(SESSION, USER))
                .thenThrow(new GameRuleException(ErrorCode.NOT_YOUR_TURN, "未轮到你掷骰"));

        controller.roll(cmd(SESSION), sha);

        verify(events).error(SESSION, USER, "not_your_turn", "未轮到你掷骰");
        verify(events, never()).rollResult(anyString(), any(Move.class));
    }

    @Test
    void unexpectedFailureBecomesInternalError() {
        when(coordinator.roll(SESSION, USER)).thenThrow(new IllegalArgumentException("boom"));

        controller.roll(cmd(SESSION), sha);

        verify(events).error(SESSION, USER, "internal_error", GameMessages.INTERNAL_ERROR);
    }

    @Test
    void blankSessionIdIsValidationError() {
        controller.roll(cmd(" "), sha);

        verify(events).error(" ", USER, "validation_error", GameMessages.SESSION_ID_REQUIRED);
        verifyNoInteractions(coordinator);
    }

    @Test
    void anonymousMessageIsDropped() {
        sha.setUser(null);

        controller.roll(cmd(SESSION), sha);

        verifyNoInteractions(coordinator, events);
    }

    // ── forfeit ─────────────────────────────────────────────────────────────

    @Test
    void forfeitBroadcastsEnded() {
        GameEnded ended = new GameEnded(SESSION, "user-home", USER, EndReason.FORFEIT, 0, 0);
        when(coordinator.forfeit(SESSION, USER)).thenReturn(ended);

        controller.forfeit(cmd(SESSION), sha);

        verify(events).ended(SESSION, ended);
    }
}
