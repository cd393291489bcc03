package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.infrastructure.memory.InMemoryGameSessionRepository;
import com.dicehub.baseball.games.baseball.support.LineupFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SessionRecoveryTest {

    @Mock
    private ConnectionSupervisor supervisor;

    private InMemoryGameSessionRepository repository;
    private GameRoomRegistry registry;
    private SessionRecovery recovery;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGameSessionRepository();
        registry = new GameRoomRegistry();
        recovery = new SessionRecovery(repository, registry, supervisor);
    }

    private static GameSession session(String id, SessionStatus status, String home, String visitor) {
        long now = System.currentTimeMillis();
        GameSession s = new GameSession();
        s.setId(id);
        s.setStatus(status);
        s.setHome(new PlayerSlot(home, "roster-h", "Home", true, true, now));
        s.setHomeLineup(LineupFixtures.averageLineup("roster-h", "Home"));
        if (visitor != null) {
            s.setVisitor(new PlayerSlot(visitor, "roster-v", "Visitor", true, true, now));
            s.setVisitorLineup(LineupFixtures.averageLineup("roster-v", "Visitor"));
        }
        s.setState(GameState.initial());
        s.setCreatedAt(now);
        return s;
    }

    // ── 恢复 ────────────────────────────────────────────────────────────────

    @Test
    void activeSessionIsRestoredWithBothPlayersOfflineAndTimed() {
        repository.save(session("s-active", SessionStatus.ACTIVE, "u1", "u2"));

        recovery.onReady();

        GameRoom room = registry.find("s-active").orElseThrow();
        boolean homeOnline = room.locked(() -> room.session().getHome().isConnected());
        boolean visitorOnline = room.locked(() -> room.session().getVisitor().isConnected());
        assertThat(homeOnline).isFalse();
        assertThat(visitorOnline).isFalse();
        assertThat(registry.liveSessionOf("u1")).contains("s-active");
        assertThat(registry.liveSessionOf("u2")).contains("s-active");

        ArgumentCaptor<String> users = ArgumentCaptor.forClass(String.class);
        verify(supervisor, times(2)).startGracePeriod(eq(room), users.capture());
        assertThat(users.getAllValues()).containsExactlyInAnyOrder("u1", "u2");
    }

    @Test
    void waitingSessionGetsItsJoinCodeBackWithoutTimers() {
        GameSession waiting = session("s-wait", SessionStatus.WAITING, "u1", null);
        waiting.setJoinCode("ABC123");
        repository.save(waiting);

        recovery.onReady();

        assertThat(registry.find("s-wait")).isPresent();
        assertThat(registry.sessionIdByJoinCode("ABC123")).contains("s-wait");
        assertThat(registry.liveSessionOf("u1")).contains("s-wait");
        verify(supervisor, never()).startGracePeriod(any(), anyString());
    }

    @Test
    void finishedSessionsStayInTheStoreOnly() {
        repository.save(session("s-done", SessionStatus.COMPLETED, "u1", "u2"));
        repository.save(session("s-forfeit", SessionStatus.FORFEIT, "u3", "u4"));

        recovery.onReady();

        assertThat(registry.size()).isZero();
        assertThat(registry.liveSessionOf("u1")).isEmpty();
        verify(supervisor, never()).startGracePeriod(any(), anyString());
    }

    @Test
    void sessionAlreadyInMemoryIsLeftAlone() {
        GameSession stored = session("s-active", SessionStatus.ACTIVE, "u1", "u2");
        repository.save(stored);
        GameRoom live = new GameRoom(stored.copy());
        registry.register(live);

        recovery.onReady();

        assertThat(registry.find("s-active")).containsSame(live);
        boolean homeOnline = live.locked(() -> live.session().getHome().isConnected());
        assertThat(homeOnline).isTrue();
        verify(supervisor, never()).startGracePeriod(any(), anyString());
    }
}
