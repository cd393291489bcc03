package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import com.dicehub.baseball.games.baseball.support.LineupFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionSupervisorTest {

    private static final String SESSION = "session-1";
    private static final String HOME = "user-home";
    private static final String VISITOR = "user-visitor";
    private static final long GRACE = 60;

    @Mock
    private SessionCoordinator coordinator;
    @Mock
    private GameEventPublisher events;
    @Mock
    private SessionPersister persister;
    @Mock
    private ScheduledExecutorService scheduler;
    @Mock
    private ScheduledFuture<Object> future;

    @Captor
    private ArgumentCaptor<Runnable> taskCaptor;

    private GameRoomRegistry registry;
    private GameRoom room;
    private ConnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        registry = new GameRoomRegistry();
        room = new GameRoom(session(SessionStatus.ACTIVE));
        registry.register(room);
        supervisor = new ConnectionSupervisor(registry, coordinator, events, persister, scheduler, GRACE);
        lenient().doReturn(future).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    private static GameSession session(SessionStatus status) {
        long now = System.currentTimeMillis();
        GameSession s = new GameSession();
        s.setId(SESSION);
        s.setStatus(status);
        s.setHome(new PlayerSlot(HOME, "roster-h", "Home", true, true, now));
        s.setHomeLineup(LineupFixtures.averageLineup("roster-h", "Home"));
        if (status != SessionStatus.WAITING) {
            s.setVisitor(new PlayerSlot(VISITOR, "roster-v", "Visitor", true, true, now));
            s.setVisitorLineup(LineupFixtures.averageLineup("roster-v", "Visitor"));
        }
        s.setState(GameState.initial());
        s.setCreatedAt(now);
        return s;
    }

    private Runnable scheduledTask() {
        verify(scheduler).schedule(taskCaptor.capture(), eq(GRACE), eq(TimeUnit.SECONDS));
        return taskCaptor.getValue();
    }

    // ── disconnect ──────────────────────────────────────────────────────────

    @Test
    void disconnectStartsGraceTimerAndNotifiesOpponent() {
        supervisor.disconnected(SESSION, HOME);

        verify(scheduler).schedule(any(Runnable.class), eq(GRACE), eq(TimeUnit.SECONDS));
        verify(events).opponentDisconnected(SESSION, VISITOR, HOME, GRACE);
        verify(persister).patchAsync(any(GameSession.class), eq(Seat.HOME));
        assertThat(supervisor.pendingTimers(SESSION)).isEqualTo(1);
        assertThat(room.locked(() -> room.session().getHome().isConnected())).isFalse();
    }

    @Test
    void repeatedDisconnectKeepsSingleTimer() {
        supervisor.disconnected(SESSION, HOME);
        supervisor.disconnected(SESSION, HOME);

        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertThat(supervisor.pendingTimers(SESSION)).isEqualTo(1);
    }

    @Test
    void bothPlayersGetIndependentTimers() {
        supervisor.disconnected(SESSION, HOME);
        supervisor.disconnected(SESSION, VISITOR);

        assertThat(supervisor.pendingTimers(SESSION)).isEqualTo(2);
    }

    @Test
    void waitingSessionDisconnectStartsNoTimer() {
        registry.evict(SESSION);
        registry.register(new GameRoom(session(SessionStatus.WAITING)));

        supervisor.disconnected(SESSION, HOME);

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        verify(events, never()).opponentDisconnected(anyString(), anyString(), anyString(), anyLong());
    }

    @Test
    void unknownSessionIsIgnored() {
        supervisor.disconnected("missing", HOME);

        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    // ── expiry ──────────────────────────────────────────────────────────────

    @Test
    void expiryForfeitsDisconnectedPlayer() {
        GameEnded ended = new GameEnded(SESSION, VISITOR, HOME, EndReason.DISCONNECT_TIMEOUT, 0, 0);
        when(coordinator.forfeit(SESSION, HOME, EndReason.DISCONNECT_TIMEOUT)).thenReturn(ended);

        supervisor.disconnected(SESSION, HOME);
        scheduledTask().run();

        verify(coordinator).forfeit(SESSION, HOME, EndReason.DISCONNECT_TIMEOUT);
        verify(events).ended(SESSION, ended);
        assertThat(supervisor.pendingTimers(SESSION)).isZero();
    }

    @Test
    void reconnectWithinGraceCancelsTimer() {
        supervisor.disconnected(SESSION, HOME);
        Runnable task = scheduledTask();

        supervisor.connected(SESSION, HOME, "socket-2");

        verify(future).cancel(false);
        verify(events).opponentConnected(SESSION, VISITOR, HOME);
        verify(events).state(eq(SESSION), eq(HOME), any(GameSession.class));
        assertThat(supervisor.pendingTimers(SESSION)).isZero();

        // 已取消的回调若仍被执行，令牌不匹配直接放弃
        task.run();
        verify(coordinator, never()).forfeit(anyString(), anyString(), any(EndReason.class));
    }

    @Test
    void expiryIgnoredWhenGameAlreadyOver() {
        supervisor.disconnected(SESSION, HOME);
        Runnable task = scheduledTask();
        room.locked(() -> room.session().setStatus(SessionStatus.COMPLETED));

        task.run();

        verify(coordinator, never()).forfeit(anyString(), anyString(), any(EndReason.class));
    }

    @Test
    void expiryIgnoredWhenRoomEvicted() {
        supervisor.disconnected(SESSION, HOME);
        Runnable task = scheduledTask();
        registry.evict(SESSION);

        task.run();

        verify(coordinator, never()).forfeit(anyString(), anyString(), any(EndReason.class));
    }

    // ── sockets ─────────────────────────────────────────────────────────────

    @Test
    void closingOneOfTwoSocketsKeepsPlayerOnline() {
        supervisor.connected(SESSION, HOME, "socket-1");
        supervisor.connected(SESSION, HOME, "socket-2");

        supervisor.socketClosed("socket-1");
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        supervisor.socketClosed("socket-2");
        verify(scheduler).schedule(any(Runnable.class), eq(GRACE), eq(TimeUnit.SECONDS));
    }

    @Test
    void socketOpenedWhileAnotherClosesKeepsPlayerOnline() {
        ConnectionSupervisor[] self = new ConnectionSupervisor[1];
        boolean[] raced = {false};
        // 断开流程刚定位到房间、尚未进入房间锁时，同一用户的新连接抢先完成
        GameRoomRegistry racing = new GameRoomRegistry() {
            @Override
            public Optional<GameRoom> find(String sessionId) {
                Optional<GameRoom> found = registry.find(sessionId);
                if (!raced[0] && self[0] != null && self[0].boundSockets() == 0) {
                    raced[0] = true;
                    self[0].connected(SESSION, HOME, "socket-B");
                }
                return found;
            }
        };
        ConnectionSupervisor racingSupervisor =
                new ConnectionSupervisor(racing, coordinator, events, persister, scheduler, GRACE);
        racingSupervisor.connected(SESSION, HOME, "socket-A");
        self[0] = racingSupervisor;

        racingSupervisor.socketClosed("socket-A");

        assertThat(raced[0]).isTrue();
        assertThat(room.locked(() -> room.session().getHome().isConnected())).isTrue();
        assertThat(room.locked(room::pendingTimerCount)).isZero();
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        verify(events, never()).opponentDisconnected(anyString(), anyString(), anyString(), anyLong());
    }

    @Test
    void nonParticipantSocketIsNotBound() {
        supervisor.connected(SESSION, "stranger", "socket-x");

        assertThat(supervisor.boundSockets()).isZero();
        verify(events, never()).state(anyString(), anyString(), any(GameSession.class));
        verify(persister, never()).patchAsync(any(GameSession.class), any(Seat.class));
    }

    @Test
    void unknownSocketCloseIsIgnored() {
        supervisor.socketClosed("never-bound");
        supervisor.socketClosed(null);

        verify(persister, never()).patchAsync(any(GameSession.class), any(Seat.class));
    }

    @Test
    void connectToFinishedSessionOnlyReplaysState() {
        registry.evict(SESSION);
        GameSession stored = session(SessionStatus.COMPLETED);
        when(coordinator.getSession(SESSION, HOME)).thenReturn(stored);

        supervisor.connected(SESSION, HOME, "socket-1");

        verify(events).state(SESSION, HOME, stored);
        verify(events, never()).opponentConnected(anyString(), anyString(), anyString());
    }
}
