package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 连接监管：Connected ⇄ Disconnected。
 *
 * - 进行中的对局里玩家断线：通知对手，启动宽限计时器（默认 60 秒）；
 * - 宽限期内重连：取消计时器，通知对手，给重连方补发当前局面；
 * - 计时器到期：在房间锁内确认计时器仍有效、对局仍进行中、玩家仍离线，再通过协调服务判负。
 *
 * 计时器挂在房间上并带令牌，取消采用“先移除再取消”，回调发现令牌不匹配直接放弃。
 */
@Slf4j
@Component
public class ConnectionSupervisor {

    private final GameRoomRegistry registry;
    private final SessionCoordinator coordinator;
    private final GameEventPublisher events;
    private final SessionPersister persister;
    private final ScheduledExecutorService scheduler;
    private final long graceSeconds;

    /** STOMP 会话ID → 绑定的对局与用户（断开时定位房间；连接计数在房间内） */
    private final ConcurrentMap<String, SocketBinding> bindings = new ConcurrentHashMap<>();

    public ConnectionSupervisor(GameRoomRegistry registry,
                                SessionCoordinator coordinator,
                                GameEventPublisher events,
                                SessionPersister persister,
                                @Qualifier("graceClockScheduler") ScheduledExecutorService scheduler,
                                @Value("${baseball.connection.grace-seconds:60}") long graceSeconds) {
        this.registry = registry;
        this.coordinator = coordinator;
        this.events = events;
        this.persister = persister;
        this.scheduler = scheduler;
        this.graceSeconds = graceSeconds;
    }

    public long getGraceSeconds() {
        return graceSeconds;
    }

    /**
     * 玩家通过 join 事件进入房间（首次进入或重连）。
     * 连接绑定、在线标记和计时器取消在同一段房间锁内完成，与断开处理互斥。
     *
     * @param socketId STOMP 会话ID，可为空（非 WS 场景）
     */
    public void connected(String sessionId, String userId, String socketId) {
        Optional<GameRoom> found = registry.find(sessionId);
        if (found.isEmpty()) {
            // 已结束的对局不再监管，只补发局面
            events.state(sessionId, userId, coordinator.getSession(sessionId, userId));
            return;
        }
        GameRoom room = found.get();
        ConnectionChange change = room.locked(() -> {
            GameSession session = room.session();
            Seat seat = session.seatOf(userId);
            if (seat == null) {
                return null;
            }
            if (socketId != null) {
                room.bindSocket(userId, socketId);
                bindings.put(socketId, new SocketBinding(sessionId, userId));
            }
            long now = System.currentTimeMillis();
            PlayerSlot slot = session.slot(seat);
            slot.setConnected(true);
            slot.setLastActiveAt(now);
            boolean timerCancelled = room.cancelTimer(userId);
            session.touch(now);
            return new ConnectionChange(session.copy(), seat, timerCancelled);
        });
        if (change == null) {
            return;
        }
        if (change.timerCancelled()) {
            log.info("玩家重连，取消断线判负: sessionId={}, userId={}", sessionId, userId);
        }
        persister.patchAsync(change.snapshot(), change.seat());
        events.state(sessionId, userId, change.snapshot());
        String opponent = change.snapshot().opponentOf(userId);
        if (opponent != null) {
            events.opponentConnected(sessionId, opponent, userId);
        }
    }

    /**
     * STOMP 连接断开。若该用户在此对局中已没有其他连接，视为离线。
     */
    public void socketClosed(String socketId) {
        if (socketId == null) {
            return;
        }
        SocketBinding binding = bindings.remove(socketId);
        if (binding == null) {
            return;
        }
        goOffline(binding.sessionId(), binding.userId(), socketId);
    }

    /**
     * 玩家离线。进行中的对局会启动宽限计时器（每个用户最多一个）。
     */
    public void disconnected(String sessionId, String userId) {
        goOffline(sessionId, userId, null);
    }

    private void goOffline(String sessionId, String userId, String socketId) {
        Optional<GameRoom> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return;
        }
        GameRoom room = found.get();
        ConnectionChange change = room.locked(() -> {
            GameSession session = room.session();
            Seat seat = session.seatOf(userId);
            if (seat == null) {
                return null;
            }
            if (socketId != null && room.unbindSocket(userId, socketId) > 0) {
                log.debug("用户仍有其他连接，不视为离线: sessionId={}, userId={}", sessionId, userId);
                return null;
            }
            long now = System.currentTimeMillis();
            session.slot(seat).setConnected(false);
            session.slot(seat).setLastActiveAt(now);
            session.touch(now);
            if (session.getStatus() == SessionStatus.ACTIVE) {
                startTimerLocked(room, userId);
            }
            return new ConnectionChange(session.copy(), seat, false);
        });
        if (change == null) {
            return;
        }
        persister.patchAsync(change.snapshot(), change.seat());
        if (change.snapshot().getStatus() == SessionStatus.ACTIVE) {
            log.info("玩家断线，{} 秒后判负: sessionId={}, userId={}", graceSeconds, sessionId, userId);
            String opponent = change.snapshot().opponentOf(userId);
            if (opponent != null) {
                events.opponentDisconnected(sessionId, opponent, userId, graceSeconds);
            }
        }
    }

    /**
     * 启动宽限计时器（服务重启恢复时也会调用）。已有计时器时保持原计时器。
     */
    public void startGracePeriod(GameRoom room, String userId) {
        room.locked(() -> {
            if (room.session().getStatus() == SessionStatus.ACTIVE) {
                startTimerLocked(room, userId);
            }
        });
    }

    private void startTimerLocked(GameRoom room, String userId) {
        if (room.hasTimer(userId)) {
            return;
        }
        long token = room.nextTimerToken();
        String sessionId = room.getSessionId();
        ScheduledFuture<?> future = scheduler.schedule(
                () -> expire(sessionId, userId, token), graceSeconds, TimeUnit.SECONDS);
        room.putTimer(userId, new GameRoom.PendingForfeit(token, future));
    }

    /**
     * 计时器到期回调：所有判断都在房间锁内完成，判负也在同一临界区内调用协调服务（锁可重入）
     */
    void expire(String sessionId, String userId, long token) {
        Optional<GameRoom> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return;
        }
        GameRoom room = found.get();
        GameEnded ended;
        room.lock();
        try {
            GameRoom.PendingForfeit pending = room.timerOf(userId);
            if (pending == null || pending.token() != token) {
                log.debug("计时器已被取消或替换: sessionId={}, userId={}", sessionId, userId);
                return;
            }
            room.removeTimer(userId);
            GameSession session = room.session();
            Seat seat = session.seatOf(userId);
            if (session.getStatus() != SessionStatus.ACTIVE || seat == null || session.slot(seat).isConnected()) {
                return;
            }
            ended = coordinator.forfeit(sessionId, userId, EndReason.DISCONNECT_TIMEOUT);
        } catch (GameRuleException e) {
            log.warn("断线判负被拒绝: sessionId={}, userId={}, reason={}", sessionId, userId, e.getMessage());
            return;
        } finally {
            room.unlock();
        }
        log.info("断线超时判负: sessionId={}, loser={}, winner={}", sessionId, userId, ended.winnerId());
        events.ended(sessionId, ended);
    }

    /**
     * 当前挂起计时器数量（监控/测试用）
     */
    public int pendingTimers(String sessionId) {
        return registry.find(sessionId).map(r -> r.locked(r::pendingTimerCount)).orElse(0);
    }

    /**
     * 当前登记的 STOMP 连接数（监控/测试用）
     */
    public int boundSockets() {
        return bindings.size();
    }

    private record SocketBinding(String sessionId, String userId) {
    }

    private record ConnectionChange(GameSession snapshot, Seat seat, boolean timerCancelled) {
    }
}
