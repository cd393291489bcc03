package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.engine.random.DefaultRandomSource;
import com.dicehub.baseball.engine.random.RandomSource;
import com.dicehub.baseball.engine.random.SeededRandomSource;
import com.dicehub.baseball.games.baseball.domain.enums.SimulationMode;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 单个对局房间：持有权威会话、随机源、玩家连接和断线判负计时器。
 * 这些状态都只能在 {@link #locked} 内访问；同一把锁串行化走子、连接变化和计时器回调。
 */
public class GameRoom {

    private final String sessionId;
    private final ReentrantLock lock = new ReentrantLock();

    private GameSession session;
    private RandomSource random;

    /** userId -> 待执行的断线判负任务（每个用户最多一个） */
    private final Map<String, PendingForfeit> forfeitTimers = new HashMap<>();
    private long timerSeq;
    /** userId -> 当前绑定的 STOMP 会话ID */
    private final Map<String, Set<String>> sockets = new HashMap<>();

    public GameRoom(GameSession session) {
        this.sessionId = session.getId();
        this.session = session;
        this.random = randomFor(session);
    }

    private static RandomSource randomFor(GameSession session) {
        if (session.getSimulationMode() != SimulationMode.DETERMINISTIC) {
            return DefaultRandomSource.INSTANCE;
        }
        if (session.getRngState() != null && session.getRngState() != 0L) {
            return SeededRandomSource.fromState(session.getRngState());
        }
        return SeededRandomSource.fromSeed(session.getSeed());
    }

    public String getSessionId() {
        return sessionId;
    }

    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /** 外部把多步操作包进同一段临界区时使用（可重入） */
    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    // ---- 以下方法要求已持有锁 ----

    public GameSession session() {
        assertLocked();
        return session;
    }

    public RandomSource random() {
        assertLocked();
        return random;
    }

    /** 把随机源状态写回会话，供持久化与重启恢复 */
    public void syncRandomState() {
        assertLocked();
        if (random instanceof SeededRandomSource seeded) {
            session.setRngState(seeded.currentState());
        }
    }

    public PendingForfeit timerOf(String userId) {
        assertLocked();
        return forfeitTimers.get(userId);
    }

    public boolean hasTimer(String userId) {
        assertLocked();
        return forfeitTimers.containsKey(userId);
    }

    public long nextTimerToken() {
        assertLocked();
        return ++timerSeq;
    }

    public void putTimer(String userId, PendingForfeit pending) {
        assertLocked();
        forfeitTimers.put(userId, pending);
    }

    /**
     * 先移除再取消：移除后回调线程即使已在等锁，也会因令牌不匹配而放弃
     *
     * @return 是否确实取消了一个计时器
     */
    public boolean cancelTimer(String userId) {
        assertLocked();
        PendingForfeit pending = forfeitTimers.remove(userId);
        if (pending == null) {
            return false;
        }
        pending.future().cancel(false);
        return true;
    }

    /** 移除（不取消），计时器回调自身使用 */
    public void removeTimer(String userId) {
        assertLocked();
        forfeitTimers.remove(userId);
    }

    public void cancelAllTimers() {
        assertLocked();
        forfeitTimers.values().forEach(p -> p.future().cancel(false));
        forfeitTimers.clear();
    }

    public int pendingTimerCount() {
        assertLocked();
        return forfeitTimers.size();
    }

    public void bindSocket(String userId, String socketId) {
        assertLocked();
        sockets.computeIfAbsent(userId, k -> new HashSet<>()).add(socketId);
    }

    /**
     * @return 解绑后该用户剩余的连接数
     */
    public int unbindSocket(String userId, String socketId) {
        assertLocked();
        Set<String> bound = sockets.get(userId);
        if (bound == null) {
            return 0;
        }
        bound.remove(socketId);
        if (bound.isEmpty()) {
            sockets.remove(userId);
            return 0;
        }
        return bound.size();
    }

    private void assertLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("room lock not held: " + sessionId);
        }
    }

    /**
     * 一个待执行的断线判负任务
     *
     * @param token 房间内递增的令牌，回调执行时用来确认自己仍是当前计时器
     */
    public record PendingForfeit(long token, ScheduledFuture<?> future) {
    }
}
