package com.dicehub.baseball.games.baseball.application;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进行中/等待中房间的内存注册表，外加两个占位索引：
 * - 邀请码 → 等待中的会话（保证一个邀请码同时只对应一个等待中的会话）；
 * - 用户 → 其未结束的会话（保证每个用户同时最多一个）。
 * 占位用 putIfAbsent 原子完成，不需要额外的锁。
 */
@Component
public class GameRoomRegistry {

    private final ConcurrentMap<String, GameRoom> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> waitingByJoinCode = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> liveByUser = new ConcurrentHashMap<>();

    public void register(GameRoom room) {
        rooms.put(room.getSessionId(), room);
    }

    public Optional<GameRoom> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(rooms.get(sessionId));
    }

    public void evict(String sessionId) {
        rooms.remove(sessionId);
    }

    public int size() {
        return rooms.size();
    }

    // ---- 用户占位 ----

    /**
     * @return 占位成功（或本就属于该会话）返回 true
     */
    public boolean claimUser(String userId, String sessionId) {
        String existing = liveByUser.putIfAbsent(userId, sessionId);
        return existing == null || existing.equals(sessionId);
    }

    public void releaseUser(String userId, String sessionId) {
        if (userId != null) {
            liveByUser.remove(userId, sessionId);
        }
    }

    public Optional<String> liveSessionOf(String userId) {
        return Optional.ofNullable(liveByUser.get(userId));
    }

    // ---- 邀请码占位 ----

    public boolean claimJoinCode(String joinCode, String sessionId) {
        return waitingByJoinCode.putIfAbsent(joinCode, sessionId) == null;
    }

    public void releaseJoinCode(String joinCode, String sessionId) {
        if (joinCode != null) {
            waitingByJoinCode.remove(joinCode, sessionId);
        }
    }

    public Optional<String> sessionIdByJoinCode(String joinCode) {
        return Optional.ofNullable(waitingByJoinCode.get(joinCode));
    }
}
