package com.dicehub.baseball.games.baseball.infrastructure.memory;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.repository.GameSessionRepository;
import com.dicehub.baseball.games.baseball.domain.repository.SessionPatch;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 单机内存仓储（baseball.store=memory），用于本地开发与测试。
 * 存取都做拷贝，调用方拿到的对象与仓储内部互不影响。
 */
@Repository
@ConditionalOnProperty(name = "baseball.store", havingValue = "memory")
public class InMemoryGameSessionRepository implements GameSessionRepository {

    private final ConcurrentMap<String, GameSession> sessions = new ConcurrentHashMap<>();

    @Override
    public boolean save(GameSession session) {
        boolean[] written = {false};
        sessions.compute(session.getId(), (id, current) -> {
            if (current != null && current.getVersion() >= session.getVersion()) {
                return current;
            }
            written[0] = true;
            return session.copy();
        });
        return written[0];
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(GameSession::copy);
    }

    @Override
    public Optional<GameSession> findByJoinCode(String joinCode) {
        if (joinCode == null) {
            return Optional.empty();
        }
        return sessions.values().stream()
                .filter(s -> s.getStatus() == SessionStatus.WAITING)
                .filter(s -> joinCode.trim().equalsIgnoreCase(s.getJoinCode()))
                .findFirst()
                .map(GameSession::copy);
    }

    @Override
    public List<GameSession> findByUser(String userId, Set<SessionStatus> statuses) {
        return sessions.values().stream()
                .filter(s -> s.isParticipant(userId))
                .filter(s -> statuses == null || statuses.isEmpty() || statuses.contains(s.getStatus()))
                .sorted(Comparator.comparingLong(GameSession::getCreatedAt).reversed())
                .map(GameSession::copy)
                .toList();
    }

    @Override
    public List<GameSession> findByStatus(Set<SessionStatus> statuses) {
        return sessions.values().stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .map(GameSession::copy)
                .toList();
    }

    @Override
    public Optional<GameSession> update(String sessionId, SessionPatch patch) {
        GameSession[] updated = {null};
        sessions.computeIfPresent(sessionId, (id, current) -> {
            if (!patch.followsVersion(current.getVersion())) {
                return current;
            }
            GameSession next = current.copy();
            patch.applyTo(next);
            updated[0] = next.copy();
            return next;
        });
        return Optional.ofNullable(updated[0]);
    }
}
