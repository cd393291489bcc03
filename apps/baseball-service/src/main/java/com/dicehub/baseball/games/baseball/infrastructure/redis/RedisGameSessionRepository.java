package com.dicehub.baseball.games.baseball.infrastructure.redis;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.repository.GameSessionRepository;
import com.dicehub.baseball.games.baseball.domain.repository.SessionPatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * RedisGameSessionRepository
 * -------------------------------------------------------
 * 对局会话的 Redis 仓储实现。
 * - 会话：baseball:session:{id}，JSON 字符串，TTL 默认 48h（每次写入续期）；
 * - 索引：用户 ZSET（score=createdAt）、状态 SET、等待中邀请码 → 会话ID；
 * - 写入：WATCH 会话键，读出当前版本，版本不新则放弃；MULTI/EXEC 中同时写会话与索引，
 *   EXEC 返回 null（并发修改）时重试。
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "baseball.store", havingValue = "redis", matchIfMissing = true)
public class RedisGameSessionRepository implements GameSessionRepository {

    private static final int MAX_CAS_ATTEMPTS = 3;
    /** EXEC 失败的标记对象 */
    private static final GameSession RETRY = new GameSession();

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisGameSessionRepository(StringRedisTemplate redis,
                                      ObjectMapper objectMapper,
                                      @Value("${baseball.redis.ttl-hours:48}") long ttlHours) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofHours(ttlHours);
    }

    @Override
    public boolean save(GameSession session) {
        return casWrite(session.getId(), current -> {
            if (current != null && current.getVersion() >= session.getVersion()) {
                return null;
            }
            return session;
        }).isPresent();
    }

    @Override
    public Optional<GameSession> update(String sessionId, SessionPatch patch) {
        return casWrite(sessionId, current -> {
            if (current == null || !patch.followsVersion(current.getVersion())) {
                return null;
            }
            patch.applyTo(current);
            return current;
        });
    }

    @Override
    public Optional<GameSession> findById(String sessionId) {
        return Optional.ofNullable(read(redis.opsForValue().get(RedisKeys.session(sessionId))));
    }

    @Override
    public Optional<GameSession> findByJoinCode(String joinCode) {
        if (joinCode == null || joinCode.isBlank()) {
            return Optional.empty();
        }
        String id = redis.opsForValue().get(RedisKeys.joinCode(joinCode));
        if (id == null) {
            return Optional.empty();
        }
        return findById(id).filter(s -> s.getStatus() == SessionStatus.WAITING);
    }

    @Override
    public List<GameSession> findByUser(String userId, Set<SessionStatus> statuses) {
        Set<String> ids = redis.opsForZSet().reverseRange(RedisKeys.userSessions(userId), 0, -1);
        List<GameSession> result = new ArrayList<>();
        for (GameSession s : loadAll(ids)) {
            if (statuses == null || statuses.isEmpty() || statuses.contains(s.getStatus())) {
                result.add(s);
            }
        }
        result.sort(Comparator.comparingLong(GameSession::getCreatedAt).reversed());
        return result;
    }

    @Override
    public List<GameSession> findByStatus(Set<SessionStatus> statuses) {
        List<GameSession> result = new ArrayList<>();
        for (SessionStatus status : statuses) {
            String indexKey = RedisKeys.statusIndex(status);
            Set<String> ids = redis.opsForSet().members(indexKey);
            if (ids == null || ids.isEmpty()) {
                continue;
            }
            List<String> idList = new ArrayList<>(ids);
            List<String> raws = redis.opsForValue().multiGet(idList.stream().map(RedisKeys::session).toList());
            for (int i = 0; i < idList.size(); i++) {
                GameSession s = raws == null ? null : read(raws.get(i));
                if (s == null) {
                    // 会话已过期，顺手清理索引
                    redis.opsForSet().remove(indexKey, idList.get(i));
                } else if (s.getStatus() == status) {
                    result.add(s);
                }
            }
        }
        return result;
    }

    /**
     * CAS 写入：mutator 返回 null 表示放弃写入
     */
    private Optional<GameSession> casWrite(String sessionId, UnaryOperator<GameSession> mutator) {
        final String key = RedisKeys.session(sessionId);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            GameSession written = redis.execute(new SessionCallback<GameSession>() {
                @SuppressWarnings("unchecked")
                @Override
                public <K, V> GameSession execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    GameSession current = read(ops.opsForValue().get(key));
                    GameSession next = mutator.apply(current);
                    if (next == null) {
                        ops.unwatch();
                        return null;
                    }
                    String json = write(next);
                    ops.multi();
                    ops.opsForValue().set(key, json, ttl);
                    writeIndexes(ops, current, next);
                    List<Object> res = ops.exec();
                    return res == null || res.isEmpty() ? RETRY : next;
                }
            });
            if (written != RETRY) {
                return Optional.ofNullable(written);
            }
            log.debug("会话写入冲突，重试: sessionId={}, attempt={}", sessionId, attempt);
        }
        log.warn("会话写入多次冲突，放弃: sessionId={}", sessionId);
        return Optional.empty();
    }

    private void writeIndexes(RedisOperations<String, String> ops, GameSession previous, GameSession next) {
        String id = next.getId();
        for (String userId : participants(next)) {
            String userKey = RedisKeys.userSessions(userId);
            ops.opsForZSet().add(userKey, id, next.getCreatedAt());
            ops.expire(userKey, ttl);
        }
        if (previous != null && previous.getStatus() != next.getStatus()) {
            ops.opsForSet().remove(RedisKeys.statusIndex(previous.getStatus()), id);
        }
        ops.opsForSet().add(RedisKeys.statusIndex(next.getStatus()), id);

        String code = next.getJoinCode();
        if (code != null) {
            if (next.getStatus() == SessionStatus.WAITING) {
                ops.opsForValue().set(RedisKeys.joinCode(code), id, ttl);
            } else if (previous == null || previous.getStatus() == SessionStatus.WAITING) {
                ops.delete(RedisKeys.joinCode(code));
            }
        }
    }

    private static Set<String> participants(GameSession s) {
        Set<String> users = new LinkedHashSet<>();
        if (s.getHome() != null) {
            users.add(s.getHome().getUserId());
        }
        if (s.getVisitor() != null) {
            users.add(s.getVisitor().getUserId());
        }
        users.removeIf(Objects::isNull);
        return users;
    }

    private List<GameSession> loadAll(Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> raws = redis.opsForValue().multiGet(ids.stream().map(RedisKeys::session).toList());
        if (raws == null) {
            return List.of();
        }
        List<GameSession> result = new ArrayList<>();
        for (String raw : raws) {
            GameSession s = read(raw);
            if (s != null) {
                result.add(s);
            }
        }
        return result;
    }

    private GameSession read(String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, GameSession.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("会话反序列化失败", e);
        }
    }

    private String write(GameSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new SerializationException("会话序列化失败: " + session.getId(), e);
        }
    }
}
