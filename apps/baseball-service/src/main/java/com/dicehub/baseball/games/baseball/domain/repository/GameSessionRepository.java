package com.dicehub.baseball.games.baseball.domain.repository;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 对局会话的持久化仓储。
 * 实现需保证：版本号不大于已存版本的写入被忽略（旧快照不能覆盖新快照）。
 */
public interface GameSessionRepository {

    /**
     * 整体保存
     *
     * @return 是否真正写入（版本过旧时返回 false）
     */
    boolean save(GameSession session);

    Optional<GameSession> findById(String sessionId);

    /**
     * 按邀请码查找等待中的对局（邀请码不区分大小写）
     */
    Optional<GameSession> findByJoinCode(String joinCode);

    /**
     * 查找用户参与的、状态在给定集合内的对局，按创建时间倒序
     */
    List<GameSession> findByUser(String userId, Set<SessionStatus> statuses);

    List<GameSession> findByStatus(Set<SessionStatus> statuses);

    /**
     * 局部更新，仅当已存版本恰为 {@code patch.version - 1} 时生效
     *
     * @return 更新后的会话；不存在或版本不衔接时为空
     */
    Optional<GameSession> update(String sessionId, SessionPatch patch);
}
