package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.repository.GameSessionRepository;
import com.dicehub.baseball.games.baseball.domain.repository.SessionPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 会话写回：内存中的房间是权威状态，存储只做持久化与历史查询。
 * 所有写入都在房间锁之外执行；异步写入走单线程执行器，保证顺序。
 */
@Slf4j
@Component
public class SessionPersister {

    private final GameSessionRepository repository;
    private final Executor executor;

    public SessionPersister(GameSessionRepository repository,
                            @Qualifier("sessionPersistExecutor") Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    /**
     * 同步写入（创建对局时使用），失败转为 internal_error
     */
    public void persistNow(GameSession snapshot) {
        try {
            repository.save(snapshot);
        } catch (RuntimeException e) {
            log.error("对局保存失败: sessionId={}", snapshot.getId(), e);
            throw new GameRuleException(ErrorCode.INTERNAL_ERROR, GameMessages.STORE_UNAVAILABLE, e);
        }
    }

    /**
     * 异步写入快照（调用方需传入锁内拷贝的快照）
     */
    public void persistAsync(GameSession snapshot) {
        submit(snapshot.getId(), () -> {
            boolean written = repository.save(snapshot);
            if (!written) {
                log.debug("跳过过期快照: sessionId={}, version={}", snapshot.getId(), snapshot.getVersion());
            }
        });
    }

    /**
     * 异步写入某个座位的在线状态。
     * 存储版本不衔接（此前的整体写入还没落库或被跳过）时改写整份快照。
     */
    public void patchAsync(GameSession snapshot, Seat seat) {
        String sessionId = snapshot.getId();
        SessionPatch patch = SessionPatch.connection(snapshot, seat);
        submit(sessionId, () -> {
            if (repository.update(sessionId, patch).isPresent()) {
                return;
            }
            boolean written = repository.save(snapshot);
            log.debug("在线状态补丁不衔接，改为整体写入: sessionId={}, version={}, written={}",
                    sessionId, snapshot.getVersion(), written);
        });
    }

    private void submit(String sessionId, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    // 内存状态仍是权威的，下一次写入会带上完整快照
                    log.warn("对局写回失败: sessionId={}, err={}", sessionId, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("写回队列已关闭，丢弃: sessionId={}", sessionId);
        }
    }
}
