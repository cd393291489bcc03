package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.domain.repository.GameSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 启动恢复（应用编排层）：把存储中未结束的对局装回内存。
 *
 * - WAITING：恢复房间、用户占位和邀请码；
 * - ACTIVE：恢复房间并把双方视为离线，各自启动宽限计时器，宽限期内不回来就判负。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRecovery {

    private final GameSessionRepository repository;
    private final GameRoomRegistry registry;
    private final ConnectionSupervisor supervisor;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("开始恢复未结束的对局");
        List<GameSession> live;
        try {
            live = repository.findByStatus(SessionStatus.LIVE);
        } catch (RuntimeException e) {
            log.error("恢复对局失败：无法读取存储", e);
            return;
        }
        int restored = 0;
        for (GameSession session : live) {
            if (registry.find(session.getId()).isPresent()) {
                continue;
            }
            restore(session);
            restored++;
        }
        log.info("对局恢复完成：共 {} 个", restored);
    }

    void restore(GameSession session) {
        String id = session.getId();
        markOffline(session.getHome());
        markOffline(session.getVisitor());
        GameRoom room = new GameRoom(session);
        registry.register(room);
        claim(session.getHome(), id);
        claim(session.getVisitor(), id);
        if (session.getStatus() == SessionStatus.WAITING && session.getJoinCode() != null) {
            registry.claimJoinCode(session.getJoinCode(), id);
        }
        if (session.getStatus() == SessionStatus.ACTIVE) {
            supervisor.startGracePeriod(room, session.getHome().getUserId());
            supervisor.startGracePeriod(room, session.getVisitor().getUserId());
        }
        log.debug("恢复对局: sessionId={}, status={}", id, session.getStatus().wireName());
    }

    private void claim(PlayerSlot slot, String sessionId) {
        if (slot != null && !registry.claimUser(slot.getUserId(), sessionId)) {
            log.warn("恢复时用户已有其他对局: userId={}, sessionId={}", slot.getUserId(), sessionId);
        }
    }

    private static void markOffline(PlayerSlot slot) {
        if (slot != null) {
            slot.setConnected(false);
        }
    }
}
