package com.dicehub.baseball.games.baseball.interfaces.ws;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.application.ConnectionSupervisor;
import com.dicehub.baseball.games.baseball.application.GameEventPublisher;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.MoveResult;
import com.dicehub.baseball.games.baseball.interfaces.ws.dto.BaseballMessages.SessionCmd;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * 掷骰棒球 WebSocket 控制器
 * ----------------------------------------
 *   /app/baseball.join    进入房间（首次或重连），补发局面并通知对手上线
 *   /app/baseball.roll    服务端掷骰并结算，结果广播到房间
 *   /app/baseball.forfeit 认输，结束事件广播到房间
 * 每条消息独立处理，失败时只给发送者回 error 事件。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class BaseballWsController {

    private final SessionCoordinator coordinator;
    private final ConnectionSupervisor supervisor;
    private final GameEventPublisher events;

    @MessageMapping("/baseball.join")
    public void join(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(cmd, sha, (sessionId, userId) -> {
            // 参与者校验：不存在/非参与者直接回错误
            coordinator.getSession(sessionId, userId);
            supervisor.connected(sessionId, userId, sha.getSessionId());
        });
    }

    @MessageMapping("/baseball.roll")
    public void roll(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(cmd, sha, (sessionId, userId) -> {
            MoveResult result = coordinator.roll(sessionId, userId);
            events.rollResult(sessionId, result.move());
            if (result.gameEnded()) {
                events.ended(sessionId, result.ended());
            }
        });
    }

    @MessageMapping("/baseball.forfeit")
    public void forfeit(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        handle(cmd, sha, (sessionId, userId) -> {
            GameEnded ended = coordinator.forfeit(sessionId, userId);
            events.ended(sessionId, ended);
        });
    }

    private void handle(SessionCmd cmd, SimpMessageHeaderAccessor sha, SessionAction action) {
        String sessionId = cmd == null ? null : cmd.getSessionId();
        Principal user = sha.getUser();
        if (user == null) {
            log.warn("WS 消息缺少用户身份: socket={}", sha.getSessionId());
            return;
        }
        String userId = user.getName();
        try {
            if (StringUtils.isBlank(sessionId)) {
                throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.SESSION_ID_REQUIRED);
            }
            action.run(sessionId, userId);
        } catch (GameRuleException e) {
            log.warn("WS 请求被拒绝: sessionId={}, userId={}, code={}, msg={}",
                    sessionId, userId, e.getErrorCode().code(), e.getMessage());
            events.error(sessionId, userId, e.getErrorCode().code(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("WS 请求处理异常: sessionId={}, userId={}", sessionId, userId, e);
            events.error(sessionId, userId, ErrorCode.INTERNAL_ERROR.code(), GameMessages.INTERNAL_ERROR);
        }
    }

    @FunctionalInterface
    private interface SessionAction {
        void run(String sessionId, String userId);
    }
}
