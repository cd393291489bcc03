package com.dicehub.baseball.platform.ws;

import com.dicehub.baseball.games.baseball.application.ConnectionSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * 监听 STOMP 断开事件，交给连接监管判断玩家是否离线。
 * 上线由 /app/baseball.join 显式触发，这里不处理 CONNECT。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final ConnectionSupervisor supervisor;

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String socketId = event.getSessionId();
        String user = event.getUser() == null ? null : event.getUser().getName();
        log.debug("WebSocket 断开: socket={}, user={}, status={}", socketId, user, event.getCloseStatus());
        supervisor.socketClosed(socketId);
    }
}
