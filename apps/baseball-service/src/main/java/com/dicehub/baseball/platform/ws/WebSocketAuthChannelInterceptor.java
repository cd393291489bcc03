package com.dicehub.baseball.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * STOMP 认证拦截器
 *
 * 在 CONNECT 阶段验证 JWT 并设置用户身份。Principal 名称取 JWT subject，
 * 与 REST 接口的 userId 一致，点对点消息（/user/queue/baseball）也按它路由。
 * 验证失败时拒绝 CONNECT。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String token = extractToken(accessor);
        if (token == null) {
            throw new IllegalArgumentException("STOMP CONNECT 缺少 token");
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
            accessor.setUser(new JwtAuthenticationToken(jwt, authorities, jwt.getSubject()));
        } catch (JwtException e) {
            log.warn("STOMP CONNECT token 校验失败: socket={}, err={}", accessor.getSessionId(), e.getMessage());
            throw new IllegalArgumentException("token 无效", e);
        }
        return message;
    }

    /**
     * 支持 Authorization: Bearer xxx 或 access_token: xxx
     */
    static String extractToken(StompHeaderAccessor accessor) {
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) {
            auth = firstHeader(accessor, "authorization");
        }
        if (auth != null && auth.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
            return auth.substring(7).trim();
        }
        String tokenOnly = firstHeader(accessor, "access_token");
        return tokenOnly == null || tokenOnly.isBlank() ? null : tokenOnly.trim();
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
