package com.dicehub.web.common;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * 当前用户信息提取工具类
 *
 * <pre>
 * {@code
 * @PostMapping("/sessions")
 * public ResponseEntity<?> create(@AuthenticationPrincipal Jwt jwt) {
 *     String userId = CurrentUserHelper.requireUserId(jwt);
 *     // ...
 * }
 * }
 * </pre>
 */
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String getUserId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    /**
     * 获取用户ID，缺失时视为未认证
     *
     * @throws IllegalArgumentException token 缺失或没有 subject
     */
    public static String requireUserId(Jwt jwt) {
        String userId = getUserId(jwt);
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("缺少用户身份");
        }
        return userId;
    }
}
