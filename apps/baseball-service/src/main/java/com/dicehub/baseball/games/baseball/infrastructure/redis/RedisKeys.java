package com.dicehub.baseball.games.baseball.infrastructure.redis;

import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;

import java.util.Locale;

/**
 * 统一管理 Redis Key 的前缀与拼接。
 */
public final class RedisKeys {

    private static final String PFX = "baseball:";

    private RedisKeys() {}

    // ---- 会话 JSON ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }

    // ---- 用户维度：参与过的会话（ZSET，score = createdAt） ----
    public static String userSessions(String userId) {
        return PFX + "user:" + userId + ":sessions";
    }

    // ---- 状态维度：会话ID集合（SET） ----
    public static String statusIndex(SessionStatus status) {
        return PFX + "status:" + status.wireName();
    }

    // ---- 邀请码 → 等待中的会话 ----
    public static String joinCode(String code) {
        return PFX + "joincode:" + code.trim().toUpperCase(Locale.ROOT);
    }
}
