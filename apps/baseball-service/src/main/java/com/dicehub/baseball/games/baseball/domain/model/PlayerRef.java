package com.dicehub.baseball.games.baseball.domain.model;

/**
 * 球员引用（id + 显示名）
 */
public record PlayerRef(String id, String name) {
}
