package com.dicehub.baseball.games.baseball.infrastructure.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 阵容服务返回的阵容视图
 *
 * @param ownerId 所有者（JWT subject）
 * @param slots   守位列表，投手的 battingOrder 为空
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RosterView(String id, String ownerId, String name, List<Slot> slots) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Slot(
            String position,
            Integer battingOrder,
            String playerId,
            String playerName,
            BattingStats batting,
            PitchingStats pitching
    ) {
    }

    /** 打击计数数据，字段可能缺失 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BattingStats(Double ops, Double slg, Integer walks, Integer strikeouts, Integer atBats) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PitchingStats(Double whip, Double kPer9, Double bbPer9, Double hrPer9) {
    }
}
