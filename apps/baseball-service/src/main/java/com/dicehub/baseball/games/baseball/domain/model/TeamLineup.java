package com.dicehub.baseball.games.baseball.domain.model;

import java.util.Comparator;
import java.util.List;

/**
 * 一支球队的上场快照：9 个棒次 + 先发投手。
 * 加入对局时从阵容服务加载一次，对局内不再访问外部服务。
 */
public record TeamLineup(
        String rosterId,
        String teamName,
        List<LineupSlot> battingOrder,
        PlayerRef startingPitcher,
        PitchingProfile pitching
) {

    public static final int LINEUP_SIZE = 9;

    public TeamLineup {
        if (battingOrder == null || battingOrder.size() != LINEUP_SIZE) {
            throw new IllegalArgumentException("lineup must contain exactly 9 batters");
        }
        battingOrder = battingOrder.stream()
                .sorted(Comparator.comparingInt(LineupSlot::battingOrder))
                .toList();
    }

    /**
     * 按打序计数取当前打者（计数对 9 取模）
     */
    public LineupSlot batterAt(int battingIndex) {
        return battingOrder.get(Math.floorMod(battingIndex, LINEUP_SIZE));
    }
}
