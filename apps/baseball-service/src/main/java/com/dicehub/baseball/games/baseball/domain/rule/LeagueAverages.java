package com.dicehub.baseball.games.baseball.domain.rule;

/**
 * 联盟平均数据：所有修正系数都以此为基准，平均水平的打者/投手修正系数为 1.0。
 */
public final class LeagueAverages {

    private LeagueAverages() {
    }

    public static final double OPS = 0.720;
    public static final double SLG = 0.400;
    public static final double WALK_RATE = 0.080;
    public static final double STRIKEOUT_RATE = 0.200;

    public static final double WHIP = 1.30;
    public static final double K_PER_9 = 8.5;
    public static final double BB_PER_9 = 3.0;
    public static final double HR_PER_9 = 1.2;
}
