package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.rule.LeagueAverages;

/**
 * 打者数据快照（每个打席不可变）。
 *
 * @param onBasePlusSlugging 上垒率+长打率（OPS）
 * @param slugging           长打率（SLG）
 * @param walkRate           保送 / 打数
 * @param strikeoutRate      三振 / 打数
 * @param plateAppearances   打数，为 0 时保送率与三振率按联盟平均处理
 */
public record BattingProfile(
        double onBasePlusSlugging,
        double slugging,
        double walkRate,
        double strikeoutRate,
        int plateAppearances
) {

    /** 联盟平均打者 */
    public static BattingProfile leagueAverage() {
        return new BattingProfile(LeagueAverages.OPS, LeagueAverages.SLG,
                LeagueAverages.WALK_RATE, LeagueAverages.STRIKEOUT_RATE, 500);
    }

    /**
     * 由计数类数据构建，缺失字段使用联盟默认值
     * （OPS .720 / SLG .400 / 50 保送 / 100 三振 / 500 打数）
     */
    public static BattingProfile fromCounts(Double ops, Double slg, Integer walks, Integer strikeouts, Integer atBats) {
        double o = ops != null && ops > 0 ? ops : LeagueAverages.OPS;
        double s = slg != null && slg > 0 ? slg : LeagueAverages.SLG;
        int bb = walks != null ? walks : 50;
        int so = strikeouts != null ? strikeouts : 100;
        int ab = atBats != null ? atBats : 500;
        if (ab <= 0) {
            return new BattingProfile(o, s, LeagueAverages.WALK_RATE, LeagueAverages.STRIKEOUT_RATE, 0);
        }
        return new BattingProfile(o, s, (double) bb / ab, (double) so / ab, ab);
    }
}
