package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BattingProfile;

/**
 * 打者相对联盟平均的比值。
 *
 * @param hit        OPS / 联盟 OPS
 * @param power      SLG / 联盟 SLG
 * @param discipline (保送率/联盟保送率) / (三振率/联盟三振率)
 */
public record BatterRatios(double hit, double power, double discipline) {

    private static final double MIN_STRIKEOUT_RATE = 0.001;

    public static BatterRatios of(BattingProfile profile) {
        double walkRate = profile.plateAppearances() > 0 ? profile.walkRate() : LeagueAverages.WALK_RATE;
        double kRate = profile.plateAppearances() > 0 ? profile.strikeoutRate() : LeagueAverages.STRIKEOUT_RATE;
        kRate = Math.max(kRate, MIN_STRIKEOUT_RATE);
        double discipline = (walkRate / LeagueAverages.WALK_RATE) / (kRate / LeagueAverages.STRIKEOUT_RATE);
        return new BatterRatios(
                profile.onBasePlusSlugging() / LeagueAverages.OPS,
                profile.slugging() / LeagueAverages.SLG,
                discipline);
    }
}
