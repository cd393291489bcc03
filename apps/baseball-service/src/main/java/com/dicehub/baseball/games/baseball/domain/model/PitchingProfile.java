package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.rule.LeagueAverages;

/**
 * 投手数据快照。
 *
 * @param whip              每局被上垒数（WHIP）
 * @param strikeoutsPerNine 每九局三振
 * @param walksPerNine      每九局保送
 * @param homeRunsPerNine   每九局被全垒打
 */
public record PitchingProfile(
        double whip,
        double strikeoutsPerNine,
        double walksPerNine,
        double homeRunsPerNine
) {

    public static PitchingProfile leagueAverage() {
        return new PitchingProfile(LeagueAverages.WHIP, LeagueAverages.K_PER_9,
                LeagueAverages.BB_PER_9, LeagueAverages.HR_PER_9);
    }

    /**
     * 缺失字段按联盟平均补齐
     */
    public static PitchingProfile of(Double whip, Double kPer9, Double bbPer9, Double hrPer9) {
        return new PitchingProfile(
                whip != null ? whip : LeagueAverages.WHIP,
                kPer9 != null ? kPer9 : LeagueAverages.K_PER_9,
                bbPer9 != null ? bbPer9 : LeagueAverages.BB_PER_9,
                hrPer9 != null ? hrPer9 : LeagueAverages.HR_PER_9);
    }
}
