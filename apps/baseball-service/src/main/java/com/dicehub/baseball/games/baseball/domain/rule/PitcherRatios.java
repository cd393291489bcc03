package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.PitchingProfile;

/**
 * 投手相对联盟平均的“压制力”比值，大于 1 表示比平均投手更强。
 *
 * @param control   联盟 WHIP / WHIP（WHIP 下限 0.8）
 * @param strikeout K/9 / 联盟 K/9
 * @param walk      联盟 BB/9 / BB/9
 * @param homeRun   联盟 HR/9 / HR/9
 */
public record PitcherRatios(double control, double strikeout, double walk, double homeRun) {

    private static final double MIN_WHIP = 0.8;
    private static final double MIN_PER_NINE = 0.1;

    public static PitcherRatios of(PitchingProfile profile) {
        return new PitcherRatios(
                LeagueAverages.WHIP / Math.max(profile.whip(), MIN_WHIP),
                profile.strikeoutsPerNine() / LeagueAverages.K_PER_9,
                LeagueAverages.BB_PER_9 / Math.max(profile.walksPerNine(), MIN_PER_NINE),
                LeagueAverages.HR_PER_9 / Math.max(profile.homeRunsPerNine(), MIN_PER_NINE));
    }
}
