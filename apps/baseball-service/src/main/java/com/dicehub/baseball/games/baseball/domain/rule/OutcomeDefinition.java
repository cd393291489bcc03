package com.dicehub.baseball.games.baseball.domain.rule;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 单个打席结果的完整定义：基础概率、对打者是否有利、修正函数、跑垒规则、出局数和描述模板。
 *
 * @param baseProbability 联盟平均水平下的基础概率
 * @param helpsBatter     true 为安打/保送类，false 为出局类
 * @param batterModifier  打者修正（已夹到该结果的区间内）
 * @param pitcherModifier 投手修正（已夹到该结果的区间内）
 * @param baseRunning     跑垒规则
 * @param outsRecorded    该结果记录的出局数
 * @param templates       描述模板，支持 {batter} / {pitcher} 占位符
 */
public record OutcomeDefinition(
        double baseProbability,
        boolean helpsBatter,
        ToDoubleFunction<BatterRatios> batterModifier,
        ToDoubleFunction<PitcherRatios> pitcherModifier,
        BaseRunningRule baseRunning,
        int outsRecorded,
        List<String> templates
) {

    /** 不受该方影响的修正 */
    static <T> ToDoubleFunction<T> neutral() {
        return any -> 1.0;
    }

    /**
     * 按极性组合修正系数：
     * 有利结果 = 打者 / 投手，不利结果 = 投手 / 打者
     */
    double adjust(BatterRatios batter, PitcherRatios pitcher) {
        double b = batterModifier.applyAsDouble(batter);
        double p = pitcherModifier.applyAsDouble(pitcher);
        return helpsBatter
                ? baseProbability * b * (1.0 / p)
                : baseProbability * (1.0 / b) * p;
    }
}
