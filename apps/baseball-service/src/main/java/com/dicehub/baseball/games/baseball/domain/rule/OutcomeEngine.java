package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BattingProfile;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.PitchingProfile;

import java.util.EnumMap;

/**
 * 打席结果引擎（纯函数，无共享可变状态）。
 *
 * 流程：
 * 1. 按打者/投手数据计算每个结果的修正后权重并归一化；
 * 2. 按骰子点数偏移概率：点数越大，越多概率从出局类移到安打/保送类；
 * 3. 每项概率保底后再次归一化；
 * 4. 用 [0,1) 的随机数按固定顺序加权抽样。
 */
public class OutcomeEngine {

    /** 骰子偏移后的单项概率下限 */
    public static final double MIN_PROBABILITY = 0.001;

    /** 默认骰子偏移幅度 */
    public static final double DEFAULT_DICE_BIAS_SHIFT = 0.05;

    private static final int NEUTRAL_TOTAL = 7;

    private final double diceBiasShift;

    public OutcomeEngine() {
        this(DEFAULT_DICE_BIAS_SHIFT);
    }

    /**
     * @param diceBiasShift |bias| = 0.5 时，每单位偏移移动的概率质量比例，取值 [0,1]
     */
    public OutcomeEngine(double diceBiasShift) {
        if (diceBiasShift < 0 || diceBiasShift > 1 || Double.isNaN(diceBiasShift)) {
            throw new IllegalArgumentException("dice bias shift must be within [0,1]: " + diceBiasShift);
        }
        this.diceBiasShift = diceBiasShift;
    }

    public double getDiceBiasShift() {
        return diceBiasShift;
    }

    /**
     * 解析一个打席结果
     *
     * @param draw [0,1) 的均匀随机数
     */
    public Outcome resolve(BattingProfile batter, PitchingProfile pitcher, DiceRoll dice, double draw) {
        return distribution(batter, pitcher, dice).select(draw);
    }

    /**
     * 计算最终概率分布（已含骰子偏移）
     */
    public OutcomeDistribution distribution(BattingProfile batter, PitchingProfile pitcher, DiceRoll dice) {
        return applyDiceBias(statAdjusted(batter, pitcher), dice);
    }

    /**
     * 只按数据修正、不含骰子偏移的分布
     */
    public OutcomeDistribution statAdjusted(BattingProfile batter, PitchingProfile pitcher) {
        BatterRatios b = BatterRatios.of(batter);
        PitcherRatios p = PitcherRatios.of(pitcher);
        EnumMap<Outcome, Double> weights = new EnumMap<>(Outcome.class);
        for (Outcome o : Outcome.values()) {
            weights.put(o, o.definition().adjust(b, p));
        }
        return OutcomeDistribution.normalized(weights);
    }

    /**
     * 骰子偏移：bias = (点数和 - 7) / 10，移动量 = |bias| × 偏移幅度 × 被移出组的总概率，
     * 组内按各项原有占比分摊。
     */
    OutcomeDistribution applyDiceBias(OutcomeDistribution base, DiceRoll dice) {
        double bias = (dice.total() - NEUTRAL_TOTAL) / 10.0;
        double shift = Math.abs(bias) * diceBiasShift;
        EnumMap<Outcome, Double> weights = base.copyWeights();

        if (shift > 0) {
            double goodTotal = 0;
            double badTotal = 0;
            for (Outcome o : Outcome.values()) {
                if (o.helpsBatter()) {
                    goodTotal += weights.get(o);
                } else {
                    badTotal += weights.get(o);
                }
            }
            boolean towardBatter = bias > 0;
            double moved = shift * (towardBatter ? badTotal : goodTotal);
            for (Outcome o : Outcome.values()) {
                double w = weights.get(o);
                boolean receiving = o.helpsBatter() == towardBatter;
                double groupTotal = o.helpsBatter() ? goodTotal : badTotal;
                if (groupTotal <= 0) {
                    continue;
                }
                double delta = (w / groupTotal) * moved;
                weights.put(o, receiving ? w + delta : w - delta);
            }
        }

        for (Outcome o : Outcome.values()) {
            weights.put(o, Math.max(MIN_PROBABILITY, weights.get(o)));
        }
        return OutcomeDistribution.normalized(weights);
    }
}
