package com.dicehub.baseball.games.baseball.domain.rule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 一次打席的结果概率分布（不可变，各项之和为 1）
 */
public final class OutcomeDistribution {

    private final EnumMap<Outcome, Double> probabilities;

    private OutcomeDistribution(EnumMap<Outcome, Double> probabilities) {
        this.probabilities = probabilities;
    }

    /**
     * 归一化后构建
     */
    static OutcomeDistribution normalized(EnumMap<Outcome, Double> weights) {
        double total = 0;
        for (double w : weights.values()) {
            total += w;
        }
        if (total <= 0) {
            throw new IllegalStateException("outcome weights must sum to a positive value");
        }
        EnumMap<Outcome, Double> normalized = new EnumMap<>(Outcome.class);
        for (Outcome o : Outcome.values()) {
            normalized.put(o, weights.getOrDefault(o, 0.0) / total);
        }
        return new OutcomeDistribution(normalized);
    }

    public double probability(Outcome outcome) {
        return probabilities.get(outcome);
    }

    public double sum() {
        double total = 0;
        for (double p : probabilities.values()) {
            total += p;
        }
        return total;
    }

    /** 对打者有利的结果总概率 */
    public double goodMass() {
        double total = 0;
        for (Outcome o : Outcome.values()) {
            if (o.helpsBatter()) {
                total += probabilities.get(o);
            }
        }
        return total;
    }

    public Map<Outcome, Double> asMap() {
        return Collections.unmodifiableMap(probabilities);
    }

    /**
     * 按注册表顺序累加概率，返回第一个累计值超过 draw 的结果。
     * 浮点误差导致没有命中时回落到地滚球出局。
     */
    public Outcome select(double draw) {
        if (draw < 0 || draw >= 1 || Double.isNaN(draw)) {
            throw new IllegalArgumentException("draw must be within [0,1): " + draw);
        }
        double cumulative = 0;
        for (Outcome o : Outcome.values()) {
            cumulative += probabilities.get(o);
            if (draw < cumulative) {
                return o;
            }
        }
        return Outcome.GROUND_OUT;
    }

    EnumMap<Outcome, Double> copyWeights() {
        return new EnumMap<>(probabilities);
    }

    @Override
    public String toString() {
        return "OutcomeDistribution" + probabilities;
    }
}
