package com.dicehub.baseball.games.baseball.domain.rule;

/**
 * 修正系数工具
 */
final class Modifiers {

    private Modifiers() {
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
