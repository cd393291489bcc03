package com.dicehub.baseball.engine.random;

/**
 * 随机源抽象。
 * 实时对局用非确定性实现，模拟/回放用带种子的确定性实现。
 */
public interface RandomSource {

    /**
     * @return [0, 1) 区间的均匀分布随机数
     */
    double nextDouble();

    /**
     * @return [0, bound) 区间的整数
     */
    default int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        int value = (int) Math.floor(nextDouble() * bound);
        return Math.min(value, bound - 1);
    }
}
