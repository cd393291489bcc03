package com.dicehub.baseball.engine.random;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 实时对局使用的随机源（ThreadLocalRandom，无共享状态）。
 */
public final class DefaultRandomSource implements RandomSource {

    public static final DefaultRandomSource INSTANCE = new DefaultRandomSource();

    private DefaultRandomSource() {
    }

    @Override
    public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
