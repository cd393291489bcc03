package com.dicehub.baseball.engine.random;

import org.apache.commons.lang3.StringUtils;

/**
 * 带种子的确定性随机源：FNV-1a(32) 按 UTF-16 码元哈希种子串，xorshift32 生成序列。
 * 相同种子 + 相同调用顺序 => 完全相同的随机序列。
 *
 * 非线程安全，调用方需在房间锁内使用。
 */
public final class SeededRandomSource implements RandomSource {

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;
    /** 哈希结果为 0 时的替代值（xorshift 状态不能为 0） */
    private static final int ZERO_STATE_REPLACEMENT = 0x9e3779b9;
    private static final double TWO_POW_32 = 4294967296.0;

    private int state;

    private SeededRandomSource(int state) {
        this.state = state;
    }

    /**
     * 由种子串创建
     *
     * @throws IllegalArgumentException 种子为空
     */
    public static SeededRandomSource fromSeed(String seed) {
        if (StringUtils.isBlank(seed)) {
            throw new IllegalArgumentException("seed must not be blank");
        }
        return new SeededRandomSource(hash(seed.trim()));
    }

    /**
     * 从持久化的状态恢复（状态为 0 时按非法处理）
     */
    public static SeededRandomSource fromState(long state) {
        int s = (int) state;
        if (s == 0) {
            throw new IllegalArgumentException("xorshift state must be non-zero");
        }
        return new SeededRandomSource(s);
    }

    static int hash(String seed) {
        int h = FNV_OFFSET;
        for (int i = 0; i < seed.length(); i++) {
            h ^= seed.charAt(i);
            h *= FNV_PRIME;
        }
        return h == 0 ? ZERO_STATE_REPLACEMENT : h;
    }

    @Override
    public double nextDouble() {
        int x = state;
        x ^= x << 13;
        x ^= x >>> 17;
        x ^= x << 5;
        state = x;
        return Integer.toUnsignedLong(x) / TWO_POW_32;
    }

    /**
     * 当前内部状态（无符号），用于持久化
     */
    public long currentState() {
        return Integer.toUnsignedLong(state);
    }
}
