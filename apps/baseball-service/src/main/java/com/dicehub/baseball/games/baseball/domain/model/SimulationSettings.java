package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.enums.SimulationMode;

/**
 * 创建对局时的随机模式设置
 *
 * @param seed DETERMINISTIC 模式必填
 */
public record SimulationSettings(SimulationMode mode, String seed) {

    public static final SimulationSettings LIVE = new SimulationSettings(SimulationMode.DEFAULT, null);

    public static SimulationSettings deterministic(String seed) {
        return new SimulationSettings(SimulationMode.DETERMINISTIC, seed);
    }

    public boolean isDeterministic() {
        return mode == SimulationMode.DETERMINISTIC;
    }
}
