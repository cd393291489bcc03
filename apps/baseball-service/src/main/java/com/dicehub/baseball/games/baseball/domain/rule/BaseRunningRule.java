package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BaseState;

/**
 * 单个结果的跑垒规则
 */
@FunctionalInterface
public interface BaseRunningRule {

    BaseAdvance advance(BaseState bases);

    /** 出局类结果：跑者不动（无双杀、无高飞牺牲打） */
    BaseRunningRule HOLD = bases -> new BaseAdvance(bases, 0);

    static BaseRunningRule homeRun() {
        return bases -> new BaseAdvance(BaseState.EMPTY, bases.runnersOn() + 1);
    }

    static BaseRunningRule triple() {
        return bases -> new BaseAdvance(new BaseState(false, false, true), bases.runnersOn());
    }

    /** 二垒、三垒跑者回本垒，一垒跑者上三垒 */
    static BaseRunningRule doubleHit() {
        return bases -> {
            int runs = (bases.second() ? 1 : 0) + (bases.third() ? 1 : 0);
            return new BaseAdvance(new BaseState(false, true, bases.first()), runs);
        };
    }

    /** 三垒跑者得分，其他跑者各进一个垒 */
    static BaseRunningRule single() {
        return bases -> new BaseAdvance(
                new BaseState(true, bases.first(), bases.second()),
                bases.third() ? 1 : 0);
    }

    /** 只推进被挤压的跑者，满垒才得分 */
    static BaseRunningRule walk() {
        return bases -> {
            boolean forcedToSecond = bases.first();
            boolean forcedToThird = forcedToSecond && bases.second();
            boolean forcedHome = forcedToThird && bases.third();
            BaseState next = new BaseState(
                    true,
                    bases.second() || forcedToSecond,
                    bases.third() || forcedToThird);
            return new BaseAdvance(next, forcedHome ? 1 : 0);
        };
    }
}
