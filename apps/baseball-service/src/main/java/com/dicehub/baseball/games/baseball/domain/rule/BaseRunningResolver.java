package com.dicehub.baseball.games.baseball.domain.rule;

import com.dicehub.baseball.games.baseball.domain.model.BaseState;

/**
 * 跑垒推进：按结果注册表中的规则计算新垒况与得分
 */
public final class BaseRunningResolver {

    private BaseRunningResolver() {
    }

    public static BaseAdvance advance(BaseState bases, Outcome outcome) {
        return outcome.definition().baseRunning().advance(bases);
    }
}
