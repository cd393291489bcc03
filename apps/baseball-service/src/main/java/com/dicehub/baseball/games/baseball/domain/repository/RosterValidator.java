package com.dicehub.baseball.games.baseball.domain.repository;

import com.dicehub.baseball.games.baseball.domain.model.TeamLineup;

import java.util.List;

/**
 * 阵容服务（外部协作方）的抽象。
 * 实现可能发起远程调用，调用方不得在房间锁内使用。
 */
public interface RosterValidator {

    boolean isOwnedBy(String userId, String rosterId);

    RosterCheck checkComplete(String rosterId);

    /**
     * 加载上场快照（9 棒 + 先发投手）
     */
    TeamLineup loadLineup(String rosterId);

    /**
     * 完整性检查结果
     *
     * @param complete 是否完整
     * @param name     阵容名
     * @param missing  缺失的守位/棒次
     */
    record RosterCheck(boolean complete, String name, List<String> missing) {
    }
}
