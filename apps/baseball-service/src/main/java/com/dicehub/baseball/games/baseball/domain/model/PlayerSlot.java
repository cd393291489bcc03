package com.dicehub.baseball.games.baseball.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局中的一个座位
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerSlot {
    /** 用户ID（JWT subject） */
    private String userId;
    /** 阵容ID */
    private String rosterId;
    /** 阵容显示名 */
    private String teamName;
    /** 阵容已校验、可开打 */
    private boolean ready;
    /** 当前是否在线 */
    private boolean connected;
    /** 最近一次活跃时间（epoch ms） */
    private long lastActiveAt;

    public PlayerSlot copy() {
        return new PlayerSlot(userId, rosterId, teamName, ready, connected, lastActiveAt);
    }
}
