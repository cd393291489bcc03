package com.dicehub.baseball.games.baseball.domain.repository;

import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import lombok.Builder;
import lombok.Value;

/**
 * 会话局部更新：只写非空字段。目前用于在线状态变化，避免整份会话（含走子记录）重写。
 * 只有已存版本恰好是 version - 1 时才生效，否则由调用方改写整份快照。
 */
@Value
@Builder
public class SessionPatch {

    /** 补丁对应的会话版本 */
    long version;
    long updatedAt;

    Boolean homeConnected;
    Long homeLastActiveAt;
    Boolean visitorConnected;
    Long visitorLastActiveAt;

    /**
     * 某个座位的在线状态补丁
     */
    public static SessionPatch connection(GameSession session, Seat seat) {
        PlayerSlot slot = session.slot(seat);
        SessionPatchBuilder b = SessionPatch.builder()
                .version(session.getVersion())
                .updatedAt(session.getUpdatedAt());
        if (seat == Seat.HOME) {
            b.homeConnected(slot.isConnected()).homeLastActiveAt(slot.getLastActiveAt());
        } else {
            b.visitorConnected(slot.isConnected()).visitorLastActiveAt(slot.getLastActiveAt());
        }
        return b.build();
    }

    /**
     * 补丁只能接在紧邻的上一版本之后；已存版本落后更多时中间的整体写入尚未落库，不能跳过
     */
    public boolean followsVersion(long storedVersion) {
        return storedVersion == version - 1;
    }

    /**
     * 应用到会话上（调用方负责版本比较）
     */
    public void applyTo(GameSession session) {
        if (homeConnected != null && session.getHome() != null) {
            session.getHome().setConnected(homeConnected);
        }
        if (homeLastActiveAt != null && session.getHome() != null) {
            session.getHome().setLastActiveAt(homeLastActiveAt);
        }
        if (visitorConnected != null && session.getVisitor() != null) {
            session.getVisitor().setConnected(visitorConnected);
        }
        if (visitorLastActiveAt != null && session.getVisitor() != null) {
            session.getVisitor().setLastActiveAt(visitorLastActiveAt);
        }
        session.setUpdatedAt(updatedAt);
        session.setVersion(version);
    }
}
