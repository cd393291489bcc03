package com.dicehub.baseball.games.baseball.domain.model;

import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.enums.SimulationMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局会话实体（可变聚合，只在房间锁内修改）。
 * 同一结构既是运行态，也是持久化 JSON 的数据模型。
 */
@Data
public class GameSession {

    // ---- 基本信息 ----
    private String id;
    /** 邀请码（仅 WAITING 期间有效） */
    private String joinCode;
    private SessionStatus status;

    // ---- 座位：创建者为主队，加入者为客队 ----
    private PlayerSlot home;
    private PlayerSlot visitor;
    private TeamLineup homeLineup;
    private TeamLineup visitorLineup;

    // ---- 局面与走子记录 ----
    private GameState state;
    private List<Move> moves = new ArrayList<>();

    // ---- 模拟模式 ----
    private SimulationMode simulationMode = SimulationMode.DEFAULT;
    private String seed;
    /** 带种子随机源的当前状态（仅 DETERMINISTIC） */
    private Long rngState;

    // ---- 结束信息 ----
    private String winnerId;
    private EndReason endReason;

    // ---- 时间戳（epoch ms）与版本 ----
    private long createdAt;
    private Long startedAt;
    private Long endedAt;
    private long updatedAt;
    /** 每次修改递增，持久化时用于丢弃旧快照 */
    private long version;

    /** 用户所在座位，非参与者返回 null */
    public Seat seatOf(String userId) {
        if (userId == null) {
            return null;
        }
        if (home != null && userId.equals(home.getUserId())) {
            return Seat.HOME;
        }
        if (visitor != null && userId.equals(visitor.getUserId())) {
            return Seat.VISITOR;
        }
        return null;
    }

    public boolean isParticipant(String userId) {
        return seatOf(userId) != null;
    }

    public PlayerSlot slot(Seat seat) {
        return seat == Seat.HOME ? home : visitor;
    }

    public TeamLineup lineup(Seat seat) {
        return seat == Seat.HOME ? homeLineup : visitorLineup;
    }

    /** 座位上的用户ID（座位为空返回 null） */
    public String userAt(Seat seat) {
        PlayerSlot slot = slot(seat);
        return slot == null ? null : slot.getUserId();
    }

    /** 对手用户ID */
    public String opponentOf(String userId) {
        Seat seat = seatOf(userId);
        return seat == null ? null : userAt(seat.opponent());
    }

    public int nextMoveNumber() {
        return moves.size() + 1;
    }

    /**
     * 深拷贝快照（record 本身不可变，只复制可变部分）
     */
    public GameSession copy() {
        GameSession c = new GameSession();
        c.id = id;
        c.joinCode = joinCode;
        c.status = status;
        c.home = home == null ? null : home.copy();
        c.visitor = visitor == null ? null : visitor.copy();
        c.homeLineup = homeLineup;
        c.visitorLineup = visitorLineup;
        c.state = state;
        c.moves = new ArrayList<>(moves);
        c.simulationMode = simulationMode;
        c.seed = seed;
        c.rngState = rngState;
        c.winnerId = winnerId;
        c.endReason = endReason;
        c.createdAt = createdAt;
        c.startedAt = startedAt;
        c.endedAt = endedAt;
        c.updatedAt = updatedAt;
        c.version = version;
        return c;
    }

    public void touch(long now) {
        this.updatedAt = now;
        this.version++;
    }
}
