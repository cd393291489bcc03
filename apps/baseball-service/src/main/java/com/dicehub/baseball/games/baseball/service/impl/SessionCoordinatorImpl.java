package com.dicehub.baseball.games.baseball.service.impl;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.application.GameRoom;
import com.dicehub.baseball.games.baseball.application.GameRoomRegistry;
import com.dicehub.baseball.games.baseball.application.SessionPersister;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.enums.EndReason;
import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.DiceRoll;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.Move;
import com.dicehub.baseball.games.baseball.domain.model.MoveResult;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.domain.model.SimulationSettings;
import com.dicehub.baseball.games.baseball.domain.model.TeamLineup;
import com.dicehub.baseball.games.baseball.domain.repository.GameSessionRepository;
import com.dicehub.baseball.games.baseball.domain.repository.RosterValidator;
import com.dicehub.baseball.games.baseball.domain.rule.AtBatResolver;
import com.dicehub.baseball.games.baseball.domain.rule.MoveTransition;
import com.dicehub.baseball.games.baseball.domain.rule.PlayResult;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 对局会话协调服务实现。
 *
 * 并发模型：
 * - 每个房间一把锁（{@link GameRoom}），走子、认输、加入、连接变化、计时器回调都在这把锁内串行执行；
 * - 阵容服务、存储等外部调用一律在锁外进行；
 * - 锁内只修改内存并拷贝快照，锁外再异步写回存储。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionCoordinatorImpl implements SessionCoordinator {

    /** 邀请码字母表：去掉易混淆的 I、O、0、1 */
    static final String JOIN_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int JOIN_CODE_LENGTH = 6;
    private static final int JOIN_CODE_MAX_ATTEMPTS = 20;

    private final GameRoomRegistry registry;
    private final GameSessionRepository repository;
    private final RosterValidator rosterValidator;
    private final SessionPersister persister;
    private final AtBatResolver atBatResolver;

    private final SecureRandom codeRandom = new SecureRandom();

    // ======================== 创建 / 加入 ========================

    @Override
    public GameSession create(String userId, String rosterId, SimulationSettings simulation) {
        requireText(userId, "userId");
        requireText(rosterId, "rosterId");
        SimulationSettings sim = simulation == null || simulation.mode() == null ? SimulationSettings.LIVE : simulation;
        if (sim.isDeterministic() && StringUtils.isBlank(sim.seed())) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.SEED_REQUIRED);
        }
        if (registry.liveSessionOf(userId).isPresent()) {
            throw new GameRuleException(ErrorCode.CONFLICT, GameMessages.ALREADY_IN_SESSION);
        }

        // 阵容校验（远程调用，不持有任何锁）
        TeamLineup lineup = loadValidatedLineup(userId, rosterId);

        String sessionId = UUID.randomUUID().toString();
        if (!registry.claimUser(userId, sessionId)) {
            throw new GameRuleException(ErrorCode.CONFLICT, GameMessages.ALREADY_IN_SESSION);
        }
        String joinCode;
        try {
            joinCode = claimUniqueJoinCode(sessionId);
        } catch (RuntimeException e) {
            registry.releaseUser(userId, sessionId);
            throw e;
        }

        long now = System.currentTimeMillis();
        GameSession session = new GameSession();
        session.setId(sessionId);
        session.setJoinCode(joinCode);
        session.setStatus(SessionStatus.WAITING);
        session.setHome(new PlayerSlot(userId, rosterId, lineup.teamName(), true, true, now));
        session.setHomeLineup(lineup);
        session.setState(GameState.initial());
        session.setSimulationMode(sim.mode());
        session.setSeed(sim.isDeterministic() ? sim.seed().trim() : null);
        session.setCreatedAt(now);
        session.touch(now);

        GameRoom room = new GameRoom(session);
        GameSession snapshot = room.locked(() -> {
            room.syncRandomState();
            return room.session().copy();
        });
        registry.register(room);
        try {
            persister.persistNow(snapshot);
        } catch (RuntimeException e) {
            registry.evict(sessionId);
            registry.releaseJoinCode(joinCode, sessionId);
            registry.releaseUser(userId, sessionId);
            throw e;
        }
        log.info("创建对局: sessionId={}, userId={}, joinCode={}, mode={}",
                sessionId, userId, joinCode, sim.mode().wireName());
        return snapshot;
    }

    @Override
    public GameSession joinByCode(String joinCode, String userId, String rosterId) {
        requireText(joinCode, "joinCode");
        String normalized = joinCode.trim().toUpperCase(Locale.ROOT);
        String sessionId = registry.sessionIdByJoinCode(normalized)
                .orElseThrow(() -> new GameRuleException(ErrorCode.SESSION_NOT_FOUND, GameMessages.JOIN_CODE_NOT_FOUND));
        return join(sessionId, userId, rosterId);
    }

    @Override
    public GameSession join(String sessionId, String userId, String rosterId) {
        requireText(userId, "userId");
        requireText(rosterId, "rosterId");
        GameRoom room = registry.find(sessionId).orElseThrow(() -> missingRoom(sessionId, null));

        // 先做廉价的状态预检，避免无谓的远程调用
        room.locked(() -> {
            checkJoinable(room.session(), userId);
        });

        TeamLineup lineup = loadValidatedLineup(userId, rosterId);

        if (!registry.claimUser(userId, sessionId)) {
            throw new GameRuleException(ErrorCode.CONFLICT, GameMessages.ALREADY_IN_SESSION);
        }

        GameSession snapshot;
        try {
            snapshot = room.locked(() -> {
                GameSession session = room.session();
                // 远程调用期间可能已有其他人加入，重新检查
                checkJoinable(session, userId);
                long now = System.currentTimeMillis();
                session.setVisitor(new PlayerSlot(userId, rosterId, lineup.teamName(), true, true, now));
                session.setVisitorLineup(lineup);
                transition(session, SessionStatus.ACTIVE);
                session.setStartedAt(now);
                session.touch(now);
                return session.copy();
            });
        } catch (RuntimeException e) {
            registry.releaseUser(userId, sessionId);
            throw e;
        }

        registry.releaseJoinCode(snapshot.getJoinCode(), sessionId);
        persister.persistAsync(snapshot);
        log.info("加入对局: sessionId={}, home={}, visitor={}", sessionId, snapshot.getHome().getUserId(), userId);
        return snapshot;
    }

    private static void checkJoinable(GameSession session, String userId) {
        if (userId.equals(session.getHome().getUserId())) {
            throw new GameRuleException(ErrorCode.SELF_JOIN, GameMessages.SELF_JOIN);
        }
        if (session.getStatus() != SessionStatus.WAITING || session.getVisitor() != null) {
            throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.SESSION_NOT_WAITING);
        }
    }

    // ======================== 走子 ========================

    @Override
    public MoveResult applyMove(String sessionId, String userId, DiceRoll diceRoll) {
        if (diceRoll == null) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.INVALID_DICE);
        }
        return move(sessionId, userId, diceRoll);
    }

    @Override
    public MoveResult roll(String sessionId, String userId) {
        return move(sessionId, userId, null);
    }

    /**
     * @param suppliedDice 为 null 时在校验通过后由房间随机源掷骰（校验失败不消耗随机数）
     */
    private MoveResult move(String sessionId, String userId, DiceRoll suppliedDice) {
        GameRoom room = registry.find(sessionId).orElseThrow(() -> missingRoom(sessionId, userId));

        MoveResult result = room.locked(() -> {
            GameSession session = room.session();
            DiceRoll dice = suppliedDice;
            if (dice == null) {
                MoveTransition.validate(session, userId);
                dice = DiceRoll.roll(room.random());
            }
            PlayResult play = MoveTransition.apply(session, userId, dice, atBatResolver, room.random());

            long now = System.currentTimeMillis();
            GameState before = session.getState();
            Move move = new Move(session.nextMoveNumber(), userId, before.inning(), before.half(),
                    play.diceRoll(), play.outcome(), play.runsScored(), play.outsRecorded(), play.description(),
                    play.batter(), play.pitcher(), play.newState(), now);
            session.getMoves().add(move);
            session.setState(play.newState());
            session.slot(session.seatOf(userId)).setLastActiveAt(now);
            room.syncRandomState();
            session.touch(now);

            GameEnded ended = null;
            if (play.newState().gameOver()) {
                ended = endLocked(room, play.newState().winner(), EndReason.COMPLETED, now);
            }
            return new MoveResult(session.copy(), move, ended);
        });

        log.debug("走子: sessionId={}, userId={}, move={}, dice={}, outcome={}, runs={}",
                sessionId, userId, result.move().moveNumber(), result.move().diceRoll().asList(),
                result.move().outcome().wireName(), result.move().runsScored());
        if (result.gameEnded()) {
            afterEnd(result.session());
            log.info("比赛结束: sessionId={}, winner={}, score={}-{}", sessionId, result.ended().winnerId(),
                    result.ended().visitorScore(), result.ended().homeScore());
        }
        persister.persistAsync(result.session());
        return result;
    }

    // ======================== 认输 / 取消 / 结束 ========================

    @Override
    public GameEnded forfeit(String sessionId, String userId) {
        return forfeit(sessionId, userId, EndReason.FORFEIT);
    }

    @Override
    public GameEnded forfeit(String sessionId, String userId, EndReason reason) {
        GameRoom room = registry.find(sessionId).orElseThrow(() -> missingRoom(sessionId, userId));
        EndOutcome out = room.locked(() -> {
            GameSession session = room.session();
            Seat seat = requireSeat(session, userId);
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.SESSION_NOT_ACTIVE);
            }
            GameEnded ended = endLocked(room, seat.opponent(), reason, System.currentTimeMillis());
            return new EndOutcome(ended, session.copy());
        });
        afterEnd(out.snapshot());
        persister.persistAsync(out.snapshot());
        log.info("判负: sessionId={}, loser={}, winner={}, reason={}",
                sessionId, userId, out.ended().winnerId(), reason.wireName());
        return out.ended();
    }

    @Override
    public GameSession cancel(String sessionId, String userId) {
        GameRoom room = registry.find(sessionId).orElseThrow(() -> missingRoom(sessionId, userId));
        GameSession snapshot = room.locked(() -> {
            GameSession session = room.session();
            Seat seat = requireSeat(session, userId);
            if (seat != Seat.HOME) {
                throw new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.CANCEL_ONLY_CREATOR);
            }
            if (session.getStatus() != SessionStatus.WAITING) {
                throw new GameRuleException(ErrorCode.CONFLICT, GameMessages.CANCEL_ONLY_WAITING);
            }
            long now = System.currentTimeMillis();
            transition(session, SessionStatus.ABANDONED);
            session.setEndReason(EndReason.ABANDONED);
            session.setEndedAt(now);
            room.cancelAllTimers();
            session.touch(now);
            return session.copy();
        });
        afterEnd(snapshot);
        persister.persistAsync(snapshot);
        log.info("取消对局: sessionId={}, userId={}", sessionId, userId);
        return snapshot;
    }

    @Override
    public GameEnded complete(String sessionId, String winnerId) {
        GameRoom room = registry.find(sessionId).orElseThrow(() -> missingRoom(sessionId, null));
        EndOutcome out = room.locked(() -> {
            GameSession session = room.session();
            Seat seat = session.seatOf(winnerId);
            if (seat == null) {
                throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.WINNER_NOT_PARTICIPANT);
            }
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.SESSION_NOT_ACTIVE);
            }
            GameEnded ended = endLocked(room, seat, EndReason.COMPLETED, System.currentTimeMillis());
            return new EndOutcome(ended, session.copy());
        });
        afterEnd(out.snapshot());
        persister.persistAsync(out.snapshot());
        log.info("结束对局: sessionId={}, winner={}", sessionId, winnerId);
        return out.ended();
    }

    /**
     * 锁内结束对局：状态迁移、记录胜负、局面置为结束、取消全部断线计时器
     */
    private GameEnded endLocked(GameRoom room, Seat winnerSeat, EndReason reason, long now) {
        GameSession session = room.session();
        transition(session, reason.terminalStatus());
        String winnerId = session.userAt(winnerSeat);
        String loserId = session.userAt(winnerSeat.opponent());
        session.setWinnerId(winnerId);
        session.setEndReason(reason);
        session.setEndedAt(now);
        if (!session.getState().gameOver()) {
            session.setState(session.getState().finished(winnerSeat));
        }
        room.cancelAllTimers();
        session.touch(now);
        GameState finalState = session.getState();
        return new GameEnded(session.getId(), winnerId, loserId, reason,
                finalState.visitorScore(), finalState.homeScore());
    }

    /**
     * 锁外收尾：释放占位并把房间移出内存（终态只从存储读取）
     */
    private void afterEnd(GameSession snapshot) {
        String id = snapshot.getId();
        if (snapshot.getHome() != null) {
            registry.releaseUser(snapshot.getHome().getUserId(), id);
        }
        if (snapshot.getVisitor() != null) {
            registry.releaseUser(snapshot.getVisitor().getUserId(), id);
        }
        registry.releaseJoinCode(snapshot.getJoinCode(), id);
        registry.evict(id);
    }

    private static void transition(GameSession session, SessionStatus next) {
        SessionStatus current = session.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.formatIllegalTransition(current, next));
        }
        session.setStatus(next);
    }

    // ======================== 查询 ========================

    @Override
    public GameSession getSession(String sessionId, String userId) {
        Optional<GameRoom> room = registry.find(sessionId);
        GameSession session = room.isPresent()
                ? room.get().locked(() -> room.get().session().copy())
                : fromStore(() -> repository.findById(sessionId))
                    .orElseThrow(() -> new GameRuleException(ErrorCode.SESSION_NOT_FOUND, GameMessages.SESSION_NOT_FOUND));
        if (!session.isParticipant(userId)) {
            throw new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.NOT_A_PARTICIPANT);
        }
        return session;
    }

    @Override
    public List<GameSession> listSessions(String userId, Set<SessionStatus> statuses) {
        Set<SessionStatus> wanted = statuses == null || statuses.isEmpty()
                ? SessionStatus.LIVE : EnumSet.copyOf(statuses);
        Map<String, GameSession> result = new LinkedHashMap<>();

        // 未结束的对局以内存为准
        registry.liveSessionOf(userId)
                .flatMap(registry::find)
                .map(r -> r.locked(() -> r.session().copy()))
                .filter(s -> wanted.contains(s.getStatus()))
                .ifPresent(s -> result.put(s.getId(), s));

        // 已结束的对局从存储读取
        Set<SessionStatus> terminal = EnumSet.noneOf(SessionStatus.class);
        wanted.stream().filter(SessionStatus::isTerminal).forEach(terminal::add);
        if (!terminal.isEmpty()) {
            for (GameSession stored : fromStore(() -> repository.findByUser(userId, terminal))) {
                if (registry.find(stored.getId()).isEmpty()) {
                    result.putIfAbsent(stored.getId(), stored);
                }
            }
        }

        List<GameSession> list = new ArrayList<>(result.values());
        list.sort(Comparator.comparingLong(GameSession::getCreatedAt).reversed());
        return list;
    }

    // ======================== 内部工具 ========================

    /**
     * 房间不在内存中：区分“不存在 / 非参与者 / 已结束”
     */
    private GameRuleException missingRoom(String sessionId, String userId) {
        Optional<GameSession> stored = fromStore(() -> repository.findById(sessionId));
        if (stored.isEmpty()) {
            return new GameRuleException(ErrorCode.SESSION_NOT_FOUND, GameMessages.SESSION_NOT_FOUND);
        }
        if (userId != null && !stored.get().isParticipant(userId)) {
            return new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.NOT_A_PARTICIPANT);
        }
        return new GameRuleException(ErrorCode.INVALID_STATE, GameMessages.SESSION_NOT_ACTIVE);
    }

    private static Seat requireSeat(GameSession session, String userId) {
        Seat seat = session.seatOf(userId);
        if (seat == null) {
            throw new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.NOT_A_PARTICIPANT);
        }
        return seat;
    }

    /**
     * 阵容归属 + 完整性校验，并加载上场快照
     */
    private TeamLineup loadValidatedLineup(String userId, String rosterId) {
        try {
            if (!rosterValidator.isOwnedBy(userId, rosterId)) {
                throw new GameRuleException(ErrorCode.FORBIDDEN, GameMessages.ROSTER_NOT_OWNED);
            }
            RosterValidator.RosterCheck check = rosterValidator.checkComplete(rosterId);
            if (!check.complete()) {
                String missing = check.missing() == null ? "" : String.join(",", check.missing());
                throw new GameRuleException(ErrorCode.VALIDATION_ERROR,
                        GameMessages.ROSTER_INCOMPLETE + (missing.isEmpty() ? "" : "：" + missing));
            }
            return rosterValidator.loadLineup(rosterId);
        } catch (GameRuleException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("阵容校验失败: userId={}, rosterId={}", userId, rosterId, e);
            throw new GameRuleException(ErrorCode.INTERNAL_ERROR, GameMessages.ROSTER_SERVICE_UNAVAILABLE, e);
        }
    }

    /**
     * 生成在“等待中”范围内唯一的邀请码，冲突时重试
     */
    private String claimUniqueJoinCode(String sessionId) {
        for (int attempt = 0; attempt < JOIN_CODE_MAX_ATTEMPTS; attempt++) {
            String code = randomJoinCode();
            if (!registry.claimJoinCode(code, sessionId)) {
                continue;
            }
            boolean takenInStore = fromStore(() -> repository.findByJoinCode(code))
                    .filter(other -> !other.getId().equals(sessionId))
                    .isPresent();
            if (!takenInStore) {
                return code;
            }
            registry.releaseJoinCode(code, sessionId);
        }
        throw new GameRuleException(ErrorCode.INTERNAL_ERROR, GameMessages.JOIN_CODE_EXHAUSTED);
    }

    String randomJoinCode() {
        StringBuilder sb = new StringBuilder(JOIN_CODE_LENGTH);
        for (int i = 0; i < JOIN_CODE_LENGTH; i++) {
            sb.append(JOIN_CODE_ALPHABET.charAt(codeRandom.nextInt(JOIN_CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private <T> T fromStore(Supplier<T> read) {
        try {
            return read.get();
        } catch (GameRuleException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("读取对局存储失败", e);
            throw new GameRuleException(ErrorCode.INTERNAL_ERROR, GameMessages.STORE_UNAVAILABLE, e);
        }
    }

    private static void requireText(String value, String name) {
        if (StringUtils.isBlank(value)) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, name + " 不能为空");
        }
    }

    private record EndOutcome(GameEnded ended, GameSession snapshot) {
    }
}
