package com.dicehub.baseball.games.baseball.application.roster;

import com.dicehub.baseball.common.ErrorCode;
import com.dicehub.baseball.common.GameRuleException;
import com.dicehub.baseball.games.baseball.domain.constants.GameMessages;
import com.dicehub.baseball.games.baseball.domain.model.BattingProfile;
import com.dicehub.baseball.games.baseball.domain.model.LineupSlot;
import com.dicehub.baseball.games.baseball.domain.model.PitchingProfile;
import com.dicehub.baseball.games.baseball.domain.model.PlayerRef;
import com.dicehub.baseball.games.baseball.domain.model.TeamLineup;
import com.dicehub.baseball.games.baseball.domain.repository.RosterValidator;
import com.dicehub.baseball.games.baseball.infrastructure.client.RosterView;
import com.dicehub.baseball.games.baseball.infrastructure.client.TeamRosterClient;
import com.dicehub.web.common.ApiResponse;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 阵容目录服务（对局域调用阵容域的统一入口）。
 * 通过 Feign 调用 roster-service，在此处统一做熔断；服务不可用一律视为 internal_error，不放行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RosterDirectoryService implements RosterValidator {

    /** 9 个打击守位 + 先发投手 */
    static final List<String> REQUIRED_POSITIONS =
            List.of("C", "1B", "2B", "3B", "SS", "LF", "CF", "RF", "DH", "SP");
    static final String STARTING_PITCHER = "SP";

    private final TeamRosterClient rosterClient;

    @Override
    @CircuitBreaker(name = "rosterService", fallbackMethod = "fallbackOwned")
    public boolean isOwnedBy(String userId, String rosterId) {
        RosterView roster = fetch(rosterId);
        return userId != null && userId.equals(roster.ownerId());
    }

    @Override
    @CircuitBreaker(name = "rosterService", fallbackMethod = "fallbackCheck")
    public RosterCheck checkComplete(String rosterId) {
        return check(fetch(rosterId));
    }

    @Override
    @CircuitBreaker(name = "rosterService", fallbackMethod = "fallbackLineup")
    public TeamLineup loadLineup(String rosterId) {
        RosterView roster = fetch(rosterId);
        RosterCheck check = check(roster);
        if (!check.complete()) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR,
                    GameMessages.ROSTER_INCOMPLETE + "：" + String.join(",", check.missing()));
        }
        return toLineup(roster);
    }

    private RosterView fetch(String rosterId) {
        ApiResponse<RosterView> resp;
        try {
            resp = rosterClient.getRoster(rosterId);
        } catch (FeignException.NotFound e) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.ROSTER_NOT_FOUND);
        }
        if (resp == null || resp.code() == 404) {
            throw new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.ROSTER_NOT_FOUND);
        }
        if (!resp.isSuccess() || resp.data() == null) {
            log.warn("获取阵容失败: rosterId={}, response={}", rosterId, resp);
            throw new IllegalStateException("roster-service returned " + resp.code());
        }
        return resp.data();
    }

    /**
     * 完整性检查：有名称、每个必需守位都有球员、打击守位的棒次恰好覆盖 1..9
     */
    static RosterCheck check(RosterView roster) {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(roster.name())) {
            missing.add("name");
        }
        List<RosterView.Slot> slots = roster.slots() == null ? List.of() : roster.slots();
        Set<String> filled = slots.stream()
                .filter(s -> s.position() != null && StringUtils.isNotBlank(s.playerId()))
                .map(s -> s.position().toUpperCase())
                .collect(Collectors.toSet());
        for (String position : REQUIRED_POSITIONS) {
            if (!filled.contains(position)) {
                missing.add(position);
            }
        }
        Set<Integer> orders = new TreeSet<>();
        for (RosterView.Slot slot : slots) {
            if (slot.battingOrder() != null && !STARTING_PITCHER.equalsIgnoreCase(slot.position())) {
                orders.add(slot.battingOrder());
            }
        }
        for (int i = 1; i <= TeamLineup.LINEUP_SIZE; i++) {
            if (!orders.contains(i)) {
                missing.add("#" + i);
            }
        }
        return new RosterCheck(missing.isEmpty(), roster.name(), missing);
    }

    static TeamLineup toLineup(RosterView roster) {
        Map<Integer, RosterView.Slot> byOrder = roster.slots().stream()
                .filter(s -> s.battingOrder() != null && !STARTING_PITCHER.equalsIgnoreCase(s.position()))
                .collect(Collectors.toMap(RosterView.Slot::battingOrder, Function.identity(), (a, b) -> a));
        List<LineupSlot> order = new ArrayList<>();
        for (int i = 1; i <= TeamLineup.LINEUP_SIZE; i++) {
            RosterView.Slot s = Objects.requireNonNull(byOrder.get(i), "batting order " + i);
            RosterView.BattingStats b = s.batting();
            BattingProfile profile = b == null
                    ? BattingProfile.leagueAverage()
                    : BattingProfile.fromCounts(b.ops(), b.slg(), b.walks(), b.strikeouts(), b.atBats());
            order.add(new LineupSlot(i, new PlayerRef(s.playerId(), s.playerName()), profile));
        }
        RosterView.Slot sp = roster.slots().stream()
                .filter(s -> STARTING_PITCHER.equalsIgnoreCase(s.position()))
                .findFirst()
                .orElseThrow(() -> new GameRuleException(ErrorCode.VALIDATION_ERROR, GameMessages.ROSTER_INCOMPLETE));
        RosterView.PitchingStats p = sp.pitching();
        PitchingProfile pitching = p == null
                ? PitchingProfile.leagueAverage()
                : PitchingProfile.of(p.whip(), p.kPer9(), p.bbPer9(), p.hrPer9());
        return new TeamLineup(roster.id(), roster.name(), order, new PlayerRef(sp.playerId(), sp.playerName()), pitching);
    }

    // ---- 熔断 / 超时 / 远程异常时的兜底：业务校验异常原样抛出，其余视为基础设施故障 ----

    @SuppressWarnings("unused")
    private boolean fallbackOwned(String userId, String rosterId, Throwable ex) {
        throw unavailable(rosterId, ex);
    }

    @SuppressWarnings("unused")
    private RosterCheck fallbackCheck(String rosterId, Throwable ex) {
        throw unavailable(rosterId, ex);
    }

    @SuppressWarnings("unused")
    private TeamLineup fallbackLineup(String rosterId, Throwable ex) {
        throw unavailable(rosterId, ex);
    }

    private static GameRuleException unavailable(String rosterId, Throwable ex) {
        if (ex instanceof GameRuleException rule) {
            return rule;
        }
        log.warn("调用 roster-service 失败: rosterId={}, ex={}", rosterId, ex.toString());
        return new GameRuleException(ErrorCode.INTERNAL_ERROR, GameMessages.ROSTER_SERVICE_UNAVAILABLE, ex);
    }
}
