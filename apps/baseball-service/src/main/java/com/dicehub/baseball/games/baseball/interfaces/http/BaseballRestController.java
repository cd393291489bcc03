package com.dicehub.baseball.games.baseball.interfaces.http;

import com.dicehub.baseball.games.baseball.application.GameEventPublisher;
import com.dicehub.baseball.games.baseball.domain.dto.SessionView;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameEnded;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.MoveResult;
import com.dicehub.baseball.games.baseball.interfaces.http.dto.SessionRequests.CreateSessionRequest;
import com.dicehub.baseball.games.baseball.interfaces.http.dto.SessionRequests.JoinByCodeRequest;
import com.dicehub.baseball.games.baseball.interfaces.http.dto.SessionRequests.JoinRequest;
import com.dicehub.baseball.games.baseball.interfaces.http.dto.SessionRequests.MoveRequest;
import com.dicehub.baseball.games.baseball.interfaces.ws.dto.BaseballMessages.RollResultPayload;
import com.dicehub.baseball.games.baseball.service.SessionCoordinator;
import com.dicehub.web.common.ApiResponse;
import com.dicehub.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 掷骰棒球 HTTP 接口（WebSocket 之外的同步通道）。
 * 与 WS 共用同一个协调服务，相同输入得到相同结果；走子与结束事件同样广播到房间。
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/baseball/sessions")
public class BaseballRestController {

    private final SessionCoordinator coordinator;
    private final GameEventPublisher events;

    /**
     * 创建对局，创建者为主队，返回含邀请码的视图
     */
    @PostMapping
    public ResponseEntity<ApiResponse<SessionView>> create(@RequestBody CreateSessionRequest req,
                                                           @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        GameSession session = coordinator.create(userId, req.rosterId(), req.simulationSettings());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(SessionView.of(session)));
    }

    @PostMapping("/join")
    public ResponseEntity<ApiResponse<SessionView>> joinByCode(@RequestBody JoinByCodeRequest req,
                                                               @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        GameSession session = coordinator.joinByCode(req.joinCode(), userId, req.rosterId());
        events.stateToRoom(session.getId(), session);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(session)));
    }

    @PostMapping("/{sessionId}/join")
    public ResponseEntity<ApiResponse<SessionView>> join(@PathVariable String sessionId,
                                                         @RequestBody JoinRequest req,
                                                         @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        GameSession session = coordinator.join(sessionId, userId, req.rosterId());
        events.stateToRoom(sessionId, session);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(session)));
    }

    /**
     * 我的对局列表；status 为逗号分隔的状态名，缺省为 waiting,active
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<SessionView>>> list(@RequestParam(name = "status", required = false) String status,
                                                               @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        List<SessionView> views = coordinator.listSessions(userId, parseStatuses(status)).stream()
                .map(SessionView::of)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(views));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<SessionView>> get(@PathVariable String sessionId,
                                                        @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(coordinator.getSession(sessionId, userId))));
    }

    /**
     * 提交一次掷骰结果
     */
    @PostMapping("/{sessionId}/moves")
    public ResponseEntity<ApiResponse<RollResultPayload>> move(@PathVariable String sessionId,
                                                               @RequestBody MoveRequest req,
                                                               @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        MoveResult result = coordinator.applyMove(sessionId, userId, req.diceRoll());
        events.rollResult(sessionId, result.move());
        if (result.gameEnded()) {
            events.ended(sessionId, result.ended());
        }
        return ResponseEntity.ok(ApiResponse.success(RollResultPayload.of(result.move())));
    }

    @PostMapping("/{sessionId}/forfeit")
    public ResponseEntity<ApiResponse<GameEnded>> forfeit(@PathVariable String sessionId,
                                                          @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        GameEnded ended = coordinator.forfeit(sessionId, userId);
        events.ended(sessionId, ended);
        return ResponseEntity.ok(ApiResponse.success(ended));
    }

    /**
     * 创建者取消等待中的对局
     */
    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<ApiResponse<SessionView>> cancel(@PathVariable String sessionId,
                                                           @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.requireUserId(jwt);
        GameSession session = coordinator.cancel(sessionId, userId);
        events.stateToRoom(sessionId, session);
        return ResponseEntity.ok(ApiResponse.success(SessionView.of(session)));
    }

    private static Set<SessionStatus> parseStatuses(String raw) {
        if (StringUtils.isBlank(raw)) {
            return SessionStatus.LIVE;
        }
        Set<SessionStatus> result = EnumSet.noneOf(SessionStatus.class);
        for (String token : raw.split(",")) {
            String name = token.trim();
            if (name.isEmpty()) {
                continue;
            }
            SessionStatus status = Arrays.stream(SessionStatus.values())
                    .filter(s -> s.wireName().equalsIgnoreCase(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("未知的对局状态: " + name));
            result.add(status);
        }
        return result.isEmpty() ? SessionStatus.LIVE : result;
    }
}
