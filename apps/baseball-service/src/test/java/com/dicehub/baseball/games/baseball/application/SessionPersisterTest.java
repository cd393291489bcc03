package com.dicehub.baseball.games.baseball.application;

import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.infrastructure.memory.InMemoryGameSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionPersisterTest {

    private InMemoryGameSessionRepository repository;
    private SessionPersister persister;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGameSessionRepository();
        persister = new SessionPersister(repository, Runnable::run);
    }

    private static GameSession stored(long version) {
        long now = System.currentTimeMillis();
        GameSession s = new GameSession();
        s.setId("s1");
        s.setStatus(SessionStatus.ACTIVE);
        s.setHome(new PlayerSlot("u1", "r1", "Home", true, true, now));
        s.setVisitor(new PlayerSlot("u2", "r2", "Visitor", true, true, now));
        s.setState(GameState.initial());
        s.setCreatedAt(now);
        s.setRngState(100L);
        s.setVersion(version);
        return s;
    }

    // ── 在线状态写回 ────────────────────────────────────────────────────────

    @Test
    void connectionChangeRightAfterStoredVersionIsPatched() {
        GameSession base = stored(4);
        repository.save(base);

        GameSession next = base.copy();
        next.getHome().setConnected(false);
        next.setVersion(5);
        persister.patchAsync(next, Seat.HOME);

        GameSession saved = repository.findById("s1").orElseThrow();
        assertThat(saved.getVersion()).isEqualTo(5);
        assertThat(saved.getHome().isConnected()).isFalse();
        assertThat(saved.getVisitor().isConnected()).isTrue();
    }

    @Test
    void connectionChangeOvertakingMoveWriteKeepsTheMove() {
        GameSession base = stored(4);
        repository.save(base);

        // v5：一次走子改变了随机源状态；v6：随后的断线
        GameSession afterMove = base.copy();
        afterMove.setRngState(200L);
        afterMove.setVersion(5);
        GameSession afterDisconnect = afterMove.copy();
        afterDisconnect.getHome().setConnected(false);
        afterDisconnect.setVersion(6);

        // 两次写入在队列里顺序颠倒
        persister.patchAsync(afterDisconnect, Seat.HOME);
        persister.persistAsync(afterMove);

        GameSession saved = repository.findById("s1").orElseThrow();
        assertThat(saved.getVersion()).isEqualTo(6);
        assertThat(saved.getRngState()).isEqualTo(200L);
        assertThat(saved.getHome().isConnected()).isFalse();
    }
}
