package com.dicehub.baseball.games.baseball.infrastructure.memory;

import com.dicehub.baseball.games.baseball.domain.enums.Seat;
import com.dicehub.baseball.games.baseball.domain.enums.SessionStatus;
import com.dicehub.baseball.games.baseball.domain.model.GameSession;
import com.dicehub.baseball.games.baseball.domain.model.GameState;
import com.dicehub.baseball.games.baseball.domain.model.PlayerSlot;
import com.dicehub.baseball.games.baseball.domain.repository.SessionPatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryGameSessionRepositoryTest {

    private InMemoryGameSessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGameSessionRepository();
    }

    private static GameSession session(String id, String home, String visitor, SessionStatus status, long createdAt) {
        GameSession s = new GameSession();
        s.setId(id);
        s.setJoinCode("CODE" + id.toUpperCase());
        s.setStatus(status);
        s.setHome(new PlayerSlot(home, "r-" + home, "Home", true, true, createdAt));
        if (visitor != null) {
            s.setVisitor(new PlayerSlot(visitor, "r-" + visitor, "Visitor", true, true, createdAt));
        }
        s.setState(GameState.initial());
        s.setCreatedAt(createdAt);
        s.setVersion(1);
        return s;
    }

    // ── save / versions ─────────────────────────────────────────────────────

    @Test
    void staleSnapshotIsIgnored() {
        GameSession s = session("s1", "u1", null, SessionStatus.WAITING, 1);
        s.setVersion(5);
        assertThat(repository.save(s)).isTrue();

        GameSession older = s.copy();
        older.setVersion(4);
        older.setStatus(SessionStatus.ABANDONED);

        assertThat(repository.save(older)).isFalse();
        assertThat(repository.findById("s1")).get()
                .extracting(GameSession::getStatus).isEqualTo(SessionStatus.WAITING);
    }

    @Test
    void storedCopyIsIsolatedFromCaller() {
        GameSession s = session("s1", "u1", null, SessionStatus.WAITING, 1);
        repository.save(s);
        s.getHome().setConnected(false);

        assertThat(repository.findById("s1").get().getHome().isConnected()).isTrue();
    }

    // ── lookups ─────────────────────────────────────────────────────────────

    @Test
    void joinCodeOnlyMatchesWaitingSessions() {
        repository.save(session("a", "u1", null, SessionStatus.WAITING, 1));
        repository.save(session("b", "u2", "u3", SessionStatus.ACTIVE, 2));

        assertThat(repository.findByJoinCode("codea")).isPresent();
        assertThat(repository.findByJoinCode("CODEB")).isEmpty();
    }

    @Test
    void findByUserFiltersAndSortsNewestFirst() {
        repository.save(session("old", "u1", "u2", SessionStatus.COMPLETED, 10));
        repository.save(session("new", "u3", "u1", SessionStatus.FORFEIT, 20));
        repository.save(session("live", "u1", null, SessionStatus.WAITING, 30));
        repository.save(session("other", "u4", "u5", SessionStatus.COMPLETED, 40));

        assertThat(repository.findByUser("u1", Set.of(SessionStatus.COMPLETED, SessionStatus.FORFEIT)))
                .extracting(GameSession::getId)
                .containsExactly("new", "old");
    }

    @Test
    void findByStatusReturnsLiveSessions() {
        repository.save(session("w", "u1", null, SessionStatus.WAITING, 1));
        repository.save(session("a", "u2", "u3", SessionStatus.ACTIVE, 2));
        repository.save(session("c", "u4", "u5", SessionStatus.COMPLETED, 3));

        assertThat(repository.findByStatus(SessionStatus.LIVE))
                .extracting(GameSession::getId)
                .containsExactlyInAnyOrder("w", "a");
    }

    // ── patch ───────────────────────────────────────────────────────────────

    @Test
    void connectionPatchUpdatesOnlyThatSeat() {
        GameSession s = session("s1", "u1", "u2", SessionStatus.ACTIVE, 1);
        repository.save(s);

        GameSession changed = s.copy();
        changed.getVisitor().setConnected(false);
        changed.getHome().setConnected(false);
        changed.setVersion(2);

        assertThat(repository.update("s1", SessionPatch.connection(changed, Seat.VISITOR))).isPresent();
        GameSession stored = repository.findById("s1").get();
        assertThat(stored.getVisitor().isConnected()).isFalse();
        assertThat(stored.getHome().isConnected()).isTrue();
        assertThat(stored.getVersion()).isEqualTo(2);
    }

    @Test
    void stalePatchIsIgnored() {
        GameSession s = session("s1", "u1", "u2", SessionStatus.ACTIVE, 1);
        s.setVersion(3);
        repository.save(s);

        GameSession changed = s.copy();
        changed.getHome().setConnected(false);
        changed.setVersion(2);

        assertThat(repository.update("s1", SessionPatch.connection(changed, Seat.HOME))).isEmpty();
        assertThat(repository.update("missing", SessionPatch.connection(changed, Seat.HOME))).isEmpty();
    }

    @Test
    void patchSkippingAVersionIsRejected() {
        GameSession s = session("s1", "u1", "u2", SessionStatus.ACTIVE, 1);
        s.setVersion(4);
        repository.save(s);

        GameSession changed = s.copy();
        changed.getHome().setConnected(false);
        changed.setVersion(6);

        assertThat(repository.update("s1", SessionPatch.connection(changed, Seat.HOME))).isEmpty();
        GameSession stored = repository.findById("s1").get();
        assertThat(stored.getVersion()).isEqualTo(4);
        assertThat(stored.getHome().isConnected()).isTrue();
    }
}
