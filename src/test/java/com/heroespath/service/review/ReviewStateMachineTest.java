package com.heroespath.service.review;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.IllegalReviewTransitionException;
import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.DismissDuration;
import com.heroespath.model.DismissalPolicy;
import com.heroespath.service.cache.InMemoryDiscoveryCache;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.support.FakeRemoteDiscoveryStore;
import com.heroespath.support.MutableClock;
import com.heroespath.support.Places;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReviewStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private FakeRemoteDiscoveryStore remote;
    private MutableClock clock;
    private DiscoveryStoreAdapter storeAdapter;
    private ReviewStateMachine stateMachine;

    private final DiscoveryContext ask = DiscoveryContext.forUser("u1");
    private final DiscoveryContext thirtyDays = DiscoveryContext.builder()
            .userId("u1").dismissalPolicy(DismissalPolicy.ALWAYS_THIRTY_DAYS).build();

    @BeforeEach
    void setUp() {
        remote = new FakeRemoteDiscoveryStore();
        clock = new MutableClock(T0);
        storeAdapter = new DiscoveryStoreAdapter(remote, new InMemoryDiscoveryCache(), clock);
        stateMachine = new ReviewStateMachine(storeAdapter, clock, 30);

        storeAdapter.createDiscovery(Discovery.builder()
                .userId("u1").routeId("R1").placeId("P1").snapshot(Places.place("P1", "cafe")).build());
    }

    private DiscoveryStatus statusOf(String placeId) {
        return storeAdapter.findDiscovery("u1", Discovery.idFor("u1", "R1", placeId)).getValue().get().getStatus();
    }

    @Test
    void saveUndoSaveKeepsOneRecord() {
        stateMachine.save(ask, "R1", "P1");
        stateMachine.undoSave(ask, "R1", "P1");
        ReviewOutcome outcome = stateMachine.save(ask, "R1", "P1");

        assertThat(outcome.getType()).isEqualTo(ReviewOutcome.Type.APPLIED);
        assertThat(outcome.getDiscovery().getDecidedAt()).isEqualTo(T0);
        assertThat(remote.size()).isEqualTo(1);
        assertThat(statusOf("P1")).isEqualTo(DiscoveryStatus.SAVED);
    }

    @Test
    void repeatedSaveIsNoOp() {
        stateMachine.save(ask, "R1", "P1");
        int writes = remote.getWriteCount();

        ReviewOutcome again = stateMachine.save(ask, "R1", "P1");

        assertThat(again.getType()).isEqualTo(ReviewOutcome.Type.NO_OP);
        assertThat(remote.getWriteCount()).isEqualTo(writes);
    }

    @Test
    void temporaryDismissalExpiresAfterThirtyDays() {
        ReviewOutcome outcome = stateMachine.dismiss(ask, "R1", "P1", DismissDuration.TEMPORARY);
        assertThat(outcome.getDiscovery().getDismissExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(30)));

        clock.advance(Duration.ofDays(29));
        assertThat(statusOf("P1")).isEqualTo(DiscoveryStatus.DISMISSED_TEMPORARY);

        clock.advance(Duration.ofDays(2));
        assertThat(statusOf("P1")).isEqualTo(DiscoveryStatus.UNREVIEWED);
        // 만료 후에는 다시 검토할 수 있다
        assertThat(stateMachine.save(ask, "R1", "P1").getType()).isEqualTo(ReviewOutcome.Type.APPLIED);
    }

    @Test
    void foreverDismissalDoesNotExpire() {
        stateMachine.dismiss(ask, "R1", "P1", DismissDuration.FOREVER);

        clock.advance(Duration.ofDays(3650));

        assertThat(statusOf("P1")).isEqualTo(DiscoveryStatus.DISMISSED_FOREVER);
    }

    @Test
    void askPolicyRequiresDuration() {
        ReviewOutcome outcome = stateMachine.dismiss(ask, "R1", "P1", null);

        assertThat(outcome.getType()).isEqualTo(ReviewOutcome.Type.DURATION_REQUIRED);
        assertThat(statusOf("P1")).isEqualTo(DiscoveryStatus.UNREVIEWED);
    }

    @Test
    void policyDefaultAppliesWhenDurationOmitted() {
        ReviewOutcome outcome = stateMachine.dismiss(thirtyDays, "R1", "P1", null);

        assertThat(outcome.getType()).isEqualTo(ReviewOutcome.Type.APPLIED);
        assertThat(outcome.getDiscovery().getStatus()).isEqualTo(DiscoveryStatus.DISMISSED_TEMPORARY);
    }

    @Test
    void explicitDurationOverridesPolicy() {
        ReviewOutcome outcome = stateMachine.dismiss(thirtyDays, "R1", "P1", DismissDuration.FOREVER);

        assertThat(outcome.getDiscovery().getStatus()).isEqualTo(DiscoveryStatus.DISMISSED_FOREVER);
        assertThat(outcome.getDiscovery().getDismissExpiresAt()).isNull();
    }

    @Test
    void savedPlaceCannotBeDismissedWithoutUndo() {
        stateMachine.save(ask, "R1", "P1");

        assertThatThrownBy(() -> stateMachine.dismiss(ask, "R1", "P1", DismissDuration.FOREVER))
                .isInstanceOf(IllegalReviewTransitionException.class);
        assertThatThrownBy(() -> stateMachine.undoDismiss(ask, "R1", "P1"))
                .isInstanceOf(IllegalReviewTransitionException.class);
    }

    @Test
    void dismissedPlaceCannotBeUndoneAsSave() {
        stateMachine.dismiss(ask, "R1", "P1", DismissDuration.TEMPORARY);

        assertThatThrownBy(() -> stateMachine.undoSave(ask, "R1", "P1"))
                .isInstanceOf(IllegalReviewTransitionException.class);

        ReviewOutcome undone = stateMachine.undoDismiss(ask, "R1", "P1");
        assertThat(undone.getDiscovery().getStatus()).isEqualTo(DiscoveryStatus.UNREVIEWED);
        assertThat(undone.getDiscovery().getDismissExpiresAt()).isNull();
    }

    @Test
    void transitionTable() {
        assertThat(ReviewStateMachine.isAllowed(DiscoveryStatus.UNREVIEWED, DiscoveryStatus.SAVED)).isTrue();
        assertThat(ReviewStateMachine.isAllowed(DiscoveryStatus.SAVED, DiscoveryStatus.DISMISSED_FOREVER)).isFalse();
        assertThat(ReviewStateMachine.isAllowed(DiscoveryStatus.DISMISSED_TEMPORARY, DiscoveryStatus.DISMISSED_FOREVER))
                .isFalse();
        assertThat(ReviewStateMachine.isAllowed(DiscoveryStatus.DISMISSED_FOREVER, DiscoveryStatus.UNREVIEWED)).isTrue();
    }

    @Test
    void unknownPlaceIsNotFound() {
        assertThatThrownBy(() -> stateMachine.save(ask, "R1", "P404"))
                .isInstanceOf(DiscoveryNotFoundException.class);
    }

    @Test
    void savingPlaceOutsideDiscoveryCreatesRecord() {
        ReviewOutcome outcome = stateMachine.save(ask, "R2", Places.place("P7", "museum"));

        assertThat(outcome.getType()).isEqualTo(ReviewOutcome.Type.APPLIED);
        assertThat(remote.peek(Discovery.idFor("u1", "R2", "P7")).get().getStatus()).isEqualTo(DiscoveryStatus.SAVED);
        assertThatThrownBy(() -> stateMachine.save(ask, "R2", Places.withoutLocation("P8", "museum")))
                .isInstanceOf(InvalidPlaceLocationException.class);
    }

    @Test
    void reviewDuringOutageCarriesWarning() {
        remote.setAvailable(false);

        ReviewOutcome outcome = stateMachine.save(ask, "R1", "P1");

        assertThat(outcome.getType()).isEqualTo(ReviewOutcome.Type.APPLIED);
        assertThat(outcome.getWarningIfAny()).hasValueSatisfying(w -> assertThat(w.isQueued()).isTrue());
    }
}
