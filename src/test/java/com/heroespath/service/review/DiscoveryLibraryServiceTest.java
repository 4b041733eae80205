package com.heroespath.service.review;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStats;
import com.heroespath.model.DismissDuration;
import com.heroespath.model.RouteReviewProgress;
import com.heroespath.service.cache.InMemoryDiscoveryCache;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.support.FakeRemoteDiscoveryStore;
import com.heroespath.support.MutableClock;
import com.heroespath.support.Places;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryLibraryServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private DiscoveryLibraryService libraryService;
    private ReviewStateMachine stateMachine;
    private final DiscoveryContext ctx = DiscoveryContext.forUser("u1");

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        DiscoveryStoreAdapter storeAdapter =
                new DiscoveryStoreAdapter(new FakeRemoteDiscoveryStore(), new InMemoryDiscoveryCache(), clock);
        libraryService = new DiscoveryLibraryService(storeAdapter, clock);
        stateMachine = new ReviewStateMachine(storeAdapter, clock, 30);

        for (String placeId : new String[]{"P1", "P2", "P3", "P4"}) {
            storeAdapter.createDiscovery(Discovery.builder()
                    .userId("u1").routeId("R1").placeId(placeId).snapshot(Places.place(placeId, "cafe")).build());
        }
    }

    @Test
    void statsAndProgressFollowReviews() {
        stateMachine.save(ctx, "R1", "P1");
        stateMachine.dismiss(ctx, "R1", "P2", DismissDuration.TEMPORARY);
        stateMachine.dismiss(ctx, "R1", "P3", DismissDuration.FOREVER);

        DiscoveryStats stats = libraryService.stats("u1");
        RouteReviewProgress progress = libraryService.progress("u1", "R1");

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getSaved()).isEqualTo(1);
        assertThat(stats.getDismissed()).isEqualTo(2);
        assertThat(stats.getPending()).isEqualTo(1);
        assertThat(progress.getTotalCount()).isEqualTo(4);
        assertThat(progress.getReviewedCount()).isEqualTo(3);
    }

    @Test
    void summaryRequestThenAttach() {
        String discoveryId = Discovery.idFor("u1", "R1", "P1");

        Discovery requested = libraryService.requestSummary("u1", discoveryId);
        Discovery attached = libraryService.attachSummary("u1", discoveryId, "{\"summary\":\"Quiet corner cafe\"}");

        assertThat(requested.getSummaryRequestedAt()).isEqualTo(T0);
        assertThat(attached.getSummaryRequestedAt()).isEqualTo(T0);
        assertThat(attached.getSummaryData()).contains("Quiet corner cafe");
    }

    @Test
    void attachRejectsBlankDataAndUnknownIds() {
        assertThatThrownBy(() -> libraryService.attachSummary("u1", Discovery.idFor("u1", "R1", "P1"), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> libraryService.attachSummary("u1", "missing", "{}"))
                .isInstanceOf(DiscoveryNotFoundException.class);
    }
}
