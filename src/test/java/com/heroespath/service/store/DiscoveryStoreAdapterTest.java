package com.heroespath.service.store;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.RouteDiscoverySet;
import com.heroespath.model.StandardPlace;
import com.heroespath.service.cache.InMemoryDiscoveryCache;
import com.heroespath.support.FakeRemoteDiscoveryStore;
import com.heroespath.support.MutableClock;
import com.heroespath.support.Places;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryStoreAdapterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private FakeRemoteDiscoveryStore remote;
    private InMemoryDiscoveryCache cache;
    private MutableClock clock;
    private DiscoveryStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        remote = new FakeRemoteDiscoveryStore();
        cache = new InMemoryDiscoveryCache();
        clock = new MutableClock(T0);
        adapter = new DiscoveryStoreAdapter(remote, cache, clock);
    }

    private Discovery record(String userId, String routeId, StandardPlace place) {
        return Discovery.builder()
                .userId(userId)
                .routeId(routeId)
                .placeId(place.getPlaceId())
                .snapshot(place)
                .build();
    }

    @Test
    void createAssignsIdAndDefaults() {
        StoreResult<Discovery> result = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe")));

        assertThat(result.isDegraded()).isFalse();
        Discovery stored = result.getValue();
        assertThat(stored.getDiscoveryId()).isEqualTo(Discovery.idFor("u1", "R1", "P1"));
        assertThat(stored.getStatus()).isEqualTo(DiscoveryStatus.UNREVIEWED);
        assertThat(stored.getDiscoveredAt()).isEqualTo(T0);
        assertThat(cache.findById(stored.getDiscoveryId())).isPresent();
    }

    @Test
    void createIsConditionalOnUserRoutePlace() {
        Discovery first = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        adapter.updateStatus("u1", first.getDiscoveryId(), DiscoveryStatus.SAVED, null);

        clock.advance(Duration.ofMinutes(5));
        Discovery second = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();

        assertThat(remote.size()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(DiscoveryStatus.SAVED);
        assertThat(second.getDiscoveredAt()).isEqualTo(T0);
    }

    @Test
    void rejectsSnapshotWithoutCoordinates() {
        assertThatThrownBy(() -> adapter.createDiscovery(record("u1", "R1", Places.withoutLocation("P9", "park"))))
                .isInstanceOf(InvalidPlaceLocationException.class)
                .satisfies(e -> assertThat(((InvalidPlaceLocationException) e).getPlaceId()).isEqualTo("P9"));
        assertThat(remote.size()).isZero();
        assertThat(cache.pendingIds()).isEmpty();
    }

    @Test
    void readFallsBackToLocalCacheWithWarning() {
        adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe")));
        adapter.createDiscovery(record("u1", "R1", Places.place("P2", "bar")));
        remote.setAvailable(false);

        StoreResult<RouteDiscoverySet> result = adapter.loadRouteDiscoveries("u1", "R1");

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getWarning()).hasValueSatisfying(w -> {
            assertThat(w.getOperation()).isEqualTo("loadRouteDiscoveries");
            assertThat(w.isQueued()).isFalse();
        });
        assertThat(result.getValue().getDiscoveries()).extracting(Discovery::getPlaceId)
                .containsExactlyInAnyOrder("P1", "P2");
    }

    @Test
    void writeDuringOutageIsQueuedAndFlushedLater() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        remote.setAvailable(false);

        StoreResult<Discovery> saved = adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.SAVED, null);

        assertThat(saved.isDegraded()).isTrue();
        assertThat(saved.getWarning().get().isQueued()).isTrue();
        assertThat(saved.getValue().getStatus()).isEqualTo(DiscoveryStatus.SAVED);
        assertThat(cache.pendingIds()).containsExactly(created.getDiscoveryId());
        // 장애 중에도 같은 인스턴스에서는 바뀐 상태가 보인다
        assertThat(adapter.loadRouteDiscoveries("u1", "R1").getValue().findByPlaceId("P1").get().getStatus())
                .isEqualTo(DiscoveryStatus.SAVED);

        assertThat(adapter.flushPending()).isZero();

        remote.setAvailable(true);
        assertThat(adapter.flushPending()).isEqualTo(1);
        assertThat(cache.pendingIds()).isEmpty();
        assertThat(remote.peek(created.getDiscoveryId()).get().getStatus()).isEqualTo(DiscoveryStatus.SAVED);
    }

    @Test
    void pendingWriteOverridesStaleRemoteRead() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        remote.setAvailable(false);
        adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.DISMISSED_FOREVER, null);
        remote.setAvailable(true);

        RouteDiscoverySet set = adapter.loadRouteDiscoveries("u1", "R1").getValue();

        assertThat(set.findByPlaceId("P1").get().getStatus()).isEqualTo(DiscoveryStatus.DISMISSED_FOREVER);
        assertThat(adapter.findDiscovery("u1", created.getDiscoveryId()).getValue().get().getStatus())
                .isEqualTo(DiscoveryStatus.DISMISSED_FOREVER);
    }

    @Test
    void createDuringOutageIsQueued() {
        remote.setAvailable(false);

        StoreResult<Discovery> result = adapter.createDiscovery(record("u1", "R2", Places.place("P5", "museum")));

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getWarning().get().isQueued()).isTrue();
        assertThat(adapter.loadRouteDiscoveries("u1", "R2").getValue().size()).isEqualTo(1);

        remote.setAvailable(true);
        adapter.flushPending();
        assertThat(remote.size()).isEqualTo(1);
    }

    @Test
    void expiredTemporaryDismissalReadsAsUnreviewed() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.DISMISSED_TEMPORARY,
                T0.plus(Duration.ofDays(30)));

        clock.advance(Duration.ofDays(29));
        assertThat(adapter.loadRouteDiscoveries("u1", "R1").getValue().withStatus(DiscoveryStatus.DISMISSED_TEMPORARY))
                .hasSize(1);

        clock.advance(Duration.ofDays(2));
        Discovery reread = adapter.loadRouteDiscoveries("u1", "R1").getValue().findByPlaceId("P1").get();
        assertThat(reread.getStatus()).isEqualTo(DiscoveryStatus.UNREVIEWED);
        assertThat(reread.getDismissExpiresAt()).isNull();
        assertThat(reread.getDecidedAt()).isNull();
        // 보정 결과가 원격에도 반영된다
        assertThat(remote.peek(created.getDiscoveryId()).get().getStatus()).isEqualTo(DiscoveryStatus.UNREVIEWED);
    }

    @Test
    void expiredDismissalIsCorrectedEvenFromLocalCache() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.DISMISSED_TEMPORARY,
                T0.plus(Duration.ofDays(30)));
        remote.setAvailable(false);
        clock.advance(Duration.ofDays(31));

        StoreResult<List<Discovery>> unreviewed = adapter.loadUserDiscoveries("u1", DiscoveryStatus.UNREVIEWED);

        assertThat(unreviewed.isDegraded()).isTrue();
        assertThat(unreviewed.getValue()).extracting(Discovery::getPlaceId).containsExactly("P1");
        // 쓰기 대기열에는 넣지 않는다
        assertThat(cache.pendingIds()).isEmpty();
    }

    @Test
    void userDiscoveriesSpanRoutes() {
        Discovery a = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        clock.advance(Duration.ofMinutes(1));
        Discovery b = adapter.createDiscovery(record("u1", "R2", Places.place("P2", "park"))).getValue();
        adapter.createDiscovery(record("u2", "R1", Places.place("P1", "cafe")));
        adapter.updateStatus("u1", a.getDiscoveryId(), DiscoveryStatus.SAVED, null);
        adapter.updateStatus("u1", b.getDiscoveryId(), DiscoveryStatus.SAVED, null);

        List<Discovery> saved = adapter.loadUserDiscoveries("u1", DiscoveryStatus.SAVED).getValue();

        assertThat(saved).extracting(Discovery::getRouteId).containsExactlyInAnyOrder("R1", "R2");
        assertThat(saved).allSatisfy(d -> assertThat(d.getDecidedAt()).isEqualTo(T0.plus(Duration.ofMinutes(1))));
    }

    @Test
    void revertingToUnreviewedClearsDecision() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.DISMISSED_TEMPORARY, T0.plusSeconds(60));

        Discovery reverted = adapter.updateStatus("u1", created.getDiscoveryId(), DiscoveryStatus.UNREVIEWED,
                T0.plusSeconds(60)).getValue();

        assertThat(reverted.getDecidedAt()).isNull();
        assertThat(reverted.getDismissExpiresAt()).isNull();
    }

    @Test
    void otherUsersCannotReadOrModify() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();

        assertThat(adapter.findDiscovery("u2", created.getDiscoveryId()).getValue()).isEqualTo(Optional.empty());
        assertThatThrownBy(() -> adapter.updateStatus("u2", created.getDiscoveryId(), DiscoveryStatus.SAVED, null))
                .isInstanceOf(DiscoveryNotFoundException.class);
    }

    @Test
    void summaryUpdateKeepsExistingValues() {
        Discovery created = adapter.createDiscovery(record("u1", "R1", Places.place("P1", "cafe"))).getValue();
        adapter.updateSummary("u1", created.getDiscoveryId(), T0, null);

        Discovery updated = adapter.updateSummary("u1", created.getDiscoveryId(), null, "{\"text\":\"ok\"}").getValue();

        assertThat(updated.getSummaryRequestedAt()).isEqualTo(T0);
        assertThat(updated.getSummaryData()).isEqualTo("{\"text\":\"ok\"}");
    }

    @Test
    void routeMarkerIsWrittenRemotelyAndMirrored() {
        StoreResult<DiscoveredRoute> marked = adapter.markRouteDiscovered("u1", "R1", 0);

        assertThat(marked.isDegraded()).isFalse();
        assertThat(marked.getValue().getDiscoveredAt()).isEqualTo(T0);
        assertThat(remote.hasRoute("u1", "R1")).isTrue();
        assertThat(cache.findRoute("u1", "R1")).isPresent();
        assertThat(adapter.isRouteDiscovered("u1", "R1").getValue()).isTrue();
        assertThat(adapter.isRouteDiscovered("u1", "R2").getValue()).isFalse();
    }

    @Test
    void routeMarkerIsQueuedDuringOutageAndFlushedLater() {
        remote.setAvailable(false);

        StoreResult<DiscoveredRoute> marked = adapter.markRouteDiscovered("u1", "R1", 0);
        StoreResult<Boolean> discovered = adapter.isRouteDiscovered("u1", "R1");

        assertThat(marked.getWarning()).hasValueSatisfying(w -> assertThat(w.isQueued()).isTrue());
        assertThat(discovered.isDegraded()).isTrue();
        assertThat(discovered.getValue()).isTrue();
        assertThat(cache.pendingRoutes()).hasSize(1);

        remote.setAvailable(true);
        int flushed = adapter.flushPending();

        assertThat(flushed).isEqualTo(1);
        assertThat(remote.hasRoute("u1", "R1")).isTrue();
        assertThat(cache.pendingRoutes()).isEmpty();
    }

    @Test
    void remoteMarkerIsFoundWithEmptyLocalCache() {
        adapter.markRouteDiscovered("u1", "R1", 3);
        DiscoveryStoreAdapter fresh = new DiscoveryStoreAdapter(remote, new InMemoryDiscoveryCache(), clock);

        assertThat(fresh.isRouteDiscovered("u1", "R1").getValue()).isTrue();
    }
}
