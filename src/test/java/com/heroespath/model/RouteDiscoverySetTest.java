package com.heroespath.model;

import com.heroespath.support.Places;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RouteDiscoverySetTest {

    private Discovery discovery(String placeId, List<DiscoverySource> sources) {
        return Discovery.builder()
                .discoveryId(Discovery.idFor("u1", "R1", placeId))
                .userId("u1")
                .routeId("R1")
                .placeId(placeId)
                .snapshot(Places.place(placeId, "cafe"))
                .status(DiscoveryStatus.UNREVIEWED)
                .discoveredAt(Instant.parse("2026-03-01T09:00:00Z"))
                .sources(new ArrayList<>(sources))
                .build();
    }

    @Test
    void consolidationStatsCountsBySource() {
        RouteDiscoverySet set = new RouteDiscoverySet("R1", List.of(
                discovery("A", List.of(DiscoverySource.ROUTE)),
                discovery("B", List.of(DiscoverySource.PING)),
                discovery("C", List.of(DiscoverySource.ROUTE, DiscoverySource.PING)),
                discovery("D", List.of())));

        ConsolidationStats stats = set.consolidationStats();

        assertThat(stats.getRouteId()).isEqualTo("R1");
        assertThat(stats.getTotalDiscoveries()).isEqualTo(4);
        // 출처가 없는 기록(D)은 경로 검색으로 센다
        assertThat(stats.getRouteDiscoveries()).isEqualTo(2);
        assertThat(stats.getPingDiscoveries()).isEqualTo(1);
        assertThat(stats.getMixedSourceDiscoveries()).isEqualTo(1);
    }
}
