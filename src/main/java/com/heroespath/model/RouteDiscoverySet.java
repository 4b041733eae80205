package com.heroespath.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 한 경로에 속한 discovery 목록
 * 같은 placeId가 여러 번 저장된 경우(동시 최초 탐색 경쟁) 읽기 시점에 하나로 합친다
 */
public class RouteDiscoverySet {

    private final String routeId;
    private final List<Discovery> discoveries;

    public RouteDiscoverySet(String routeId, List<Discovery> records) {
        this.routeId = routeId;
        this.discoveries = Collections.unmodifiableList(dedupe(records));
    }

    public static RouteDiscoverySet empty(String routeId) {
        return new RouteDiscoverySet(routeId, List.of());
    }

    private static List<Discovery> dedupe(List<Discovery> records) {
        List<Discovery> ordered = new ArrayList<>(records == null ? List.of() : records);
        ordered.sort(Comparator.comparing(Discovery::getDiscoveredAt,
                Comparator.nullsLast(Comparator.naturalOrder())));

        Map<String, Discovery> byPlace = new LinkedHashMap<>();
        for (Discovery d : ordered) {
            Discovery existing = byPlace.get(d.getPlaceId());
            // 이미 결정된 기록을 우선, 그 다음은 먼저 발견된 기록
            if (existing == null
                    || (!existing.getStatus().isReviewed() && d.getStatus().isReviewed())) {
                byPlace.put(d.getPlaceId(), d);
            }
        }
        return new ArrayList<>(byPlace.values());
    }

    public String getRouteId() {
        return routeId;
    }

    public List<Discovery> getDiscoveries() {
        return discoveries;
    }

    public boolean isEmpty() {
        return discoveries.isEmpty();
    }

    public int size() {
        return discoveries.size();
    }

    public Optional<Discovery> findByPlaceId(String placeId) {
        return discoveries.stream().filter(d -> d.getPlaceId().equals(placeId)).findFirst();
    }

    public List<Discovery> withStatus(DiscoveryStatus status) {
        return discoveries.stream().filter(d -> d.getStatus() == status).collect(Collectors.toList());
    }

    public List<StandardPlace> unreviewedPlaces() {
        return withStatus(DiscoveryStatus.UNREVIEWED).stream()
                .map(Discovery::getSnapshot)
                .collect(Collectors.toList());
    }

    /**
     * 출처가 기록되지 않은 discovery는 경로 검색에서 온 것으로 본다
     */
    public ConsolidationStats consolidationStats() {
        int routeOnly = 0;
        int pingOnly = 0;
        int mixed = 0;
        for (Discovery d : discoveries) {
            boolean fromPing = d.getSources() != null && d.getSources().contains(DiscoverySource.PING);
            boolean fromRoute = d.getSources() == null || d.getSources().isEmpty()
                    || d.getSources().contains(DiscoverySource.ROUTE);
            if (fromPing && fromRoute) {
                mixed++;
            } else if (fromPing) {
                pingOnly++;
            } else {
                routeOnly++;
            }
        }
        return new ConsolidationStats(routeId, discoveries.size(), routeOnly, pingOnly, mixed);
    }

    public RouteReviewProgress progress() {
        int total = discoveries.size();
        int reviewed = (int) discoveries.stream().filter(d -> d.getStatus().isReviewed()).count();
        return RouteReviewProgress.of(routeId, total, reviewed);
    }
}
