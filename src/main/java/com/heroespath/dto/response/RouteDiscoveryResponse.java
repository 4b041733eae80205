package com.heroespath.dto.response;

import com.heroespath.model.StandardPlace;
import com.heroespath.service.discovery.DiscoveryResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 경로 탐색 결과 (미검토 장소 + 경고)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteDiscoveryResponse {
    private String routeId;
    private List<StandardPlace> places;
    private boolean firstDiscovery;
    private boolean placesUnavailable;
    private int pingPlaceCount;
    private List<String> rejectedPlaceIds;
    private List<String> warnings;

    public static RouteDiscoveryResponse from(DiscoveryResult result) {
        return new RouteDiscoveryResponse(
                result.getRouteId(),
                result.getPlaces(),
                result.isResolverCalled(),
                result.isPlacesUnavailable(),
                result.getPingPlaceCount(),
                result.getRejectedPlaceIds(),
                result.getWarnings().stream()
                        .map(w -> "DegradedPersistence: " + w.getOperation() + " (" + w.getReason() + ")")
                        .collect(Collectors.toList()));
    }
}
