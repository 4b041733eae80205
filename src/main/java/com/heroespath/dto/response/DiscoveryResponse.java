package com.heroespath.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoverySource;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.StandardPlace;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscoveryResponse {
    private String discoveryId;
    private String routeId;
    private String placeId;
    private DiscoveryStatus status;
    private StandardPlace place;
    private Instant discoveredAt;
    private Instant decidedAt;
    private Instant dismissExpiresAt;
    private Instant summaryRequestedAt;
    private String summaryData;
    private List<DiscoverySource> sources;

    public static DiscoveryResponse from(Discovery discovery) {
        return DiscoveryResponse.builder()
                .discoveryId(discovery.getDiscoveryId())
                .routeId(discovery.getRouteId())
                .placeId(discovery.getPlaceId())
                .status(discovery.getStatus())
                .place(discovery.getSnapshot())
                .discoveredAt(discovery.getDiscoveredAt())
                .decidedAt(discovery.getDecidedAt())
                .dismissExpiresAt(discovery.getDismissExpiresAt())
                .summaryRequestedAt(discovery.getSummaryRequestedAt())
                .summaryData(discovery.getSummaryData())
                .sources(discovery.getSources())
                .build();
    }
}
