package com.heroespath.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroespath.entity.DiscoveredRouteEntity;
import com.heroespath.entity.DiscoveryEntity;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoverySource;
import com.heroespath.model.StandardPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Discovery <-> DiscoveryEntity 변환. 스냅샷은 place_data JSON 컬럼
 * 탐색 완료 경로 표시(DiscoveredRoute)도 같이 변환한다
 */
@Slf4j
@Component
public class DiscoveryEntityMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Discovery toModel(DiscoveryEntity entity) {
        return Discovery.builder()
                .discoveryId(entity.getDiscoveryId())
                .userId(entity.getUserId())
                .routeId(entity.getRouteId())
                .placeId(entity.getPlaceId())
                .snapshot(readSnapshot(entity))
                .status(entity.getStatus())
                .discoveredAt(entity.getDiscoveredAt())
                .decidedAt(entity.getDecidedAt())
                .dismissExpiresAt(entity.getDismissExpiresAt())
                .summaryRequestedAt(entity.getSummaryRequestedAt())
                .summaryData(entity.getSummaryData())
                .sources(readSources(entity.getSources()))
                .build();
    }

    public DiscoveryEntity toEntity(Discovery discovery) {
        DiscoveryEntity entity = new DiscoveryEntity();
        entity.setDiscoveryId(discovery.getDiscoveryId());
        entity.setUserId(discovery.getUserId());
        entity.setRouteId(discovery.getRouteId());
        entity.setPlaceId(discovery.getPlaceId());
        copyMutableFields(discovery, entity);
        return entity;
    }

    /**
     * 상태/결정 시각/요약 등 변경 가능한 필드만 엔티티에 반영 (키 필드는 그대로)
     */
    public void copyMutableFields(Discovery discovery, DiscoveryEntity entity) {
        entity.setStatus(discovery.getStatus());
        entity.setPlaceData(writeSnapshot(discovery.getSnapshot()));
        entity.setDiscoveredAt(discovery.getDiscoveredAt());
        entity.setDecidedAt(discovery.getDecidedAt());
        entity.setDismissExpiresAt(discovery.getDismissExpiresAt());
        entity.setSummaryRequestedAt(discovery.getSummaryRequestedAt());
        entity.setSummaryData(discovery.getSummaryData());
        entity.setSources(writeSources(discovery.getSources()));
    }

    public DiscoveredRoute toRouteModel(DiscoveredRouteEntity entity) {
        return DiscoveredRoute.builder()
                .userId(entity.getUserId())
                .routeId(entity.getRouteId())
                .discoveredAt(entity.getDiscoveredAt())
                .discoveryCount(entity.getDiscoveryCount())
                .build();
    }

    public DiscoveredRouteEntity toRouteEntity(DiscoveredRoute route) {
        DiscoveredRouteEntity entity = new DiscoveredRouteEntity();
        entity.setUserId(route.getUserId());
        entity.setRouteId(route.getRouteId());
        entity.setDiscoveredAt(route.getDiscoveredAt());
        entity.setDiscoveryCount(route.getDiscoveryCount());
        return entity;
    }

    private List<DiscoverySource> readSources(String stored) {
        if (stored == null || stored.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(stored.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(DiscoverySource::valueOf)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private String writeSources(List<DiscoverySource> sources) {
        if (sources == null || sources.isEmpty()) {
            return null;
        }
        return sources.stream().map(Enum::name).collect(Collectors.joining(","));
    }

    private StandardPlace readSnapshot(DiscoveryEntity entity) {
        if (entity.getPlaceData() == null || entity.getPlaceData().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(entity.getPlaceData(), StandardPlace.class);
        } catch (JsonProcessingException e) {
            log.warn("[DiscoveryEntityMapper] unreadable place_data - discoveryId: {}, error: {}",
                    entity.getDiscoveryId(), e.getOriginalMessage());
            return null;
        }
    }

    private String writeSnapshot(StandardPlace snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize place snapshot: " + snapshot.getPlaceId(), e);
        }
    }
}
