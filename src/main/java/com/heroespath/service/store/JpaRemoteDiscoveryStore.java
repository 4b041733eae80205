package com.heroespath.service.store;

import com.heroespath.entity.DiscoveredRouteEntity;
import com.heroespath.entity.DiscoveryEntity;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.repository.DiscoveredRouteRepository;
import com.heroespath.repository.DiscoveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRemoteDiscoveryStore implements RemoteDiscoveryStore {

    private final DiscoveryRepository discoveryRepository;
    private final DiscoveredRouteRepository discoveredRouteRepository;
    private final DiscoveryEntityMapper mapper;

    @Override
    public List<Discovery> findByRoute(String userId, String routeId) {
        return discoveryRepository.findByUserIdAndRouteIdOrderByDiscoveredAtAsc(userId, routeId).stream()
                .map(mapper::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Discovery> findById(String discoveryId) {
        return discoveryRepository.findByDiscoveryId(discoveryId).map(mapper::toModel);
    }

    @Override
    public List<Discovery> findByUser(String userId, Collection<DiscoveryStatus> statuses) {
        return discoveryRepository.findByUserIdAndStatusInOrderByDiscoveredAtDesc(userId, statuses).stream()
                .map(mapper::toModel)
                .collect(Collectors.toList());
    }

    @Override
    public Discovery insertIfAbsent(Discovery discovery) {
        Optional<DiscoveryEntity> existing = discoveryRepository.findByUserIdAndRouteIdAndPlaceId(
                discovery.getUserId(), discovery.getRouteId(), discovery.getPlaceId());
        if (existing.isPresent()) {
            return mapper.toModel(existing.get());
        }

        try {
            return mapper.toModel(discoveryRepository.saveAndFlush(mapper.toEntity(discovery)));
        } catch (DataIntegrityViolationException e) {
            // 동시 최초 탐색으로 같은 (user, route, place)가 먼저 INSERT된 경우: 재조회
            log.info("[JpaRemoteDiscoveryStore] insertIfAbsent - concurrent insert detected, key: {}",
                    discovery.storageKey());
            return discoveryRepository.findByUserIdAndRouteIdAndPlaceId(
                            discovery.getUserId(), discovery.getRouteId(), discovery.getPlaceId())
                    .map(mapper::toModel)
                    .orElseThrow(() -> new IllegalStateException(
                            "discoveries duplicate key but row not found: " + discovery.storageKey(), e));
        }
    }

    @Override
    public Discovery save(Discovery discovery) {
        Optional<DiscoveryEntity> existing = discoveryRepository.findByDiscoveryId(discovery.getDiscoveryId());
        if (existing.isEmpty()) {
            return insertIfAbsent(discovery);
        }
        DiscoveryEntity entity = existing.get();
        mapper.copyMutableFields(discovery, entity);
        return mapper.toModel(discoveryRepository.save(entity));
    }

    @Override
    public Optional<DiscoveredRoute> findRoute(String userId, String routeId) {
        return discoveredRouteRepository.findByUserIdAndRouteId(userId, routeId).map(mapper::toRouteModel);
    }

    @Override
    public DiscoveredRoute insertRouteIfAbsent(DiscoveredRoute route) {
        Optional<DiscoveredRouteEntity> existing =
                discoveredRouteRepository.findByUserIdAndRouteId(route.getUserId(), route.getRouteId());
        if (existing.isPresent()) {
            return mapper.toRouteModel(existing.get());
        }

        try {
            return mapper.toRouteModel(discoveredRouteRepository.saveAndFlush(mapper.toRouteEntity(route)));
        } catch (DataIntegrityViolationException e) {
            log.info("[JpaRemoteDiscoveryStore] insertRouteIfAbsent - concurrent insert detected, key: {}",
                    route.storageKey());
            return discoveredRouteRepository.findByUserIdAndRouteId(route.getUserId(), route.getRouteId())
                    .map(mapper::toRouteModel)
                    .orElseThrow(() -> new IllegalStateException(
                            "discovered_routes duplicate key but row not found: " + route.storageKey(), e));
        }
    }
}
