package com.heroespath.service.cache;

import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 인메모리 캐시 (기본값)
 * 프로세스가 재시작되면 대기 중인 쓰기도 사라진다. 유지가 필요하면 redis 타입을 사용
 */
@Component
@ConditionalOnProperty(name = "discovery.cache.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDiscoveryCache implements LocalDiscoveryCache {

    private final Map<String, Discovery> entries = new ConcurrentHashMap<>();
    private final Map<String, String> keyById = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final Map<String, DiscoveredRoute> routes = new ConcurrentHashMap<>();
    private final Set<String> pendingRouteKeys = ConcurrentHashMap.newKeySet();

    @Override
    public void put(Discovery discovery) {
        String key = LocalDiscoveryCache.keyOf(discovery);
        // 호출자가 나중에 객체를 바꿔도 캐시 내용은 유지
        entries.put(key, discovery.toBuilder().build());
        keyById.put(discovery.getDiscoveryId(), key);
    }

    @Override
    public Optional<Discovery> findById(String discoveryId) {
        String key = keyById.get(discoveryId);
        return Optional.ofNullable(key == null ? null : entries.get(key)).map(d -> d.toBuilder().build());
    }

    @Override
    public List<Discovery> findByRoute(String userId, String routeId) {
        return entries.values().stream()
                .filter(d -> d.getUserId().equals(userId) && d.getRouteId().equals(routeId))
                .sorted(Comparator.comparing(Discovery::getDiscoveredAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(d -> d.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<Discovery> findByUser(String userId) {
        return entries.values().stream()
                .filter(d -> d.getUserId().equals(userId))
                .map(d -> d.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public void markPending(String discoveryId) {
        pending.add(discoveryId);
    }

    @Override
    public Set<String> pendingIds() {
        return Set.copyOf(pending);
    }

    @Override
    public void clearPending(String discoveryId) {
        pending.remove(discoveryId);
    }

    @Override
    public void putRoute(DiscoveredRoute route) {
        routes.put(route.storageKey(), route.toBuilder().build());
    }

    @Override
    public Optional<DiscoveredRoute> findRoute(String userId, String routeId) {
        return Optional.ofNullable(routes.get(DiscoveredRoute.keyOf(userId, routeId))).map(r -> r.toBuilder().build());
    }

    @Override
    public void markRoutePending(DiscoveredRoute route) {
        pendingRouteKeys.add(route.storageKey());
    }

    @Override
    public List<DiscoveredRoute> pendingRoutes() {
        return pendingRouteKeys.stream()
                .map(routes::get)
                .filter(Objects::nonNull)
                .map(r -> r.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public void clearRoutePending(DiscoveredRoute route) {
        pendingRouteKeys.remove(route.storageKey());
    }

    /**
     * 캐시 클리어 (테스트용)
     */
    public void clearAll() {
        entries.clear();
        keyById.clear();
        pending.clear();
        routes.clear();
        pendingRouteKeys.clear();
    }
}
