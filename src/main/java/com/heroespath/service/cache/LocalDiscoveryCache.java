package com.heroespath.service.cache;

import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 원격 저장소 장애 시 사용하는 로컬 key-value 캐시
 * 원격에 반영되지 않은 쓰기는 pending으로 표시해 두었다가 flush 때 다시 보낸다
 */
public interface LocalDiscoveryCache {

    String KEY_PREFIX = "discovery:";

    void put(Discovery discovery);

    Optional<Discovery> findById(String discoveryId);

    List<Discovery> findByRoute(String userId, String routeId);

    List<Discovery> findByUser(String userId);

    void markPending(String discoveryId);

    Set<String> pendingIds();

    void clearPending(String discoveryId);

    void putRoute(DiscoveredRoute route);

    Optional<DiscoveredRoute> findRoute(String userId, String routeId);

    /**
     * putRoute로 넣은 표시를 원격 미반영으로 표시
     */
    void markRoutePending(DiscoveredRoute route);

    List<DiscoveredRoute> pendingRoutes();

    void clearRoutePending(DiscoveredRoute route);

    static String keyOf(Discovery discovery) {
        return KEY_PREFIX + discovery.storageKey();
    }
}
