package com.heroespath.service.store;

import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 원격 문서 저장소. 연결 실패는 DataAccessException/TransactionException으로 드러난다
 */
public interface RemoteDiscoveryStore {

    List<Discovery> findByRoute(String userId, String routeId);

    Optional<Discovery> findById(String discoveryId);

    List<Discovery> findByUser(String userId, Collection<DiscoveryStatus> statuses);

    /**
     * (user, route, place)가 이미 있으면 저장하지 않고 기존 기록을 돌려준다
     */
    Discovery insertIfAbsent(Discovery discovery);

    /**
     * discoveryId 기준 upsert
     */
    Discovery save(Discovery discovery);

    Optional<DiscoveredRoute> findRoute(String userId, String routeId);

    /**
     * (user, route) 표시가 이미 있으면 기존 표시를 돌려준다
     */
    DiscoveredRoute insertRouteIfAbsent(DiscoveredRoute route);
}
