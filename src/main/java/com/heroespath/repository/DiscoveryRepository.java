package com.heroespath.repository;

import com.heroespath.entity.DiscoveryEntity;
import com.heroespath.model.DiscoveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DiscoveryRepository extends JpaRepository<DiscoveryEntity, Long> {
    List<DiscoveryEntity> findByUserIdAndRouteIdOrderByDiscoveredAtAsc(String userId, String routeId);

    Optional<DiscoveryEntity> findByUserIdAndRouteIdAndPlaceId(String userId, String routeId, String placeId);

    Optional<DiscoveryEntity> findByDiscoveryId(String discoveryId);

    List<DiscoveryEntity> findByUserIdAndStatusInOrderByDiscoveredAtDesc(String userId, Collection<DiscoveryStatus> statuses);
}
