package com.heroespath.repository;

import com.heroespath.entity.DiscoveredRouteEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DiscoveredRouteRepository extends JpaRepository<DiscoveredRouteEntity, Long> {
    Optional<DiscoveredRouteEntity> findByUserIdAndRouteId(String userId, String routeId);
}
