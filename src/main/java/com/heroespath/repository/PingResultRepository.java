package com.heroespath.repository;

import com.heroespath.entity.PingResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface PingResultRepository extends JpaRepository<PingResultEntity, Long> {
    List<PingResultEntity> findByUserIdAndRouteIdOrderByPingedAtAsc(String userId, String routeId);

    @Transactional
    long deleteByUserIdAndRouteId(String userId, String routeId);
}
