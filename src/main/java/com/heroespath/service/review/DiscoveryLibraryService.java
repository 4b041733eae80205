package com.heroespath.service.review;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.model.ConsolidationStats;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryStats;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.RouteReviewProgress;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.service.store.StoreResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * 사용자 discovery 목록, 통계, 경로별 진행률, 요약 첨부
 */
@Slf4j
@Service
public class DiscoveryLibraryService {

    private final DiscoveryStoreAdapter storeAdapter;
    private final Clock clock;

    public DiscoveryLibraryService(DiscoveryStoreAdapter storeAdapter, Clock clock) {
        this.storeAdapter = storeAdapter;
        this.clock = clock;
    }

    public StoreResult<List<Discovery>> listByStatus(String userId, DiscoveryStatus status) {
        return storeAdapter.loadUserDiscoveries(userId, status);
    }

    public DiscoveryStats stats(String userId) {
        long saved = count(userId, DiscoveryStatus.SAVED);
        long dismissed = count(userId, DiscoveryStatus.DISMISSED_TEMPORARY)
                + count(userId, DiscoveryStatus.DISMISSED_FOREVER);
        long pending = count(userId, DiscoveryStatus.UNREVIEWED);
        return new DiscoveryStats(saved + dismissed + pending, saved, dismissed, pending);
    }

    public RouteReviewProgress progress(String userId, String routeId) {
        return storeAdapter.loadRouteDiscoveries(userId, routeId).getValue().progress();
    }

    /**
     * 경로의 discovery를 출처(경로 검색/ping/둘 다)별로 센다
     */
    public ConsolidationStats consolidationStats(String userId, String routeId) {
        return storeAdapter.loadRouteDiscoveries(userId, routeId).getValue().consolidationStats();
    }

    /**
     * 요약 생성 요청 시각만 기록. 생성 자체는 외부에서 한다
     */
    public Discovery requestSummary(String userId, String discoveryId) {
        return storeAdapter.updateSummary(userId, discoveryId, clock.instant(), null).getValue();
    }

    public Discovery attachSummary(String userId, String discoveryId, String summaryData) {
        if (summaryData == null || summaryData.isBlank()) {
            throw new IllegalArgumentException("summaryData must not be empty");
        }
        Discovery discovery = storeAdapter.findDiscovery(userId, discoveryId).getValue()
                .orElseThrow(() -> new DiscoveryNotFoundException("Discovery not found: " + discoveryId));
        if (discovery.getSummaryRequestedAt() == null) {
            log.info("[DiscoveryLibraryService] attachSummary without prior request - discoveryId: {}", discoveryId);
        }
        return storeAdapter.updateSummary(userId, discoveryId, null, summaryData).getValue();
    }

    private long count(String userId, DiscoveryStatus status) {
        return storeAdapter.loadUserDiscoveries(userId, status).getValue().size();
    }
}
