package com.heroespath.service.store;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.RouteDiscoverySet;
import com.heroespath.service.cache.LocalDiscoveryCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Discovery 영속화 경계
 * 원격 저장소를 우선 사용하고, 실패하면 로컬 캐시로 읽고/쓰며 DegradedPersistence 경고를 함께 돌려준다.
 * 만료된 임시 숨김은 읽을 때 미검토로 보정한다 (별도 스윕 없음)
 */
@Slf4j
@Service
public class DiscoveryStoreAdapter {

    private final RemoteDiscoveryStore remoteStore;
    private final LocalDiscoveryCache localCache;
    private final Clock clock;

    public DiscoveryStoreAdapter(RemoteDiscoveryStore remoteStore, LocalDiscoveryCache localCache, Clock clock) {
        this.remoteStore = remoteStore;
        this.localCache = localCache;
        this.clock = clock;
    }

    public StoreResult<RouteDiscoverySet> loadRouteDiscoveries(String userId, String routeId) {
        List<Discovery> records;
        DegradedPersistence warning = null;
        try {
            records = remoteStore.findByRoute(userId, routeId);
        } catch (DataAccessException | TransactionException e) {
            warning = degradedRead("loadRouteDiscoveries", e);
            records = null;
        }
        if (records == null) {
            records = localCache.findByRoute(userId, routeId);
        } else {
            records = overlayPending(records, () -> localCache.findByRoute(userId, routeId));
            mirror(records);
        }

        applyLazyExpiry(records);
        RouteDiscoverySet set = new RouteDiscoverySet(routeId, records);
        log.debug("[DiscoveryStoreAdapter] loadRouteDiscoveries - userId: {}, routeId: {}, size: {}, degraded: {}",
                userId, routeId, set.size(), warning != null);
        return warning == null ? StoreResult.ok(set) : StoreResult.degraded(set, warning);
    }

    /**
     * 최초 탐색을 마친 경로인지 확인
     * 원격에 아직 반영되지 않은 로컬 표시도 탐색 완료로 본다
     */
    public StoreResult<Boolean> isRouteDiscovered(String userId, String routeId) {
        try {
            Optional<DiscoveredRoute> remote = remoteStore.findRoute(userId, routeId);
            if (remote.isPresent()) {
                mirrorRoute(remote.get());
                return StoreResult.ok(true);
            }
            return StoreResult.ok(localCache.findRoute(userId, routeId).isPresent());
        } catch (DataAccessException | TransactionException e) {
            DegradedPersistence warning = degradedRead("isRouteDiscovered", e);
            return StoreResult.degraded(localCache.findRoute(userId, routeId).isPresent(), warning);
        }
    }

    /**
     * 경로를 탐색 완료로 표시. 이미 표시돼 있으면 기존 표시를 돌려준다
     * 원격 실패 시 로컬에 저장하고 flush 대기열에 넣는다
     */
    public StoreResult<DiscoveredRoute> markRouteDiscovered(String userId, String routeId, int discoveryCount) {
        DiscoveredRoute route = DiscoveredRoute.builder()
                .userId(userId)
                .routeId(routeId)
                .discoveredAt(clock.instant())
                .discoveryCount(discoveryCount)
                .build();
        try {
            DiscoveredRoute stored = remoteStore.insertRouteIfAbsent(route);
            mirrorRoute(stored);
            return StoreResult.ok(stored);
        } catch (DataAccessException | TransactionException e) {
            log.warn("[DiscoveryStoreAdapter] markRouteDiscovered - remote store unavailable, queued locally: key: {}, error: {}",
                    route.storageKey(), e.getMessage());
            localCache.putRoute(route);
            localCache.markRoutePending(route);
            return StoreResult.degraded(route, DegradedPersistence.queuedWrite("markRouteDiscovered", e));
        }
    }

    /**
     * 새 discovery 저장. 같은 (user, route, place)가 이미 있으면 기존 기록을 돌려준다
     * @throws InvalidPlaceLocationException 스냅샷에 숫자 좌표가 없는 경우 (저장하지 않음)
     */
    public StoreResult<Discovery> createDiscovery(Discovery record) {
        if (record.getSnapshot() == null || !record.getSnapshot().hasValidLocation()) {
            log.warn("[DiscoveryStoreAdapter] createDiscovery - rejected, no coordinates: placeId: {}", record.getPlaceId());
            throw new InvalidPlaceLocationException(record.getPlaceId());
        }
        Discovery toCreate = record.toBuilder()
                .discoveryId(Discovery.idFor(record.getUserId(), record.getRouteId(), record.getPlaceId()))
                .status(record.getStatus() != null ? record.getStatus() : DiscoveryStatus.UNREVIEWED)
                .discoveredAt(record.getDiscoveredAt() != null ? record.getDiscoveredAt() : clock.instant())
                .build();

        try {
            Discovery stored = remoteStore.insertIfAbsent(toCreate);
            mirror(List.of(stored));
            return StoreResult.ok(stored);
        } catch (DataAccessException | TransactionException e) {
            Optional<Discovery> cached = localCache.findById(toCreate.getDiscoveryId());
            if (cached.isPresent()) {
                return StoreResult.degraded(cached.get(), degradedRead("createDiscovery", e));
            }
            return StoreResult.degraded(toCreate, queueWrite("createDiscovery", toCreate, e));
        }
    }

    /**
     * 상태 변경. UNREVIEWED로 돌아가면 결정 시각과 만료 시각을 지운다
     */
    public StoreResult<Discovery> updateStatus(String userId, String discoveryId, DiscoveryStatus status,
                                               Instant expiresAt) {
        Instant now = clock.instant();
        return modify(userId, discoveryId, "updateStatus", current -> current.toBuilder()
                .status(status)
                .decidedAt(status.isReviewed() ? now : null)
                .dismissExpiresAt(status == DiscoveryStatus.DISMISSED_TEMPORARY ? expiresAt : null)
                .build());
    }

    /**
     * 요약 요청 시각 또는 외부에서 생성된 요약 데이터 기록. null 인자는 기존 값을 유지
     */
    public StoreResult<Discovery> updateSummary(String userId, String discoveryId, Instant requestedAt, String summaryData) {
        return modify(userId, discoveryId, "updateSummary", current -> current.toBuilder()
                .summaryRequestedAt(requestedAt != null ? requestedAt : current.getSummaryRequestedAt())
                .summaryData(summaryData != null ? summaryData : current.getSummaryData())
                .build());
    }

    public StoreResult<Optional<Discovery>> findDiscovery(String userId, String discoveryId) {
        Optional<Discovery> found;
        DegradedPersistence warning = null;
        try {
            Optional<Discovery> pending = localCache.pendingIds().contains(discoveryId)
                    ? localCache.findById(discoveryId)
                    : Optional.empty();
            found = pending.isPresent() ? pending : remoteStore.findById(discoveryId);
        } catch (DataAccessException | TransactionException e) {
            warning = degradedRead("findDiscovery", e);
            found = localCache.findById(discoveryId);
        }

        found = found.filter(d -> d.getUserId().equals(userId));
        found.ifPresent(d -> applyLazyExpiry(List.of(d)));
        return warning == null ? StoreResult.ok(found) : StoreResult.degraded(found, warning);
    }

    /**
     * 사용자 전체 경로에서 해당 상태의 discovery 목록
     * 만료된 임시 숨김은 UNREVIEWED로 보정된 뒤 분류된다
     */
    public StoreResult<List<Discovery>> loadUserDiscoveries(String userId, DiscoveryStatus status) {
        Set<DiscoveryStatus> queried = status == DiscoveryStatus.UNREVIEWED
                ? EnumSet.of(DiscoveryStatus.UNREVIEWED, DiscoveryStatus.DISMISSED_TEMPORARY)
                : EnumSet.of(status);

        List<Discovery> records;
        DegradedPersistence warning = null;
        try {
            records = remoteStore.findByUser(userId, queried);
        } catch (DataAccessException | TransactionException e) {
            warning = degradedRead("loadUserDiscoveries", e);
            records = null;
        }
        records = records == null
                ? localCache.findByUser(userId)
                : overlayPending(records, () -> localCache.findByUser(userId));

        applyLazyExpiry(records);
        List<Discovery> result = records.stream()
                .filter(d -> d.getStatus() == status)
                .collect(Collectors.toList());
        return warning == null ? StoreResult.ok(result) : StoreResult.degraded(result, warning);
    }

    /**
     * 로컬에 대기 중인 쓰기를 원격 저장소에 다시 보낸다
     * 원격이 아직 실패하면 남은 항목은 대기열에 둔다
     * @return 반영된 건수
     */
    @Scheduled(fixedDelayString = "${discovery.cache.flush-interval-ms:60000}")
    public int flushPending() {
        int flushed = flushPendingRoutes();
        Set<String> pendingIds = localCache.pendingIds();
        if (pendingIds.isEmpty()) {
            return flushed;
        }

        for (String discoveryId : pendingIds) {
            Optional<Discovery> cached = localCache.findById(discoveryId);
            if (cached.isEmpty()) {
                localCache.clearPending(discoveryId);
                continue;
            }
            try {
                remoteStore.save(cached.get());
                localCache.clearPending(discoveryId);
                flushed++;
            } catch (DataAccessException | TransactionException e) {
                log.warn("[DiscoveryStoreAdapter] flushPending - remote still unavailable, error: {}", e.getMessage());
                break;
            }
        }
        log.info("[DiscoveryStoreAdapter] flushPending - flushed: {}, pending: {}", flushed, pendingIds.size());
        return flushed;
    }

    private int flushPendingRoutes() {
        int flushed = 0;
        for (DiscoveredRoute route : localCache.pendingRoutes()) {
            try {
                remoteStore.insertRouteIfAbsent(route);
                localCache.clearRoutePending(route);
                flushed++;
            } catch (DataAccessException | TransactionException e) {
                log.warn("[DiscoveryStoreAdapter] flushPending - route marker not flushed, key: {}, error: {}",
                        route.storageKey(), e.getMessage());
                break;
            }
        }
        return flushed;
    }

    private StoreResult<Discovery> modify(String userId, String discoveryId, String operation,
                                          UnaryOperator<Discovery> change) {
        StoreResult<Optional<Discovery>> lookup = findDiscovery(userId, discoveryId);
        Discovery current = lookup.getValue()
                .orElseThrow(() -> new DiscoveryNotFoundException("Discovery not found: " + discoveryId));
        Discovery updated = change.apply(current);

        if (lookup.isDegraded()) {
            // 조회부터 실패했다면 원격을 다시 시도하지 않고 바로 대기열에 넣는다
            DegradedPersistence cause = lookup.getWarning().get();
            localCache.put(updated);
            localCache.markPending(updated.getDiscoveryId());
            return StoreResult.degraded(updated, new DegradedPersistence(operation, cause.getReason(), true));
        }

        try {
            Discovery stored = remoteStore.save(updated);
            mirror(List.of(stored));
            localCache.clearPending(stored.getDiscoveryId());
            return StoreResult.ok(stored);
        } catch (DataAccessException | TransactionException e) {
            return StoreResult.degraded(updated, queueWrite(operation, updated, e));
        }
    }

    /**
     * 원격 결과에 아직 반영되지 않은 로컬 쓰기를 덮어쓴다
     */
    private List<Discovery> overlayPending(List<Discovery> remote, Supplier<List<Discovery>> local) {
        Set<String> pendingIds = localCache.pendingIds();
        if (pendingIds.isEmpty()) {
            return new ArrayList<>(remote);
        }
        Map<String, Discovery> byId = new LinkedHashMap<>();
        remote.forEach(d -> byId.put(d.getDiscoveryId(), d));
        local.get().stream()
                .filter(d -> pendingIds.contains(d.getDiscoveryId()))
                .forEach(d -> byId.put(d.getDiscoveryId(), d));
        return new ArrayList<>(byId.values());
    }

    /**
     * 만료된 임시 숨김을 UNREVIEWED로 보정하고 가능하면 저장소에도 반영
     */
    private void applyLazyExpiry(List<Discovery> records) {
        Instant now = clock.instant();
        for (Discovery discovery : records) {
            Instant expiredAt = discovery.getDismissExpiresAt();
            if (!discovery.correctStaleDismissal(now)) {
                continue;
            }
            log.info("[DiscoveryStoreAdapter] stale dismissal corrected - discoveryId: {}, expiredAt: {}",
                    discovery.getDiscoveryId(), expiredAt);
            try {
                remoteStore.save(discovery);
            } catch (DataAccessException | TransactionException e) {
                // 읽을 때마다 다시 보정되므로 대기열에 넣지 않는다
                log.debug("[DiscoveryStoreAdapter] stale dismissal write-back skipped - discoveryId: {}, error: {}",
                        discovery.getDiscoveryId(), e.getMessage());
            }
            mirror(List.of(discovery));
        }
    }

    private void mirrorRoute(DiscoveredRoute route) {
        try {
            localCache.putRoute(route);
        } catch (DataAccessException e) {
            log.warn("[DiscoveryStoreAdapter] local cache route mirror failed - error: {}", e.getMessage());
        }
    }

    private void mirror(List<Discovery> records) {
        try {
            records.forEach(localCache::put);
        } catch (DataAccessException e) {
            log.warn("[DiscoveryStoreAdapter] local cache mirror failed - error: {}", e.getMessage());
        }
    }

    private DegradedPersistence degradedRead(String operation, Exception e) {
        log.warn("[DiscoveryStoreAdapter] {} - remote store unavailable, serving local cache: {}", operation, e.getMessage());
        return DegradedPersistence.read(operation, e);
    }

    private DegradedPersistence queueWrite(String operation, Discovery discovery, Exception e) {
        log.warn("[DiscoveryStoreAdapter] {} - remote store unavailable, queued locally: discoveryId: {}, error: {}",
                operation, discovery.getDiscoveryId(), e.getMessage());
        localCache.put(discovery);
        localCache.markPending(discovery.getDiscoveryId());
        return DegradedPersistence.queuedWrite(operation, e);
    }
}
