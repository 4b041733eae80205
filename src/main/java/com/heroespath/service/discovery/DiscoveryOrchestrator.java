package com.heroespath.service.discovery;

import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.exception.PlacesUnavailableException;
import com.heroespath.model.DiscoveredRoute;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.RouteDiscoverySet;
import com.heroespath.model.RouteSample;
import com.heroespath.model.StandardPlace;
import com.heroespath.service.places.FieldProfile;
import com.heroespath.service.places.NearbyQuery;
import com.heroespath.service.ping.PingPlacesSource;
import com.heroespath.service.places.PlacesResolver;
import com.heroespath.service.store.DegradedPersistence;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.service.store.StoreResult;
import com.heroespath.service.taxonomy.PlaceTaxonomy;
import com.heroespath.service.taxonomy.TaxonomyClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 경로 단위 탐색
 * 이미 탐색한 경로면 resolver를 호출하지 않고 저장된 미검토 목록만 돌려준다.
 * 최초 탐색일 때만 resolver를 호출하고, 산책 중 ping 결과와 합쳐 UNREVIEWED로 저장한 뒤 경로를 탐색 완료로 표시한다
 */
@Slf4j
@Service
public class DiscoveryOrchestrator {

    private final PlacesResolver placesResolver;
    private final DiscoveryStoreAdapter storeAdapter;
    private final TaxonomyClassifier classifier;
    private final RouteSampler routeSampler;
    private final PlaceMerger placeMerger;
    private final PingPlacesSource pingPlaces;
    private final Clock clock;
    private final Executor discoveryExecutor;
    private final int maxResults;

    public DiscoveryOrchestrator(PlacesResolver placesResolver,
                                 DiscoveryStoreAdapter storeAdapter,
                                 TaxonomyClassifier classifier,
                                 RouteSampler routeSampler,
                                 PlaceMerger placeMerger,
                                 PingPlacesSource pingPlaces,
                                 Clock clock,
                                 @Qualifier("discoveryExecutor") Executor discoveryExecutor,
                                 @Value("${discovery.search.max-results:20}") int maxResults) {
        this.placesResolver = placesResolver;
        this.storeAdapter = storeAdapter;
        this.classifier = classifier;
        this.routeSampler = routeSampler;
        this.placeMerger = placeMerger;
        this.pingPlaces = pingPlaces;
        this.clock = clock;
        this.discoveryExecutor = discoveryExecutor;
        this.maxResults = maxResults;
    }

    public DiscoveryResult discoverForRoute(DiscoveryContext ctx, String routeId, List<RouteSample> routeCoords,
                                            List<String> typeFilters, String language) {
        List<DegradedPersistence> warnings = new ArrayList<>();

        // 기존 목록과 탐색 완료 표시를 다 읽은 뒤에 resolver 호출 여부를 결정
        StoreResult<RouteDiscoverySet> existing = storeAdapter.loadRouteDiscoveries(ctx.getUserId(), routeId);
        existing.getWarning().ifPresent(warnings::add);
        if (!existing.getValue().isEmpty()) {
            return alreadyDiscovered(routeId, existing.getValue(), warnings);
        }
        StoreResult<Boolean> discovered = storeAdapter.isRouteDiscovered(ctx.getUserId(), routeId);
        discovered.getWarning().ifPresent(warnings::add);
        if (discovered.getValue()) {
            return alreadyDiscovered(routeId, existing.getValue(), warnings);
        }

        boolean callerFiltered = typeFilters != null && !typeFilters.isEmpty();
        if (!callerFiltered && ctx.allTypesDisabled()) {
            // 탐색 완료로 표시하지 않으므로 타입을 다시 켜면 최초 탐색을 할 수 있다
            log.info("[DiscoveryOrchestrator] discoverForRoute - routeId: {}, all place types disabled, skipped", routeId);
            return DiscoveryResult.builder()
                    .routeId(routeId)
                    .warnings(warnings)
                    .build();
        }

        List<SearchCircle> circles = routeSampler.coverage(routeCoords);
        if (circles.isEmpty()) {
            log.info("[DiscoveryOrchestrator] discoverForRoute - routeId: {}, no usable route samples, skipped", routeId);
            return DiscoveryResult.builder()
                    .routeId(routeId)
                    .warnings(warnings)
                    .build();
        }

        List<String> filters = effectiveFilters(typeFilters, ctx);
        List<StandardPlace> found;
        try {
            found = searchRoute(circles, filters, language);
        } catch (PlacesUnavailableException e) {
            // 빈 결과로 대체, 탐색 완료로 표시하지 않으므로 다음 호출이 다시 최초 탐색이 된다
            log.warn("[DiscoveryOrchestrator] discoverForRoute - routeId: {}, places unavailable: {}",
                    routeId, e.getFailures());
            return DiscoveryResult.builder()
                    .routeId(routeId)
                    .resolverCalled(true)
                    .placesUnavailable(true)
                    .warnings(warnings)
                    .build();
        }

        List<StandardPlace> pinged = loadPingPlaces(ctx.getUserId(), routeId, warnings);
        List<ConsolidatedPlace> consolidated = placeMerger.consolidate(found, pinged != null ? pinged : List.of());

        Instant now = clock.instant();
        int matched = 0;
        List<StandardPlace> created = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (ConsolidatedPlace candidate : consolidated) {
            StandardPlace place = candidate.getPlace();
            if (!classifier.matchesAnyFilter(place, filters)) {
                continue;
            }
            matched++;
            if (!place.hasValidLocation()) {
                log.warn("[DiscoveryOrchestrator] rejected place without coordinates - routeId: {}, placeId: {}",
                        routeId, place.getPlaceId());
                rejected.add(place.getPlaceId());
                continue;
            }
            Discovery record = Discovery.builder()
                    .userId(ctx.getUserId())
                    .routeId(routeId)
                    .placeId(place.getPlaceId())
                    .snapshot(place)
                    .status(DiscoveryStatus.UNREVIEWED)
                    .discoveredAt(now)
                    .sources(candidate.getSources())
                    .build();
            try {
                StoreResult<Discovery> stored = storeAdapter.createDiscovery(record);
                stored.getWarning().ifPresent(warnings::add);
                // 동시 최초 탐색에서 이미 검토된 기록이 있으면 돌려주지 않는다
                if (stored.getValue().getStatus() == DiscoveryStatus.UNREVIEWED) {
                    created.add(stored.getValue().getSnapshot());
                }
            } catch (InvalidPlaceLocationException e) {
                rejected.add(e.getPlaceId());
            }
        }

        StoreResult<DiscoveredRoute> marker = storeAdapter.markRouteDiscovered(ctx.getUserId(), routeId, created.size());
        marker.getWarning().ifPresent(warnings::add);
        if (pinged != null && !pinged.isEmpty()) {
            archivePingResults(ctx.getUserId(), routeId);
        }

        log.info("[DiscoveryOrchestrator] discoverForRoute - routeId: {}, cached: false, found: {}, pinged: {}, matched: {}, created: {}, rejected: {}, filters: {}",
                routeId, found.size(), pinged != null ? pinged.size() : 0, matched, created.size(), rejected.size(), filters);
        return DiscoveryResult.builder()
                .routeId(routeId)
                .places(created)
                .resolverCalled(true)
                .pingPlaceCount(pinged != null ? pinged.size() : 0)
                .rejectedPlaceIds(rejected)
                .warnings(warnings)
                .build();
    }

    /**
     * 여러 경로를 동시에 탐색할 때 사용. 한 경로 안의 단계는 순차로 실행된다
     * future를 취소해도 이미 보낸 저장 요청은 되돌리지 않는다
     */
    public CompletableFuture<DiscoveryResult> discoverForRouteAsync(DiscoveryContext ctx, String routeId,
                                                                    List<RouteSample> routeCoords,
                                                                    List<String> typeFilters, String language) {
        return CompletableFuture.supplyAsync(
                () -> discoverForRoute(ctx, routeId, routeCoords, typeFilters, language), discoveryExecutor);
    }

    private DiscoveryResult alreadyDiscovered(String routeId, RouteDiscoverySet set, List<DegradedPersistence> warnings) {
        List<StandardPlace> unreviewed = set.unreviewedPlaces();
        log.info("[DiscoveryOrchestrator] discoverForRoute - routeId: {}, cached: true, total: {}, unreviewed: {}",
                routeId, set.size(), unreviewed.size());
        return DiscoveryResult.builder()
                .routeId(routeId)
                .places(unreviewed)
                .resolverCalled(false)
                .warnings(warnings)
                .build();
    }

    private List<StandardPlace> searchRoute(List<SearchCircle> circles, List<String> filters, String language) {
        Set<String> searchTypes = searchTypesFor(filters);

        List<StandardPlace> all = new ArrayList<>();
        for (SearchCircle circle : circles) {
            for (String type : searchTypes) {
                all.addAll(placesResolver.resolveNearby(NearbyQuery.builder()
                        .center(circle.getCenter())
                        .radiusMeters(circle.getRadiusMeters())
                        .type(type)
                        .profile(FieldProfile.SEARCH_STANDARD)
                        .maxResults(maxResults)
                        .language(language != null ? language : "en")
                        .build()));
            }
        }
        return placeMerger.merge(all);
    }

    /**
     * 저장소 장애로 읽지 못하면 null. ping 결과 없이 진행한다
     */
    private List<StandardPlace> loadPingPlaces(String userId, String routeId, List<DegradedPersistence> warnings) {
        try {
            return pingPlaces.placesForRoute(userId, routeId);
        } catch (DataAccessException | TransactionException e) {
            log.warn("[DiscoveryOrchestrator] ping results unavailable - routeId: {}, error: {}", routeId, e.getMessage());
            warnings.add(DegradedPersistence.read("loadPingResults", e));
            return null;
        }
    }

    private void archivePingResults(String userId, String routeId) {
        try {
            pingPlaces.archive(userId, routeId);
        } catch (DataAccessException | TransactionException e) {
            // 남은 ping 결과는 이미 탐색한 경로에서는 다시 읽히지 않는다
            log.warn("[DiscoveryOrchestrator] ping results not archived - routeId: {}, error: {}", routeId, e.getMessage());
        }
    }

    /**
     * 원시 태그 필터는 그대로 검색 타입으로 쓰고, 카테고리/서브타입 필터는 타입 제한 없이 검색한 뒤 분류기로 거른다
     */
    private Set<String> searchTypesFor(List<String> filters) {
        Set<String> types = new LinkedHashSet<>();
        if (filters.isEmpty()) {
            types.add(null);
            return types;
        }
        for (String filter : filters) {
            types.add(PlaceTaxonomy.isGroupName(filter) ? null : filter);
        }
        return types;
    }

    /**
     * 호출자가 필터를 주지 않으면 사용자 설정의 타입을 사용. 설정이 없거나 "all"이 있으면 필터 없음
     */
    private List<String> effectiveFilters(List<String> typeFilters, DiscoveryContext ctx) {
        List<String> filters = typeFilters != null && !typeFilters.isEmpty() ? typeFilters : ctx.getEnabledTypes();
        if (filters == null || filters.contains(TaxonomyClassifier.ALL_TYPES)) {
            return List.of();
        }
        return filters;
    }
}
