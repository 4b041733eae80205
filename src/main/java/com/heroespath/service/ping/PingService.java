package com.heroespath.service.ping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroespath.entity.PingAllowance;
import com.heroespath.entity.PingResultEntity;
import com.heroespath.exception.PlacesUnavailableException;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.GeoPoint;
import com.heroespath.model.PingPolicy;
import com.heroespath.model.StandardPlace;
import com.heroespath.repository.PingAllowanceRepository;
import com.heroespath.repository.PingResultRepository;
import com.heroespath.service.discovery.PlaceMerger;
import com.heroespath.service.places.FieldProfile;
import com.heroespath.service.places.NearbyQuery;
import com.heroespath.service.places.PlacesResolver;
import com.heroespath.service.taxonomy.PlaceTaxonomy;
import com.heroespath.service.taxonomy.TaxonomyClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 산책 중 현재 위치 주변 검색 (ping)
 * 쿨다운과 기간별 크레딧으로 사용을 제한하고, 결과는 경로별로 저장해 두었다가
 * 경로 최초 탐색 때 경로 검색 결과와 합친다
 */
@Slf4j
@Service
public class PingService implements PingPlacesSource {

    private static final TypeReference<List<StandardPlace>> PLACE_LIST = new TypeReference<>() {
    };

    private final PlacesResolver placesResolver;
    private final TaxonomyClassifier classifier;
    private final PlaceMerger placeMerger;
    private final PingAllowanceRepository allowanceRepository;
    private final PingResultRepository resultRepository;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PingService(PlacesResolver placesResolver,
                       TaxonomyClassifier classifier,
                       PlaceMerger placeMerger,
                       PingAllowanceRepository allowanceRepository,
                       PingResultRepository resultRepository,
                       Clock clock) {
        this.placesResolver = placesResolver;
        this.classifier = classifier;
        this.placeMerger = placeMerger;
        this.allowanceRepository = allowanceRepository;
        this.resultRepository = resultRepository;
        this.clock = clock;
    }

    public PingEligibility checkEligibility(DiscoveryContext ctx) {
        return eligibilityOf(currentAllowance(ctx), ctx.getPingPolicy(), clock.instant());
    }

    /**
     * 현재 위치 주변을 사용자 설정 타입으로 검색하고 결과를 경로에 저장
     * 쿨다운/크레딧 부족이면 검색하지 않고 해당 outcome을 돌려준다
     */
    public PingResult ping(DiscoveryContext ctx, String routeId, GeoPoint location, String language) {
        if (routeId == null || routeId.isBlank()) {
            throw new IllegalArgumentException("routeId is required");
        }
        if (location == null || !location.isValid()) {
            throw new IllegalArgumentException("Ping needs a numeric location");
        }

        PingPolicy policy = ctx.getPingPolicy();
        PingAllowance allowance = currentAllowance(ctx);
        Instant now = clock.instant();
        PingEligibility eligibility = eligibilityOf(allowance, policy, now);
        if (!eligibility.isCanPing()) {
            log.info("[PingService] ping blocked - userId: {}, reason: {}, cooldownRemaining: {}s",
                    ctx.getUserId(), eligibility.getBlockedBy(), eligibility.getCooldownRemainingSeconds());
            return PingResult.builder()
                    .outcome(eligibility.getBlockedBy())
                    .creditsRemaining(eligibility.getCreditsRemaining())
                    .cooldownRemainingSeconds(eligibility.getCooldownRemainingSeconds())
                    .build();
        }
        if (ctx.allTypesDisabled()) {
            return PingResult.builder()
                    .outcome(PingOutcome.NO_ENABLED_TYPES)
                    .creditsRemaining(allowance.getCreditsRemaining())
                    .build();
        }

        List<String> filters = filtersFor(ctx);
        Set<String> searchTypes = new LinkedHashSet<>();
        if (filters.isEmpty()) {
            searchTypes.add(null);
        }
        for (String filter : filters) {
            searchTypes.add(PlaceTaxonomy.isGroupName(filter) ? null : filter);
        }
        int perType = (int) Math.ceil((double) policy.getMaxResults() / searchTypes.size());

        List<StandardPlace> found = new ArrayList<>();
        int failed = 0;
        for (String type : searchTypes) {
            try {
                found.addAll(placesResolver.resolveNearby(NearbyQuery.builder()
                        .center(location)
                        .radiusMeters(policy.getRadiusMeters())
                        .type(type)
                        .profile(FieldProfile.SEARCH_STANDARD)
                        .maxResults(perType)
                        .language(language != null ? language : "en")
                        .build()));
            } catch (PlacesUnavailableException e) {
                failed++;
                log.warn("[PingService] ping search failed - userId: {}, type: {}, failures: {}",
                        ctx.getUserId(), type, e.getFailures());
            }
        }
        if (failed == searchTypes.size()) {
            return PingResult.builder()
                    .outcome(PingOutcome.PLACES_UNAVAILABLE)
                    .creditsRemaining(allowance.getCreditsRemaining())
                    .build();
        }

        List<StandardPlace> places = placeMerger.merge(found).stream()
                .filter(place -> classifier.matchesAnyFilter(place, filters))
                .limit(policy.getMaxResults())
                .filter(place -> policy.getMinRating() == null
                        || place.getRating() == null
                        || place.getRating() >= policy.getMinRating())
                .collect(Collectors.toList());

        String pingId = storeResult(ctx.getUserId(), routeId, location, places, now);

        allowance.setLastPingAt(now);
        allowance.setCreditsRemaining(Math.max(0, allowance.getCreditsRemaining() - 1));
        allowance.setTotalPingsUsed(allowance.getTotalPingsUsed() + 1);
        allowanceRepository.save(allowance);

        log.info("[PingService] ping - userId: {}, routeId: {}, pingId: {}, found: {}, kept: {}, creditsRemaining: {}",
                ctx.getUserId(), routeId, pingId, found.size(), places.size(), allowance.getCreditsRemaining());
        return PingResult.builder()
                .outcome(PingOutcome.FOUND)
                .pingId(pingId)
                .places(places)
                .creditsRemaining(allowance.getCreditsRemaining())
                .build();
    }

    public PingStats stats(DiscoveryContext ctx) {
        PingAllowance allowance = currentAllowance(ctx);
        PingPolicy policy = ctx.getPingPolicy();
        return new PingStats(allowance.getCreditsRemaining(), allowance.getTotalPingsUsed(),
                policy.getCreditsPerPeriod(), policy.getCooldown().getSeconds());
    }

    @Override
    public List<StandardPlace> placesForRoute(String userId, String routeId) {
        List<StandardPlace> places = new ArrayList<>();
        for (PingResultEntity result : resultRepository.findByUserIdAndRouteIdOrderByPingedAtAsc(userId, routeId)) {
            if (result.getPlacesData() == null) {
                continue;
            }
            try {
                places.addAll(objectMapper.readValue(result.getPlacesData(), PLACE_LIST));
            } catch (JsonProcessingException e) {
                log.warn("[PingService] unreadable places_data - pingId: {}, error: {}",
                        result.getPingId(), e.getOriginalMessage());
            }
        }
        return places;
    }

    @Override
    public long archive(String userId, String routeId) {
        long deleted = resultRepository.deleteByUserIdAndRouteId(userId, routeId);
        log.info("[PingService] archive - userId: {}, routeId: {}, pings: {}", userId, routeId, deleted);
        return deleted;
    }

    /**
     * 사용량 기록이 없으면 만들고, 크레딧 기간이 지났으면 다시 채운다
     */
    private PingAllowance currentAllowance(DiscoveryContext ctx) {
        PingPolicy policy = ctx.getPingPolicy();
        Instant now = clock.instant();
        PingAllowance allowance = allowanceRepository.findById(ctx.getUserId()).orElse(null);
        if (allowance == null) {
            allowance = new PingAllowance();
            allowance.setUserId(ctx.getUserId());
            allowance.setCreditsRemaining(policy.getCreditsPerPeriod());
            allowance.setLastCreditReset(now);
            return allowanceRepository.save(allowance);
        }
        if (!allowance.getLastCreditReset().plus(policy.getCreditPeriod()).isAfter(now)) {
            log.info("[PingService] credits reset - userId: {}, lastReset: {}", ctx.getUserId(), allowance.getLastCreditReset());
            allowance.setCreditsRemaining(policy.getCreditsPerPeriod());
            allowance.setLastCreditReset(now);
            return allowanceRepository.save(allowance);
        }
        return allowance;
    }

    private PingEligibility eligibilityOf(PingAllowance allowance, PingPolicy policy, Instant now) {
        if (allowance.getLastPingAt() != null) {
            Instant readyAt = allowance.getLastPingAt().plus(policy.getCooldown());
            if (now.isBefore(readyAt)) {
                long remainingMillis = Duration.between(now, readyAt).toMillis();
                return PingEligibility.cooldown((remainingMillis + 999) / 1000, allowance.getCreditsRemaining());
            }
        }
        if (allowance.getCreditsRemaining() <= 0) {
            return PingEligibility.noCredits();
        }
        return PingEligibility.allowed(allowance.getCreditsRemaining());
    }

    /**
     * 설정이 없거나 "all"이면 타입 제한 없음
     */
    private List<String> filtersFor(DiscoveryContext ctx) {
        List<String> enabled = ctx.getEnabledTypes();
        if (enabled == null || enabled.contains(TaxonomyClassifier.ALL_TYPES)) {
            return List.of();
        }
        return enabled;
    }

    private String storeResult(String userId, String routeId, GeoPoint location, List<StandardPlace> places, Instant now) {
        PingResultEntity entity = new PingResultEntity();
        entity.setPingId("ping_" + UUID.randomUUID());
        entity.setUserId(userId);
        entity.setRouteId(routeId);
        entity.setLatitude(location.getLat());
        entity.setLongitude(location.getLng());
        entity.setPingedAt(now);
        entity.setPlaceCount(places.size());
        try {
            entity.setPlacesData(objectMapper.writeValueAsString(places));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ping places for route " + routeId, e);
        }
        return resultRepository.save(entity).getPingId();
    }
}
