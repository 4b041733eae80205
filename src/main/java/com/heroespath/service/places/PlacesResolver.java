package com.heroespath.service.places;

import com.heroespath.exception.PlacesUnavailableException;
import com.heroespath.model.GeoPoint;
import com.heroespath.model.StandardPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Places API 세대 차이를 숨기는 resolver
 * 설정된 순서대로 전략을 시도하고 처음 성공한 결과를 돌려준다. 결과를 저장하지 않는다
 */
@Slf4j
@Service
public class PlacesResolver {

    private final List<PlacesLookupStrategy> strategies;
    private final PlacePhotoUrls photoUrls;
    private final String probePlaceId;

    public PlacesResolver(List<PlacesLookupStrategy> availableStrategies,
                          PlacePhotoUrls photoUrls,
                          @Value("${google.places.strategy-order:current,legacy}") String strategyOrder,
                          @Value("${google.places.probe-place-id:ChIJN1t_tDeuEmsRUsoyG83frY4}") String probePlaceId) {
        this.strategies = orderStrategies(availableStrategies, strategyOrder);
        this.photoUrls = photoUrls;
        this.probePlaceId = probePlaceId;
        log.info("[PlacesResolver] strategy order: {}",
                strategies.stream().map(PlacesLookupStrategy::generation).collect(Collectors.toList()));
    }

    static List<PlacesLookupStrategy> orderStrategies(List<PlacesLookupStrategy> available, String order) {
        Map<String, PlacesLookupStrategy> byGeneration = available.stream()
                .collect(Collectors.toMap(PlacesLookupStrategy::generation, Function.identity()));
        List<PlacesLookupStrategy> ordered = new ArrayList<>();
        for (String generation : Arrays.asList(order.split(","))) {
            PlacesLookupStrategy strategy = byGeneration.get(generation.trim());
            if (strategy == null) {
                throw new IllegalArgumentException("Unknown places strategy in google.places.strategy-order: " + generation);
            }
            ordered.add(strategy);
        }
        if (ordered.isEmpty()) {
            throw new IllegalArgumentException("google.places.strategy-order must name at least one strategy");
        }
        return ordered;
    }

    public List<StandardPlace> resolveNearby(GeoPoint point, int radiusMeters, String typeFilter, FieldProfile profile) {
        return resolveNearby(NearbyQuery.builder()
                .center(point)
                .radiusMeters(radiusMeters)
                .type(typeFilter)
                .profile(profile)
                .build());
    }

    /**
     * @throws PlacesUnavailableException 모든 세대가 실패한 경우
     */
    public List<StandardPlace> resolveNearby(NearbyQuery query) {
        if (query.getCenter() == null || !query.getCenter().isValid()) {
            throw new IllegalArgumentException("Nearby search needs a numeric center point");
        }
        String operation = "nearby(" + query.getCenter().getLat() + "," + query.getCenter().getLng()
                + ", r=" + query.getRadiusMeters() + ", type=" + query.getType() + ")";
        return firstSuccess(operation, query.getProfile(), strategy -> () -> strategy.nearby(query));
    }

    /**
     * details-full 프로필로 상세 정보 조회
     */
    public StandardPlace resolveDetails(String placeId, String language) {
        if (placeId == null || placeId.isBlank()) {
            throw new IllegalArgumentException("placeId is required");
        }
        return firstSuccess("details(" + placeId + ")", FieldProfile.DETAILS_FULL,
                strategy -> () -> strategy.details(placeId, language, FieldProfile.DETAILS_FULL));
    }

    private <T> T firstSuccess(String operation, FieldProfile profile,
                               Function<PlacesLookupStrategy, Supplier<LookupResult<T>>> call) {
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < strategies.size(); i++) {
            PlacesLookupStrategy strategy = strategies.get(i);
            long startTime = System.currentTimeMillis();
            LookupResult<T> result = call.apply(strategy).get();
            long duration = System.currentTimeMillis() - startTime;

            if (result.isSuccess()) {
                log.info("[PlacesResolver] {} - generation: {}, profile: {}, outcome: ok, duration: {}ms",
                        operation, strategy.generation(), profile.getProfileName(), duration);
                return result.getValue();
            }
            // 마지막 전략의 0건 응답은 실패가 아니라 빈 결과
            if (result.isEmptyAnswer() && i == strategies.size() - 1) {
                log.info("[PlacesResolver] {} - generation: {}, profile: {}, outcome: empty, duration: {}ms",
                        operation, strategy.generation(), profile.getProfileName(), duration);
                return result.getValue();
            }
            failures.add(result.toString());
            log.warn("[PlacesResolver] {} - generation: {}, profile: {}, outcome: failed ({}), duration: {}ms",
                    operation, strategy.generation(), profile.getProfileName(), result.getError(), duration);
        }
        log.warn("[PlacesResolver] {} - all generations failed: {}", operation, failures);
        throw new PlacesUnavailableException(operation, failures);
    }

    /**
     * 알려진 장소의 상세 조회로 세대별 연결 상태 확인. 예외를 던지지 않는다
     */
    public ConnectivityReport checkConnectivity() {
        ConnectivityReport report = new ConnectivityReport();
        report.setProbePlaceId(probePlaceId);
        for (PlacesLookupStrategy strategy : strategies) {
            report.record(strategy.details(probePlaceId, "en", FieldProfile.SEARCH_BASIC));
        }
        log.info("[PlacesResolver] checkConnectivity - available: {}", report.getAvailable());
        return report;
    }

    public String buildPhotoUrl(String photoReference, int maxWidth) {
        return photoUrls.photoUrl(photoReference, maxWidth);
    }
}
