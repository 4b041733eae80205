package com.heroespath.service.discovery;

import com.heroespath.model.DiscoverySource;
import com.heroespath.model.StandardPlace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 여러 검색 지점에서 중복으로 나온 장소를 placeId 기준으로 합침
 * 처음 나온 순서를 유지한다
 */
@Component
public class PlaceMerger {

    public List<StandardPlace> merge(List<StandardPlace> places) {
        Map<String, StandardPlace> byPlaceId = new LinkedHashMap<>();
        for (StandardPlace place : places) {
            if (place == null || place.getPlaceId() == null) {
                continue;
            }
            StandardPlace existing = byPlaceId.get(place.getPlaceId());
            byPlaceId.put(place.getPlaceId(), existing == null ? place : combine(existing, place));
        }
        return new ArrayList<>(byPlaceId.values());
    }

    /**
     * 경로 검색 결과와 ping 결과를 합침
     * 경로 검색 쪽 필드가 우선이고, ping에서만 나온 장소는 뒤에 붙는다
     */
    public List<ConsolidatedPlace> consolidate(List<StandardPlace> routePlaces, List<StandardPlace> pingPlaces) {
        Map<String, Set<DiscoverySource>> sources = new LinkedHashMap<>();
        routePlaces.forEach(place -> record(sources, place, DiscoverySource.ROUTE));
        pingPlaces.forEach(place -> record(sources, place, DiscoverySource.PING));

        List<StandardPlace> all = new ArrayList<>(routePlaces);
        all.addAll(pingPlaces);
        return merge(all).stream()
                .map(place -> new ConsolidatedPlace(place, new ArrayList<>(sources.get(place.getPlaceId()))))
                .collect(Collectors.toList());
    }

    private static void record(Map<String, Set<DiscoverySource>> sources, StandardPlace place, DiscoverySource source) {
        if (place == null || place.getPlaceId() == null) {
            return;
        }
        sources.computeIfAbsent(place.getPlaceId(), id -> EnumSet.noneOf(DiscoverySource.class)).add(source);
    }

    private StandardPlace combine(StandardPlace first, StandardPlace other) {
        List<String> types = new ArrayList<>(first.getTypes());
        for (String type : other.getTypes()) {
            if (!types.contains(type)) {
                types.add(type);
            }
        }
        // 다른 태그가 합쳐졌다면 "unknown" 자리표시는 뺀다
        if (types.size() > 1) {
            types.remove(StandardPlace.UNKNOWN_TYPE);
        }

        return StandardPlace.builder()
                .placeId(first.getPlaceId())
                .name(first.getName())
                .primaryCategory(StandardPlace.UNKNOWN_TYPE.equals(first.getPrimaryCategory())
                        ? other.getPrimaryCategory()
                        : first.getPrimaryCategory())
                .types(types)
                .location(first.hasValidLocation() ? first.getLocation() : other.getLocation())
                .rating(max(first.getRating(), other.getRating()))
                .ratingCount(max(first.getRatingCount(), other.getRatingCount()))
                .priceLevel(first.getPriceLevel() != null ? first.getPriceLevel() : other.getPriceLevel())
                .address(first.getAddress() != null && !first.getAddress().isBlank() ? first.getAddress() : other.getAddress())
                .photos(first.getPhotos().isEmpty() ? other.getPhotos() : first.getPhotos())
                .attributions(first.getAttributions().isEmpty() ? other.getAttributions() : first.getAttributions())
                .website(first.getWebsite() != null ? first.getWebsite() : other.getWebsite())
                .phoneNumber(first.getPhoneNumber() != null ? first.getPhoneNumber() : other.getPhoneNumber())
                .openNow(first.getOpenNow() != null ? first.getOpenNow() : other.getOpenNow())
                .openingHours(first.getOpeningHours() != null ? first.getOpeningHours() : other.getOpeningHours())
                .editorialSummary(first.getEditorialSummary() != null ? first.getEditorialSummary() : other.getEditorialSummary())
                .reviewSnippets(first.getReviewSnippets() != null ? first.getReviewSnippets() : other.getReviewSnippets())
                .sourceSchema(first.getSourceSchema())
                .build();
    }

    private static <T extends Comparable<T>> T max(T a, T b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
