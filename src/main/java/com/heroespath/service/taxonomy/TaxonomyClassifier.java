package com.heroespath.service.taxonomy;

import com.heroespath.model.StandardPlace;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * 원시 타입 태그를 사용자용 카테고리로 분류하고 필터 일치 여부를 판정
 * 상태가 없는 순수 함수 모음
 */
@Component
public class TaxonomyClassifier {

    public static final String ALL_TYPES = "all";

    /**
     * primaryCategory, types 순서로 테이블을 찾고 없으면 UNKNOWN
     */
    public PlaceClassification classify(StandardPlace place) {
        if (place == null) {
            return PlaceClassification.UNKNOWN;
        }
        PlaceClassification byPrimary = classifyTag(place.getPrimaryCategory());
        if (byPrimary != null) {
            return byPrimary;
        }
        if (place.getTypes() != null) {
            for (String type : place.getTypes()) {
                PlaceClassification byType = classifyTag(type);
                if (byType != null) {
                    return byType;
                }
            }
        }
        return PlaceClassification.UNKNOWN;
    }

    /**
     * (a) 대표 타입이 허용 목록에 있거나
     * (b) types 중 하나가 허용 목록에 있고 복합 용도 장소가 아니면 true
     */
    public boolean matchesFilter(StandardPlace place, String filter) {
        if (filter == null || filter.isBlank() || ALL_TYPES.equals(filter)) {
            return true;
        }
        List<String> allowed = PlaceTaxonomy.allowedTagsFor(filter);
        if (allowed.contains(primaryOf(place))) {
            return true;
        }
        List<String> types = place.getTypes();
        boolean anyTypeAllowed = types != null && types.stream().anyMatch(allowed::contains);
        return anyTypeAllowed && !isMixedUse(place);
    }

    /**
     * 필터 중 하나라도 일치하면 true. 필터가 없으면 모두 통과
     */
    public boolean matchesAnyFilter(StandardPlace place, Collection<String> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        return filters.stream().anyMatch(filter -> matchesFilter(place, filter));
    }

    /**
     * 대표 타입이 복합 용도 목록에 있거나, 대표 타입과 다른 카테고리의 태그가 섞여 있으면 복합 용도
     */
    public boolean isMixedUse(StandardPlace place) {
        return PlaceTaxonomy.isMixedUsePrimaryType(primaryOf(place)) || hasCrossCategoryTags(place);
    }

    private boolean hasCrossCategoryTags(StandardPlace place) {
        List<String> types = place.getTypes();
        if (types == null || types.isEmpty()) {
            return false;
        }
        String homeCategory = PlaceTaxonomy.categoryOfTag(primaryOf(place));
        if (homeCategory == null) {
            // 대표 타입이 테이블에 없으면 처음으로 분류되는 태그의 카테고리를 기준으로 삼는다
            homeCategory = types.stream()
                    .map(PlaceTaxonomy::categoryOfTag)
                    .filter(c -> c != null)
                    .findFirst()
                    .orElse(null);
        }
        if (homeCategory == null) {
            return false;
        }
        for (String type : types) {
            String category = PlaceTaxonomy.categoryOfTag(type);
            if (category != null && !category.equals(homeCategory)) {
                return true;
            }
        }
        return false;
    }

    private String primaryOf(StandardPlace place) {
        if (place.getPrimaryCategory() != null && !place.getPrimaryCategory().isBlank()) {
            return place.getPrimaryCategory();
        }
        List<String> types = place.getTypes();
        return types == null || types.isEmpty() ? null : types.get(0);
    }

    private PlaceClassification classifyTag(String tag) {
        String subtype = PlaceTaxonomy.subtypeOfTag(tag);
        if (subtype == null) {
            return null;
        }
        return new PlaceClassification(PlaceTaxonomy.categoryOfSubtype(subtype), subtype);
    }
}
