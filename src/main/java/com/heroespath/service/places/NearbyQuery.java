package com.heroespath.service.places;

import com.heroespath.model.GeoPoint;
import lombok.Builder;
import lombok.Value;

/**
 * API 세대와 무관한 주변 검색 질의
 */
@Value
@Builder
public class NearbyQuery {
    GeoPoint center;
    int radiusMeters;
    String type; // null이면 타입 제한 없음
    @Builder.Default
    FieldProfile profile = FieldProfile.SEARCH_BASIC;
    @Builder.Default
    int maxResults = 20;
    @Builder.Default
    String language = "en";

    public boolean hasTypeRestriction() {
        return type != null && !type.isBlank() && !"all".equals(type) && !"point_of_interest".equals(type);
    }
}
