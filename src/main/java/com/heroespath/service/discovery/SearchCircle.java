package com.heroespath.service.discovery;

import com.heroespath.model.GeoPoint;
import lombok.Value;

/**
 * 주변 검색 한 번의 중심과 반경
 */
@Value
public class SearchCircle {
    GeoPoint center;
    int radiusMeters;
}
