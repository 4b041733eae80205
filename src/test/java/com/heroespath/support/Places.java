package com.heroespath.support;

import com.heroespath.model.GeoPoint;
import com.heroespath.model.RouteSample;
import com.heroespath.model.StandardPlace;

import java.util.ArrayList;
import java.util.List;

/**
 * 테스트 장소/경로 생성
 */
public final class Places {

    private Places() {
    }

    /**
     * 대표 타입 없이 types만 주면 types[0]이 대표 타입
     */
    public static StandardPlace place(String placeId, String... types) {
        return StandardPlace.builder()
                .placeId(placeId)
                .name("Place " + placeId)
                .primaryCategory(types[0])
                .types(new ArrayList<>(List.of(types)))
                .location(new GeoPoint(37.5665, 126.9780))
                .rating(4.2)
                .ratingCount(120L)
                .build();
    }

    public static StandardPlace withoutLocation(String placeId, String... types) {
        StandardPlace place = place(placeId, types);
        place.setLocation(null);
        return place;
    }

    /**
     * 약 100m 길이의 짧은 경로
     */
    public static List<RouteSample> shortWalk() {
        return List.of(
                new RouteSample(37.5665, 126.9780, 1_700_000_000_000L),
                new RouteSample(37.5670, 126.9785, 1_700_000_060_000L),
                new RouteSample(37.5673, 126.9790, 1_700_000_120_000L));
    }
}
