package com.heroespath.service.discovery;

import com.heroespath.model.GeoPoint;
import com.heroespath.model.RouteSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 경로 샘플에서 검색 지점 선택
 * 짧은 경로는 경계 원 하나, 긴 경로는 경로를 따라 일정 간격으로 샘플링
 */
@Slf4j
@Component
public class RouteSampler {

    static final double METERS_PER_DEGREE = 111_139;
    static final int MIN_RADIUS_METERS = 25;
    static final int MAX_RADIUS_METERS = 50_000;
    private static final double EARTH_RADIUS_METERS = 6_371_000;

    private final int radiusMeters;
    private final int spacingMeters;
    private final int maxPoints;

    public RouteSampler(@Value("${discovery.search.radius-meters:500}") int radiusMeters,
                        @Value("${discovery.search.spacing-meters:400}") int spacingMeters,
                        @Value("${discovery.search.max-points:8}") int maxPoints) {
        this.radiusMeters = radiusMeters;
        this.spacingMeters = spacingMeters;
        this.maxPoints = Math.max(1, maxPoints);
    }

    public List<SearchCircle> coverage(List<RouteSample> samples) {
        List<GeoPoint> points = samples == null ? List.of() : samples.stream()
                .map(RouteSample::toPoint)
                .filter(GeoPoint::isValid)
                .collect(Collectors.toList());
        if (points.isEmpty()) {
            return List.of();
        }

        SearchCircle bounding = boundingCircle(points);
        if (bounding.getRadiusMeters() <= radiusMeters) {
            return List.of(bounding);
        }

        List<SearchCircle> circles = sampleAlongPath(points).stream()
                .map(point -> new SearchCircle(point, radiusMeters))
                .collect(Collectors.toList());
        log.debug("[RouteSampler] coverage - samples: {}, boundingRadius: {}m, searchPoints: {}",
                points.size(), bounding.getRadiusMeters(), circles.size());
        return circles;
    }

    /**
     * 위경도 경계 상자의 중심, 반경은 대각선의 절반 ([25m, 50km]로 제한)
     */
    static SearchCircle boundingCircle(List<GeoPoint> points) {
        double minLat = Double.MAX_VALUE;
        double maxLat = -Double.MAX_VALUE;
        double minLng = Double.MAX_VALUE;
        double maxLng = -Double.MAX_VALUE;
        for (GeoPoint point : points) {
            minLat = Math.min(minLat, point.getLat());
            maxLat = Math.max(maxLat, point.getLat());
            minLng = Math.min(minLng, point.getLng());
            maxLng = Math.max(maxLng, point.getLng());
        }

        double centerLat = (minLat + maxLat) / 2;
        double centerLng = (minLng + maxLng) / 2;
        double latMeters = (maxLat - minLat) * METERS_PER_DEGREE;
        double lngMeters = (maxLng - minLng) * METERS_PER_DEGREE * Math.cos(Math.toRadians(centerLat));

        int radius = (int) Math.ceil(Math.hypot(latMeters, lngMeters) / 2);
        radius = Math.min(Math.max(radius, MIN_RADIUS_METERS), MAX_RADIUS_METERS);
        return new SearchCircle(new GeoPoint(centerLat, centerLng), radius);
    }

    private List<GeoPoint> sampleAlongPath(List<GeoPoint> points) {
        List<GeoPoint> sampled = new ArrayList<>();
        sampled.add(points.get(0));
        double sinceLast = 0;
        for (int i = 1; i < points.size(); i++) {
            sinceLast += distanceMeters(points.get(i - 1), points.get(i));
            if (sinceLast >= spacingMeters) {
                sampled.add(points.get(i));
                sinceLast = 0;
            }
        }
        GeoPoint last = points.get(points.size() - 1);
        if (sampled.get(sampled.size() - 1) != last) {
            sampled.add(last);
        }

        if (sampled.size() <= maxPoints) {
            return sampled;
        }
        // 처음과 끝을 유지하며 균등하게 줄임
        List<GeoPoint> reduced = new ArrayList<>();
        if (maxPoints == 1) {
            reduced.add(sampled.get(sampled.size() / 2));
            return reduced;
        }
        for (int i = 0; i < maxPoints; i++) {
            int index = (int) Math.round(i * (sampled.size() - 1) / (double) (maxPoints - 1));
            reduced.add(sampled.get(index));
        }
        return reduced;
    }

    /**
     * haversine 거리 (미터)
     */
    static double distanceMeters(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.getLat() - a.getLat());
        double dLng = Math.toRadians(b.getLng() - a.getLng());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.getLat())) * Math.cos(Math.toRadians(b.getLat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(h));
    }
}
