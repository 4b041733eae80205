package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 경로 공급자가 넘겨주는 GPS 샘플 한 개
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteSample {
    private double lat;
    private double lng;
    private Long timestamp; // epoch millis, 없을 수 있음

    public GeoPoint toPoint() {
        return new GeoPoint(lat, lng);
    }
}
