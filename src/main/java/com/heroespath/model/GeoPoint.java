package com.heroespath.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 위도/경도 좌표
 * 값이 비어 있을 수 있으므로 박싱 타입을 사용
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeoPoint {
    private Double lat;
    private Double lng;

    /**
     * 두 좌표 모두 유한한 숫자인지 확인
     */
    @JsonIgnore
    public boolean isValid() {
        return lat != null && lng != null
                && !lat.isNaN() && !lng.isNaN()
                && !lat.isInfinite() && !lng.isInfinite();
    }
}
