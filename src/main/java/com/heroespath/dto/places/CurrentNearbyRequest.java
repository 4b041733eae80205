package com.heroespath.dto.places;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Google Places API (New) searchNearby 요청 본문
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CurrentNearbyRequest {
    private List<String> includedTypes;
    private Integer maxResultCount;
    private LocationRestriction locationRestriction;
    private String languageCode;
    private String rankPreference; // "POPULARITY" or "DISTANCE"

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LocationRestriction {
        private Circle circle;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Circle {
            private Center center;
            private Double radius;

            @Data
            @NoArgsConstructor
            @AllArgsConstructor
            public static class Center {
                private Double latitude;
                private Double longitude;
            }
        }
    }

    public static CurrentNearbyRequest of(double latitude, double longitude, double radius,
                                          List<String> includedTypes, int maxResultCount, String languageCode) {
        LocationRestriction.Circle.Center center = new LocationRestriction.Circle.Center(latitude, longitude);
        LocationRestriction restriction = new LocationRestriction(new LocationRestriction.Circle(center, radius));
        return new CurrentNearbyRequest(includedTypes, maxResultCount, restriction, languageCode, "POPULARITY");
    }
}
