package com.heroespath.dto.places;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 기존 Places API place 객체
 * 필수: place_id, name
 * 주소는 nearbysearch에서 vicinity, details에서 formatted_address로 온다
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyPlacePayload {
    @JsonProperty("place_id")
    private String placeId;
    private String name;
    private List<String> types;
    private Geometry geometry;
    private String vicinity;
    @JsonProperty("formatted_address")
    private String formattedAddress;
    private Double rating;
    @JsonProperty("user_ratings_total")
    private Long userRatingsTotal;
    @JsonProperty("price_level")
    private Integer priceLevel;
    private List<Photo> photos;
    @JsonProperty("html_attributions")
    private List<String> htmlAttributions;
    private String website;
    @JsonProperty("formatted_phone_number")
    private String formattedPhoneNumber;
    @JsonProperty("opening_hours")
    private OpeningHours openingHours;
    @JsonProperty("editorial_summary")
    private EditorialSummary editorialSummary;
    private List<Review> reviews;

    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (placeId == null || placeId.isBlank()) {
            violations.add("place_id is required");
        }
        if (name == null || name.isBlank()) {
            violations.add("name is required");
        }
        return violations;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geometry {
        private LatLng location;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class LatLng {
            private Double lat;
            private Double lng;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Photo {
        @JsonProperty("photo_reference")
        private String photoReference;
        private Integer width;
        private Integer height;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpeningHours {
        @JsonProperty("open_now")
        private Boolean openNow;
        @JsonProperty("weekday_text")
        private List<String> weekdayText;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EditorialSummary {
        private String overview;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Review {
        private Integer rating;
        private String text;
        private Long time;
    }
}
