package com.heroespath.dto.places;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Places API (New) place 객체
 * 필수: id, displayName.text
 * 나머지는 필드 마스크에 따라 빠질 수 있는 선택 필드
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CurrentPlacePayload {
    private String id;
    private LocalizedText displayName;
    private String primaryType;
    private List<String> types;
    private Location location;
    private Double rating;
    private Long userRatingCount;
    private String priceLevel; // "PRICE_LEVEL_MODERATE" 형식
    private String formattedAddress;
    private String shortFormattedAddress;
    private List<Photo> photos;
    private List<Attribution> attributions;
    private String websiteUri;
    private String nationalPhoneNumber;
    private String internationalPhoneNumber;
    private OpeningHours regularOpeningHours;
    private OpeningHours currentOpeningHours;
    private LocalizedText editorialSummary;
    private List<Review> reviews;

    /**
     * 스키마 필수 필드 검증. 위반 항목 목록을 돌려준다
     */
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (id == null || id.isBlank()) {
            violations.add("id is required");
        }
        if (displayName == null || displayName.getText() == null || displayName.getText().isBlank()) {
            violations.add("displayName.text is required");
        }
        return violations;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocalizedText {
        private String text;
        private String languageCode;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        private Double latitude;
        private Double longitude;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Photo {
        private String name; // places/PLACE_ID/photos/PHOTO_RESOURCE
        private Integer widthPx;
        private Integer heightPx;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attribution {
        private String provider;
        private String providerUri;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OpeningHours {
        private Boolean openNow;
        private List<String> weekdayDescriptions;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Review {
        private Integer rating;
        private LocalizedText text;
        private String publishTime;
    }
}
