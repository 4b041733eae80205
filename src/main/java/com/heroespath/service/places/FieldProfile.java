package com.heroespath.service.places;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 이름이 붙은 응답 필드 부분집합
 * 요청 형태를 각 API의 파라미터 문법과 분리하고, 응답 용량과 과금을 줄인다
 */
public enum FieldProfile {
    SEARCH_BASIC("search-basic",
            List.of("id", "displayName", "location", "types", "primaryType"),
            List.of("place_id", "name", "geometry", "types")),
    SEARCH_STANDARD("search-standard",
            List.of("rating", "userRatingCount", "priceLevel", "photos", "formattedAddress",
                    "shortFormattedAddress", "attributions"),
            List.of("rating", "user_ratings_total", "price_level", "photos", "vicinity", "formatted_address")),
    DETAILS_FULL("details-full",
            List.of("regularOpeningHours", "currentOpeningHours", "websiteUri", "nationalPhoneNumber",
                    "internationalPhoneNumber", "editorialSummary", "reviews"),
            List.of("opening_hours", "website", "formatted_phone_number", "editorial_summary", "reviews"));

    private final String profileName;
    private final List<String> currentFields;
    private final List<String> legacyFields;

    FieldProfile(String profileName, List<String> currentFields, List<String> legacyFields) {
        this.profileName = profileName;
        this.currentFields = currentFields;
        this.legacyFields = legacyFields;
    }

    public String getProfileName() {
        return profileName;
    }

    /**
     * 상위 프로필은 하위 프로필 필드를 모두 포함한다 (basic < standard < full)
     */
    private List<FieldProfile> included() {
        return Arrays.asList(values()).subList(0, ordinal() + 1);
    }

    /**
     * 신규 API X-Goog-FieldMask 값
     * @param searchResponse searchNearby 응답이면 "places." 접두어를 붙임
     */
    public String currentFieldMask(boolean searchResponse) {
        List<String> fields = new ArrayList<>();
        included().forEach(p -> fields.addAll(p.currentFields));
        String prefix = searchResponse ? "places." : "";
        return fields.stream().map(f -> prefix + f).collect(Collectors.joining(","));
    }

    /**
     * 기존 API details의 fields 파라미터 값
     */
    public String legacyFields() {
        List<String> fields = new ArrayList<>();
        included().forEach(p -> fields.addAll(p.legacyFields));
        return String.join(",", fields);
    }

    public static FieldProfile fromName(String name) {
        for (FieldProfile profile : values()) {
            if (profile.profileName.equals(name) || profile.name().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown field profile: " + name);
    }
}
