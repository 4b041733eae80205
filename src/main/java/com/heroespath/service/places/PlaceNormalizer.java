package com.heroespath.service.places;

import com.heroespath.dto.places.CurrentPlacePayload;
import com.heroespath.dto.places.LegacyPlacePayload;
import com.heroespath.dto.places.PlaceSchema;
import com.heroespath.model.GeoPoint;
import com.heroespath.model.StandardPlace;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 검증을 통과한 세대별 payload를 StandardPlace로 변환
 * 없는 선택 필드는 기본값으로 채우지 않는다
 */
@Component
public class PlaceNormalizer {

    private static final Map<String, Integer> PRICE_LEVELS = Map.of(
            "PRICE_LEVEL_FREE", 0,
            "PRICE_LEVEL_INEXPENSIVE", 1,
            "PRICE_LEVEL_MODERATE", 2,
            "PRICE_LEVEL_EXPENSIVE", 3,
            "PRICE_LEVEL_VERY_EXPENSIVE", 4
    );

    public StandardPlace fromCurrent(CurrentPlacePayload payload) {
        List<String> types = normalizeTypes(payload.getTypes(), payload.getPrimaryType());
        String primary = hasText(payload.getPrimaryType()) ? payload.getPrimaryType() : types.get(0);

        GeoPoint location = null;
        if (payload.getLocation() != null) {
            location = new GeoPoint(payload.getLocation().getLatitude(), payload.getLocation().getLongitude());
        }

        CurrentPlacePayload.OpeningHours hours = payload.getCurrentOpeningHours() != null
                ? payload.getCurrentOpeningHours()
                : payload.getRegularOpeningHours();

        return StandardPlace.builder()
                .placeId(payload.getId())
                .name(payload.getDisplayName().getText())
                .primaryCategory(primary)
                .types(types)
                .location(location)
                .rating(payload.getRating())
                .ratingCount(payload.getUserRatingCount())
                .priceLevel(payload.getPriceLevel() != null ? PRICE_LEVELS.get(payload.getPriceLevel()) : null)
                .address(hasText(payload.getFormattedAddress())
                        ? payload.getFormattedAddress()
                        : payload.getShortFormattedAddress())
                .photos(payload.getPhotos() == null ? new ArrayList<>() : payload.getPhotos().stream()
                        .map(CurrentPlacePayload.Photo::getName)
                        .filter(this::hasText)
                        .collect(Collectors.toList()))
                .attributions(payload.getAttributions() == null ? new ArrayList<>() : payload.getAttributions().stream()
                        .map(CurrentPlacePayload.Attribution::getProvider)
                        .filter(this::hasText)
                        .collect(Collectors.toList()))
                .website(payload.getWebsiteUri())
                .phoneNumber(hasText(payload.getNationalPhoneNumber())
                        ? payload.getNationalPhoneNumber()
                        : payload.getInternationalPhoneNumber())
                .openNow(hours != null ? hours.getOpenNow() : null)
                .openingHours(hours != null ? hours.getWeekdayDescriptions() : null)
                .editorialSummary(payload.getEditorialSummary() != null ? payload.getEditorialSummary().getText() : null)
                .reviewSnippets(payload.getReviews() == null ? null : payload.getReviews().stream()
                        .map(CurrentPlacePayload.Review::getText)
                        .filter(text -> text != null && hasText(text.getText()))
                        .map(CurrentPlacePayload.LocalizedText::getText)
                        .collect(Collectors.toList()))
                .sourceSchema(PlaceSchema.CURRENT_V1.getVersion())
                .build();
    }

    public StandardPlace fromLegacy(LegacyPlacePayload payload) {
        // 기존 API는 대표 타입이 따로 없으므로 types[0]을 사용
        List<String> types = normalizeTypes(payload.getTypes(), null);

        GeoPoint location = null;
        if (payload.getGeometry() != null && payload.getGeometry().getLocation() != null) {
            location = new GeoPoint(payload.getGeometry().getLocation().getLat(),
                    payload.getGeometry().getLocation().getLng());
        }

        LegacyPlacePayload.OpeningHours hours = payload.getOpeningHours();

        return StandardPlace.builder()
                .placeId(payload.getPlaceId())
                .name(payload.getName())
                .primaryCategory(types.get(0))
                .types(types)
                .location(location)
                .rating(payload.getRating())
                .ratingCount(payload.getUserRatingsTotal())
                .priceLevel(payload.getPriceLevel())
                .address(hasText(payload.getVicinity()) ? payload.getVicinity() : payload.getFormattedAddress())
                .photos(payload.getPhotos() == null ? new ArrayList<>() : payload.getPhotos().stream()
                        .map(LegacyPlacePayload.Photo::getPhotoReference)
                        .filter(this::hasText)
                        .collect(Collectors.toList()))
                .attributions(payload.getHtmlAttributions() == null
                        ? new ArrayList<>()
                        : new ArrayList<>(payload.getHtmlAttributions()))
                .website(payload.getWebsite())
                .phoneNumber(payload.getFormattedPhoneNumber())
                .openNow(hours != null ? hours.getOpenNow() : null)
                .openingHours(hours != null ? hours.getWeekdayText() : null)
                .editorialSummary(payload.getEditorialSummary() != null
                        ? payload.getEditorialSummary().getOverview()
                        : null)
                .reviewSnippets(payload.getReviews() == null ? null : payload.getReviews().stream()
                        .map(LegacyPlacePayload.Review::getText)
                        .filter(this::hasText)
                        .collect(Collectors.toList()))
                .sourceSchema(PlaceSchema.LEGACY.getVersion())
                .build();
    }

    /**
     * types는 비어 있지 않아야 한다
     * 목록이 없으면 대표 타입, 그것도 없으면 "unknown"
     */
    private List<String> normalizeTypes(List<String> types, String primaryType) {
        List<String> result = new ArrayList<>();
        if (types != null) {
            for (String type : types) {
                if (hasText(type) && !result.contains(type)) {
                    result.add(type);
                }
            }
        }
        if (result.isEmpty()) {
            result.add(hasText(primaryType) ? primaryType : StandardPlace.UNKNOWN_TYPE);
        }
        return result;
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
