package com.heroespath.service.places;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 불투명 photo reference로 이미지 URL 생성
 * 신규 API reference는 "places/"로 시작하는 리소스 이름
 */
@Component
public class PlacePhotoUrls {

    private final String currentBaseUrl;
    private final String legacyBaseUrl;
    private final String apiKey;

    public PlacePhotoUrls(@Value("${google.places.new.base-url:https://places.googleapis.com/v1}") String currentBaseUrl,
                          @Value("${google.places.legacy.base-url:https://maps.googleapis.com/maps/api/place}") String legacyBaseUrl,
                          @Value("${google.places.api.key:}") String apiKey) {
        this.currentBaseUrl = currentBaseUrl;
        this.legacyBaseUrl = legacyBaseUrl;
        this.apiKey = apiKey;
    }

    public String photoUrl(String photoReference, int maxWidth) {
        if (photoReference == null || photoReference.isEmpty()) {
            return null;
        }
        if (photoReference.startsWith("places/")) {
            return String.format("%s/%s/media?maxHeightPx=%d&maxWidthPx=%d&key=%s",
                    currentBaseUrl, photoReference, maxWidth, maxWidth, apiKey);
        }
        return String.format("%s/photo?maxwidth=%d&photoreference=%s&key=%s",
                legacyBaseUrl, maxWidth, photoReference, apiKey);
    }
}
