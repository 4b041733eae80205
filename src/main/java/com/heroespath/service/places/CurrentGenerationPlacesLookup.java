package com.heroespath.service.places;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroespath.dto.places.CurrentNearbyRequest;
import com.heroespath.dto.places.CurrentPlacePayload;
import com.heroespath.dto.places.CurrentPlacesResponse;
import com.heroespath.model.StandardPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Places API (New, v1)
 * searchNearby(POST)와 place details(GET), 필드는 X-Goog-FieldMask 헤더로 지정
 */
@Slf4j
@Component
public class CurrentGenerationPlacesLookup implements PlacesLookupStrategy {

    public static final String GENERATION = "current";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PlaceNormalizer normalizer;
    private final String baseUrl;
    private final String apiKey;

    public CurrentGenerationPlacesLookup(RestTemplate placesRestTemplate,
                                         ObjectMapper objectMapper,
                                         PlaceNormalizer normalizer,
                                         @Value("${google.places.new.base-url:https://places.googleapis.com/v1}") String baseUrl,
                                         @Value("${google.places.api.key:}") String apiKey) {
        this.restTemplate = placesRestTemplate;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public String generation() {
        return GENERATION;
    }

    @Override
    public LookupResult<List<StandardPlace>> nearby(NearbyQuery query) {
        if (apiKey == null || apiKey.isEmpty()) {
            return LookupResult.failure(GENERATION, "api key is not set");
        }

        CurrentNearbyRequest request = CurrentNearbyRequest.of(
                query.getCenter().getLat(),
                query.getCenter().getLng(),
                query.getRadiusMeters(),
                query.hasTypeRestriction() ? List.of(query.getType()) : null,
                Math.max(1, Math.min(query.getMaxResults(), 20)), // v1 허용 범위 1-20
                query.getLanguage());

        HttpEntity<CurrentNearbyRequest> entity = new HttpEntity<>(request, headers(query.getProfile().currentFieldMask(true)));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    baseUrl + "/places:searchNearby", HttpMethod.POST, entity, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return LookupResult.failure(GENERATION, "status " + response.getStatusCode().value());
            }
            if (response.getBody() == null || response.getBody().isBlank()) {
                return LookupResult.failure(GENERATION, "empty body");
            }

            CurrentPlacesResponse body = objectMapper.readValue(response.getBody(), CurrentPlacesResponse.class);
            if (body.getPlaces() == null) {
                return LookupResult.emptyAnswer(GENERATION, List.of(), "empty body: no places field");
            }

            List<StandardPlace> places = new ArrayList<>();
            for (CurrentPlacePayload payload : body.getPlaces()) {
                List<String> violations = payload.violations();
                if (!violations.isEmpty()) {
                    log.warn("[CurrentGenerationPlacesLookup] dropping invalid place - id: {}, violations: {}",
                            payload.getId(), violations);
                    continue;
                }
                places.add(normalizer.fromCurrent(payload));
            }
            if (places.isEmpty() && !body.getPlaces().isEmpty()) {
                return LookupResult.failure(GENERATION, "malformed body: no valid places");
            }
            return LookupResult.success(GENERATION, places);
        } catch (JsonProcessingException e) {
            return LookupResult.failure(GENERATION, "malformed body: " + e.getOriginalMessage());
        } catch (RestClientException e) {
            return LookupResult.failure(GENERATION, "transport: " + e.getMessage());
        }
    }

    @Override
    public LookupResult<StandardPlace> details(String placeId, String language, FieldProfile profile) {
        if (apiKey == null || apiKey.isEmpty()) {
            return LookupResult.failure(GENERATION, "api key is not set");
        }

        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/places/{placeId}")
                .queryParam("languageCode", language)
                .buildAndExpand(placeId)
                .toUriString();

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers(profile.currentFieldMask(false))), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return LookupResult.failure(GENERATION, "status " + response.getStatusCode().value());
            }
            if (response.getBody() == null || response.getBody().isBlank()) {
                return LookupResult.failure(GENERATION, "empty body");
            }

            CurrentPlacePayload payload = objectMapper.readValue(response.getBody(), CurrentPlacePayload.class);
            List<String> violations = payload.violations();
            if (!violations.isEmpty()) {
                return LookupResult.failure(GENERATION, "malformed body: " + violations);
            }
            return LookupResult.success(GENERATION, normalizer.fromCurrent(payload));
        } catch (JsonProcessingException e) {
            return LookupResult.failure(GENERATION, "malformed body: " + e.getOriginalMessage());
        } catch (RestClientException e) {
            return LookupResult.failure(GENERATION, "transport: " + e.getMessage());
        }
    }

    private HttpHeaders headers(String fieldMask) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Goog-Api-Key", apiKey);
        headers.set("X-Goog-FieldMask", fieldMask);
        return headers;
    }
}
