package com.heroespath.service.places;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heroespath.dto.places.LegacyPlacePayload;
import com.heroespath.dto.places.LegacyPlacesResponse;
import com.heroespath.model.StandardPlace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * 기존 Google Places API (nearbysearch/json, details/json)
 * HTTP 200이어도 status 필드가 OK/ZERO_RESULTS가 아니면 실패로 본다
 */
@Slf4j
@Component
public class LegacyGenerationPlacesLookup implements PlacesLookupStrategy {

    public static final String GENERATION = "legacy";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PlaceNormalizer normalizer;
    private final String baseUrl;
    private final String apiKey;

    public LegacyGenerationPlacesLookup(RestTemplate placesRestTemplate,
                                        ObjectMapper objectMapper,
                                        PlaceNormalizer normalizer,
                                        @Value("${google.places.legacy.base-url:https://maps.googleapis.com/maps/api/place}") String baseUrl,
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

        UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/nearbysearch/json")
                .queryParam("location", query.getCenter().getLat() + "," + query.getCenter().getLng())
                .queryParam("radius", query.getRadiusMeters())
                .queryParam("language", query.getLanguage());
        if (query.hasTypeRestriction()) {
            uriBuilder.queryParam("type", query.getType());
        }
        uriBuilder.queryParam("key", apiKey);

        LookupResult<LegacyPlacesResponse> fetched = fetch(uriBuilder.toUriString());
        if (!fetched.isSuccess()) {
            return LookupResult.failure(GENERATION, fetched.getError());
        }
        LegacyPlacesResponse body = fetched.getValue();
        if (body.isZeroResults()) {
            return LookupResult.success(GENERATION, new ArrayList<>());
        }
        if (body.getResults() == null) {
            return LookupResult.failure(GENERATION, "empty body: no results field");
        }

        List<StandardPlace> places = new ArrayList<>();
        for (LegacyPlacePayload payload : body.getResults()) {
            List<String> violations = payload.violations();
            if (!violations.isEmpty()) {
                log.warn("[LegacyGenerationPlacesLookup] dropping invalid place - place_id: {}, violations: {}",
                        payload.getPlaceId(), violations);
                continue;
            }
            places.add(normalizer.fromLegacy(payload));
            if (places.size() >= query.getMaxResults()) {
                break;
            }
        }
        if (places.isEmpty() && !body.getResults().isEmpty()) {
            return LookupResult.failure(GENERATION, "malformed body: no valid places");
        }
        return LookupResult.success(GENERATION, places);
    }

    @Override
    public LookupResult<StandardPlace> details(String placeId, String language, FieldProfile profile) {
        if (apiKey == null || apiKey.isEmpty()) {
            return LookupResult.failure(GENERATION, "api key is not set");
        }

        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/details/json")
                .queryParam("place_id", placeId)
                .queryParam("fields", profile.legacyFields())
                .queryParam("language", language)
                .queryParam("key", apiKey)
                .toUriString();

        LookupResult<LegacyPlacesResponse> fetched = fetch(url);
        if (!fetched.isSuccess()) {
            return LookupResult.failure(GENERATION, fetched.getError());
        }
        LegacyPlacePayload result = fetched.getValue().getResult();
        if (result == null) {
            return LookupResult.failure(GENERATION, "empty body: no result field");
        }
        List<String> violations = result.violations();
        if (!violations.isEmpty()) {
            return LookupResult.failure(GENERATION, "malformed body: " + violations);
        }
        return LookupResult.success(GENERATION, normalizer.fromLegacy(result));
    }

    private LookupResult<LegacyPlacesResponse> fetch(String url) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return LookupResult.failure(GENERATION, "status " + response.getStatusCode().value());
            }
            if (response.getBody() == null || response.getBody().isBlank()) {
                return LookupResult.failure(GENERATION, "empty body");
            }
            LegacyPlacesResponse body = objectMapper.readValue(response.getBody(), LegacyPlacesResponse.class);
            if (!body.isOk() && !body.isZeroResults()) {
                String detail = body.getErrorMessage() != null ? " (" + body.getErrorMessage() + ")" : "";
                return LookupResult.failure(GENERATION, "api status " + body.getStatus() + detail);
            }
            return LookupResult.success(GENERATION, body);
        } catch (JsonProcessingException e) {
            return LookupResult.failure(GENERATION, "malformed body: " + e.getOriginalMessage());
        } catch (RestClientException e) {
            return LookupResult.failure(GENERATION, "transport: " + e.getMessage());
        }
    }
}
