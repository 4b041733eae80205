package com.heroespath.dto.places;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 기존 Places API 응답 (nearbysearch는 results, details는 result)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyPlacesResponse {
    public static final String STATUS_OK = "OK";
    public static final String STATUS_ZERO_RESULTS = "ZERO_RESULTS";

    private String status;
    private List<LegacyPlacePayload> results;
    private LegacyPlacePayload result;
    @JsonProperty("error_message")
    private String errorMessage;

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }

    public boolean isZeroResults() {
        return STATUS_ZERO_RESULTS.equals(status);
    }
}
