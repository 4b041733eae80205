package com.heroespath.dto.places;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Google Places API (New) searchNearby 응답
 * 결과가 없으면 places 필드 자체가 빠진다
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CurrentPlacesResponse {
    private List<CurrentPlacePayload> places;
}
