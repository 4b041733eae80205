package com.heroespath.controller;

import com.heroespath.dto.response.PlaceDetailsResponse;
import com.heroespath.model.StandardPlace;
import com.heroespath.service.places.ConnectivityReport;
import com.heroespath.service.places.PlacesResolver;
import com.heroespath.service.taxonomy.PlaceClassification;
import com.heroespath.service.taxonomy.TaxonomyClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 장소 상세 조회 REST API (resolver 직접 호출, 저장하지 않음)
 */
@RestController
@RequestMapping("/api/places")
@RequiredArgsConstructor
public class PlaceController {

    private static final int PHOTO_MAX_WIDTH = 800;

    private final PlacesResolver placesResolver;
    private final TaxonomyClassifier classifier;

    /**
     * GET /api/places/{placeId}?language=en
     * 두 세대 모두 실패하면 503
     */
    @GetMapping("/{placeId}")
    public ResponseEntity<PlaceDetailsResponse> details(@PathVariable String placeId,
                                                        @RequestParam(defaultValue = "en") String language) {
        StandardPlace place = placesResolver.resolveDetails(placeId, language);
        PlaceClassification classification = classifier.classify(place);
        List<String> photoUrls = place.getPhotos().stream()
                .map(reference -> placesResolver.buildPhotoUrl(reference, PHOTO_MAX_WIDTH))
                .collect(Collectors.toList());
        return ResponseEntity.ok(new PlaceDetailsResponse(
                place, classification.getCategory(), classification.getSubtype(), photoUrls));
    }

    @GetMapping("/connectivity")
    public ResponseEntity<ConnectivityReport> connectivity() {
        return ResponseEntity.ok(placesResolver.checkConnectivity());
    }
}
