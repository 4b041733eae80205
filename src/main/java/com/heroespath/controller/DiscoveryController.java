package com.heroespath.controller;

import com.heroespath.dto.request.DiscoverRouteRequest;
import com.heroespath.dto.request.DismissRequest;
import com.heroespath.dto.request.SettingsRequest;
import com.heroespath.dto.request.SummaryRequest;
import com.heroespath.dto.response.DiscoveryResponse;
import com.heroespath.dto.response.ReviewResponse;
import com.heroespath.dto.response.RouteDiscoveryResponse;
import com.heroespath.dto.response.RouteSetResponse;
import com.heroespath.model.ConsolidationStats;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStats;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.RouteDiscoverySet;
import com.heroespath.model.RouteReviewProgress;
import com.heroespath.service.discovery.DiscoveryOrchestrator;
import com.heroespath.service.discovery.DiscoveryResult;
import com.heroespath.service.review.DiscoveryLibraryService;
import com.heroespath.service.review.ReviewStateMachine;
import com.heroespath.service.settings.UserSettingsService;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.service.store.StoreResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 경로 탐색, 검토, 사용자 discovery 목록 REST API
 * 사용자 식별은 X-User-Id 헤더 (인증은 앞단에서 처리)
 */
@RestController
@RequestMapping("/api/discoveries")
@RequiredArgsConstructor
public class DiscoveryController {

    private static final String USER_HEADER = "X-User-Id";

    private final DiscoveryOrchestrator discoveryOrchestrator;
    private final ReviewStateMachine reviewStateMachine;
    private final DiscoveryLibraryService libraryService;
    private final DiscoveryStoreAdapter storeAdapter;
    private final UserSettingsService settingsService;

    /**
     * POST /api/discoveries/routes/{routeId}/discover
     * 이미 탐색한 경로면 저장된 미검토 목록을 돌려준다
     */
    @PostMapping("/routes/{routeId}/discover")
    public ResponseEntity<RouteDiscoveryResponse> discover(@RequestHeader(USER_HEADER) String userId,
                                                           @PathVariable String routeId,
                                                           @RequestBody DiscoverRouteRequest request) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        DiscoveryResult result = discoveryOrchestrator.discoverForRoute(
                ctx, routeId, request.getCoords(), request.getTypeFilters(), request.getLanguage());
        return ResponseEntity.ok(RouteDiscoveryResponse.from(result));
    }

    @GetMapping("/routes/{routeId}")
    public ResponseEntity<RouteSetResponse> routeDiscoveries(@RequestHeader(USER_HEADER) String userId,
                                                             @PathVariable String routeId) {
        StoreResult<RouteDiscoverySet> set = storeAdapter.loadRouteDiscoveries(userId, routeId);
        List<DiscoveryResponse> discoveries = set.getValue().getDiscoveries().stream()
                .map(DiscoveryResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new RouteSetResponse(routeId, discoveries, set.getValue().progress(), set.isDegraded()));
    }

    @GetMapping("/routes/{routeId}/progress")
    public ResponseEntity<RouteReviewProgress> progress(@RequestHeader(USER_HEADER) String userId,
                                                        @PathVariable String routeId) {
        return ResponseEntity.ok(libraryService.progress(userId, routeId));
    }

    @GetMapping("/routes/{routeId}/consolidation")
    public ResponseEntity<ConsolidationStats> consolidation(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String routeId) {
        return ResponseEntity.ok(libraryService.consolidationStats(userId, routeId));
    }

    @PostMapping("/routes/{routeId}/places/{placeId}/save")
    public ResponseEntity<ReviewResponse> save(@RequestHeader(USER_HEADER) String userId,
                                               @PathVariable String routeId,
                                               @PathVariable String placeId) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        return ResponseEntity.ok(ReviewResponse.from(reviewStateMachine.save(ctx, routeId, placeId)));
    }

    /**
     * 기간이 없고 정책이 ASK면 outcome=DURATION_REQUIRED (상태 변경 없음)
     */
    @PostMapping("/routes/{routeId}/places/{placeId}/dismiss")
    public ResponseEntity<ReviewResponse> dismiss(@RequestHeader(USER_HEADER) String userId,
                                                  @PathVariable String routeId,
                                                  @PathVariable String placeId,
                                                  @RequestBody(required = false) DismissRequest request) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        return ResponseEntity.ok(ReviewResponse.from(reviewStateMachine.dismiss(
                ctx, routeId, placeId, request != null ? request.getDuration() : null)));
    }

    @PostMapping("/routes/{routeId}/places/{placeId}/undo-save")
    public ResponseEntity<ReviewResponse> undoSave(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable String routeId,
                                                   @PathVariable String placeId) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        return ResponseEntity.ok(ReviewResponse.from(reviewStateMachine.undoSave(ctx, routeId, placeId)));
    }

    @PostMapping("/routes/{routeId}/places/{placeId}/undo-dismiss")
    public ResponseEntity<ReviewResponse> undoDismiss(@RequestHeader(USER_HEADER) String userId,
                                                      @PathVariable String routeId,
                                                      @PathVariable String placeId) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        return ResponseEntity.ok(ReviewResponse.from(reviewStateMachine.undoDismiss(ctx, routeId, placeId)));
    }

    /**
     * GET /api/discoveries?status=SAVED
     */
    @GetMapping
    public ResponseEntity<List<DiscoveryResponse>> byStatus(@RequestHeader(USER_HEADER) String userId,
                                                            @RequestParam(defaultValue = "SAVED") DiscoveryStatus status) {
        List<DiscoveryResponse> discoveries = libraryService.listByStatus(userId, status).getValue().stream()
                .map(DiscoveryResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(discoveries);
    }

    @GetMapping("/stats")
    public ResponseEntity<DiscoveryStats> stats(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(libraryService.stats(userId));
    }

    @PostMapping("/{discoveryId}/summary-request")
    public ResponseEntity<DiscoveryResponse> requestSummary(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String discoveryId) {
        return ResponseEntity.ok(DiscoveryResponse.from(libraryService.requestSummary(userId, discoveryId)));
    }

    @PutMapping("/{discoveryId}/summary")
    public ResponseEntity<DiscoveryResponse> attachSummary(@RequestHeader(USER_HEADER) String userId,
                                                           @PathVariable String discoveryId,
                                                           @RequestBody SummaryRequest request) {
        return ResponseEntity.ok(DiscoveryResponse.from(
                libraryService.attachSummary(userId, discoveryId, request.getSummaryData())));
    }

    @PutMapping("/settings")
    public ResponseEntity<DiscoveryContext> updateSettings(@RequestHeader(USER_HEADER) String userId,
                                                           @RequestBody SettingsRequest request) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        if (request.getDismissalPolicy() != null) {
            ctx = settingsService.updateDismissalPolicy(userId, request.getDismissalPolicy());
        }
        if (request.getEnabledTypes() != null) {
            ctx = settingsService.updateEnabledTypes(userId, request.getEnabledTypes());
        }
        if (request.getMinRating() != null) {
            ctx = settingsService.updateMinRating(userId, request.getMinRating());
        }
        return ResponseEntity.ok(ctx);
    }
}
