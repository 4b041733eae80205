package com.heroespath.controller;

import com.heroespath.dto.request.PingRequest;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.GeoPoint;
import com.heroespath.service.ping.PingEligibility;
import com.heroespath.service.ping.PingOutcome;
import com.heroespath.service.ping.PingResult;
import com.heroespath.service.ping.PingService;
import com.heroespath.service.ping.PingStats;
import com.heroespath.service.settings.UserSettingsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 산책 중 ping API
 * 쿨다운/크레딧 부족은 429로 응답하고 본문에 남은 시간과 크레딧을 담는다
 */
@RestController
@RequestMapping("/api/pings")
@RequiredArgsConstructor
public class PingController {

    private static final String USER_HEADER = "X-User-Id";

    private final PingService pingService;
    private final UserSettingsService settingsService;

    /**
     * POST /api/pings/routes/{routeId}
     */
    @PostMapping("/routes/{routeId}")
    public ResponseEntity<PingResult> ping(@RequestHeader(USER_HEADER) String userId,
                                           @PathVariable String routeId,
                                           @RequestBody PingRequest request) {
        DiscoveryContext ctx = settingsService.contextFor(userId);
        PingResult result = pingService.ping(ctx, routeId,
                new GeoPoint(request.getLat(), request.getLng()), request.getLanguage());
        if (result.getOutcome() == PingOutcome.COOLDOWN || result.getOutcome() == PingOutcome.NO_CREDITS) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/eligibility")
    public ResponseEntity<PingEligibility> eligibility(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(pingService.checkEligibility(settingsService.contextFor(userId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<PingStats> stats(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(pingService.stats(settingsService.contextFor(userId)));
    }
}
