package com.heroespath.service.review;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.IllegalReviewTransitionException;
import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.DismissDuration;
import com.heroespath.model.StandardPlace;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.service.store.StoreResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 검토 상태 전이
 * UNREVIEWED -> SAVED | DISMISSED_TEMPORARY | DISMISSED_FOREVER
 * SAVED -> UNREVIEWED (저장 취소), DISMISSED_* -> UNREVIEWED (숨김 취소)
 * 이미 목표 상태면 no-op, 그 외 전이는 IllegalReviewTransitionException
 */
@Slf4j
@Service
public class ReviewStateMachine {

    private static final Map<DiscoveryStatus, Set<DiscoveryStatus>> TRANSITIONS = Map.of(
            DiscoveryStatus.UNREVIEWED, EnumSet.of(DiscoveryStatus.SAVED,
                    DiscoveryStatus.DISMISSED_TEMPORARY, DiscoveryStatus.DISMISSED_FOREVER),
            DiscoveryStatus.SAVED, EnumSet.of(DiscoveryStatus.UNREVIEWED),
            DiscoveryStatus.DISMISSED_TEMPORARY, EnumSet.of(DiscoveryStatus.UNREVIEWED),
            DiscoveryStatus.DISMISSED_FOREVER, EnumSet.of(DiscoveryStatus.UNREVIEWED)
    );

    private final DiscoveryStoreAdapter storeAdapter;
    private final Clock clock;
    private final Duration temporaryDismissal;

    public ReviewStateMachine(DiscoveryStoreAdapter storeAdapter,
                              Clock clock,
                              @Value("${discovery.dismiss.temporary-days:30}") int temporaryDays) {
        this.storeAdapter = storeAdapter;
        this.clock = clock;
        this.temporaryDismissal = Duration.ofDays(temporaryDays);
    }

    public static boolean isAllowed(DiscoveryStatus from, DiscoveryStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    public ReviewOutcome save(DiscoveryContext ctx, String routeId, String placeId) {
        return transition(ctx, load(ctx, routeId, placeId), DiscoveryStatus.SAVED, null);
    }

    /**
     * 아직 discovery가 없는 장소(상세 화면 등)도 저장할 수 있도록 필요하면 먼저 만든다
     * @throws InvalidPlaceLocationException 좌표가 없는 장소
     */
    public ReviewOutcome save(DiscoveryContext ctx, String routeId, StandardPlace place) {
        if (!place.hasValidLocation()) {
            throw new InvalidPlaceLocationException(place.getPlaceId());
        }
        String discoveryId = Discovery.idFor(ctx.getUserId(), routeId, place.getPlaceId());
        Discovery current = storeAdapter.findDiscovery(ctx.getUserId(), discoveryId).getValue()
                .orElseGet(() -> storeAdapter.createDiscovery(Discovery.builder()
                        .userId(ctx.getUserId())
                        .routeId(routeId)
                        .placeId(place.getPlaceId())
                        .snapshot(place)
                        .status(DiscoveryStatus.UNREVIEWED)
                        .discoveredAt(clock.instant())
                        .build()).getValue());
        return transition(ctx, current, DiscoveryStatus.SAVED, null);
    }

    /**
     * @param duration null이면 사용자 정책을 따르고, 정책이 ASK면 DURATION_REQUIRED를 돌려준다
     */
    public ReviewOutcome dismiss(DiscoveryContext ctx, String routeId, String placeId, DismissDuration duration) {
        Discovery current = load(ctx, routeId, placeId);
        DismissDuration effective = duration != null ? duration : ctx.getDismissalPolicy().defaultDuration();
        if (effective == null) {
            log.debug("[ReviewStateMachine] dismiss - duration required, discoveryId: {}", current.getDiscoveryId());
            return ReviewOutcome.durationRequired(current);
        }
        DiscoveryStatus target = effective.getTargetStatus();
        Instant expiresAt = target == DiscoveryStatus.DISMISSED_TEMPORARY
                ? clock.instant().plus(temporaryDismissal)
                : null;
        return transition(ctx, current, target, expiresAt);
    }

    public ReviewOutcome undoSave(DiscoveryContext ctx, String routeId, String placeId) {
        Discovery current = load(ctx, routeId, placeId);
        if (current.getStatus().isDismissed()) {
            throw new IllegalReviewTransitionException(current.getStatus(), DiscoveryStatus.UNREVIEWED);
        }
        return transition(ctx, current, DiscoveryStatus.UNREVIEWED, null);
    }

    public ReviewOutcome undoDismiss(DiscoveryContext ctx, String routeId, String placeId) {
        Discovery current = load(ctx, routeId, placeId);
        if (current.getStatus() == DiscoveryStatus.SAVED) {
            throw new IllegalReviewTransitionException(current.getStatus(), DiscoveryStatus.UNREVIEWED);
        }
        return transition(ctx, current, DiscoveryStatus.UNREVIEWED, null);
    }

    private ReviewOutcome transition(DiscoveryContext ctx, Discovery current, DiscoveryStatus target, Instant expiresAt) {
        DiscoveryStatus from = current.getStatus();
        if (from == target) {
            return ReviewOutcome.noOp(current);
        }
        if (!isAllowed(from, target)) {
            throw new IllegalReviewTransitionException(from, target);
        }

        StoreResult<Discovery> updated = storeAdapter.updateStatus(ctx.getUserId(), current.getDiscoveryId(), target, expiresAt);
        log.info("[ReviewStateMachine] transition - discoveryId: {}, placeId: {}, {} -> {}, expiresAt: {}",
                current.getDiscoveryId(), current.getPlaceId(), from, target, expiresAt);
        return ReviewOutcome.applied(updated.getValue(), updated.getWarning().orElse(null));
    }

    private Discovery load(DiscoveryContext ctx, String routeId, String placeId) {
        String discoveryId = Discovery.idFor(ctx.getUserId(), routeId, placeId);
        return storeAdapter.findDiscovery(ctx.getUserId(), discoveryId).getValue()
                .orElseThrow(() -> new DiscoveryNotFoundException(
                        "No discovery for route " + routeId + " and place " + placeId));
    }
}
