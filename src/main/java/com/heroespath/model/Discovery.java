package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * (route, place) 한 쌍에 대한 발견 기록
 * 상태 변경은 ReviewStateMachine만 수행
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Discovery {
    private String discoveryId;
    private String userId;
    private String routeId;
    private String placeId;
    private StandardPlace snapshot;
    private DiscoveryStatus status;
    private Instant discoveredAt;
    private Instant decidedAt;
    private Instant dismissExpiresAt; // DISMISSED_TEMPORARY일 때만 존재
    private Instant summaryRequestedAt;
    private String summaryData; // 외부에서 생성된 요약 (불투명 JSON)
    @Builder.Default
    private List<DiscoverySource> sources = new ArrayList<>();

    /**
     * 만료된 임시 숨김인지 확인 (읽기 시점 판정)
     */
    public boolean isStaleDismissal(Instant now) {
        return status == DiscoveryStatus.DISMISSED_TEMPORARY
                && dismissExpiresAt != null
                && !dismissExpiresAt.isAfter(now);
    }

    /**
     * 만료된 임시 숨김을 미검토 상태로 되돌림
     * @return 보정이 일어났으면 true
     */
    public boolean correctStaleDismissal(Instant now) {
        if (!isStaleDismissal(now)) {
            return false;
        }
        this.status = DiscoveryStatus.UNREVIEWED;
        this.decidedAt = null;
        this.dismissExpiresAt = null;
        return true;
    }

    public String storageKey() {
        return keyOf(userId, routeId, placeId);
    }

    public static String keyOf(String userId, String routeId, String placeId) {
        return userId + ":" + routeId + ":" + placeId;
    }

    /**
     * (user, route, place)에서 결정되는 discoveryId
     * 원격 저장소와 로컬 캐시가 같은 기록에 같은 id를 쓴다
     */
    public static String idFor(String userId, String routeId, String placeId) {
        String key = keyOf(userId, routeId, placeId);
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
