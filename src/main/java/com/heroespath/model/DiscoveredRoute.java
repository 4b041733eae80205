package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 최초 탐색을 마친 경로 표시
 * 저장된 discovery가 0건이어도 이 기록이 있으면 resolver를 다시 호출하지 않는다
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredRoute {
    private String userId;
    private String routeId;
    private Instant discoveredAt;
    private int discoveryCount;

    public String storageKey() {
        return keyOf(userId, routeId);
    }

    public static String keyOf(String userId, String routeId) {
        return userId + ":" + routeId;
    }
}
