package com.heroespath.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 산책 중 ping 검색의 사용 제한과 검색 범위
 */
@Value
@Builder(toBuilder = true)
public class PingPolicy {
    @Builder.Default
    Duration cooldown = Duration.ofSeconds(10);
    @Builder.Default
    int creditsPerPeriod = 50;
    @Builder.Default
    Duration creditPeriod = Duration.ofDays(30);
    @Builder.Default
    int radiusMeters = 500;
    @Builder.Default
    int maxResults = 10;
    Double minRating; // null이면 평점으로 거르지 않음

    public static PingPolicy defaults() {
        return PingPolicy.builder().build();
    }
}
