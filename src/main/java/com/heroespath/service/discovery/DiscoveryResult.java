package com.heroespath.service.discovery;

import com.heroespath.model.StandardPlace;
import com.heroespath.service.store.DegradedPersistence;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * discoverForRoute 결과
 * places는 현재 미검토 상태인 장소만 담는다
 */
@Value
@Builder
public class DiscoveryResult {
    String routeId;
    @Builder.Default
    List<StandardPlace> places = List.of();
    boolean resolverCalled; // 최초 탐색이었는지
    boolean placesUnavailable; // 모든 Places API 세대가 실패해 빈 결과로 대체됨
    int pingPlaceCount; // 합쳐진 산책 중 ping 장소 수 (중복 포함)
    @Builder.Default
    List<String> rejectedPlaceIds = List.of(); // 좌표가 없어 저장하지 않은 장소
    @Builder.Default
    List<DegradedPersistence> warnings = List.of();
}
