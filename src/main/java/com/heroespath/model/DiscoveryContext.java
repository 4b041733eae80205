package com.heroespath.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 요청 단위로 전달되는 사용자 컨텍스트
 * 프로세스 전역 상태 대신 orchestrator, state machine, ping 서비스에 명시적으로 넘긴다
 */
@Value
@Builder(toBuilder = true)
public class DiscoveryContext {
    String userId;
    @Builder.Default
    DismissalPolicy dismissalPolicy = DismissalPolicy.ASK;
    /**
     * null이면 타입 제한 없음, 빈 목록이면 사용자가 모든 타입을 끈 상태
     */
    List<String> enabledTypes;
    @Builder.Default
    PingPolicy pingPolicy = PingPolicy.defaults();

    public static DiscoveryContext forUser(String userId) {
        return DiscoveryContext.builder().userId(userId).build();
    }

    public boolean allTypesDisabled() {
        return enabledTypes != null && enabledTypes.isEmpty();
    }
}
