package com.heroespath.service.store;

import lombok.Value;

/**
 * 원격 저장소 장애로 로컬 캐시를 사용했다는 경고. 오류가 아니다
 */
@Value
public class DegradedPersistence {
    String operation;
    String reason;
    boolean queued; // 쓰기가 로컬 대기열에 들어가 나중에 반영됨

    public static DegradedPersistence read(String operation, Exception cause) {
        return new DegradedPersistence(operation, cause.getMessage(), false);
    }

    public static DegradedPersistence queuedWrite(String operation, Exception cause) {
        return new DegradedPersistence(operation, cause.getMessage(), true);
    }
}
