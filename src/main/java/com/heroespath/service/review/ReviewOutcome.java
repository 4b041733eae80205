package com.heroespath.service.review;

import com.heroespath.model.Discovery;
import com.heroespath.service.store.DegradedPersistence;
import lombok.Value;

import java.util.Optional;

/**
 * 상태 전이 요청의 결과
 */
@Value
public class ReviewOutcome {

    public enum Type {
        APPLIED,
        NO_OP, // 이미 목표 상태
        DURATION_REQUIRED // 정책이 ASK인데 기간이 없음, 호출자가 사용자에게 물어야 함
    }

    Type type;
    Discovery discovery;
    DegradedPersistence warning;

    public static ReviewOutcome applied(Discovery discovery, DegradedPersistence warning) {
        return new ReviewOutcome(Type.APPLIED, discovery, warning);
    }

    public static ReviewOutcome noOp(Discovery discovery) {
        return new ReviewOutcome(Type.NO_OP, discovery, null);
    }

    public static ReviewOutcome durationRequired(Discovery discovery) {
        return new ReviewOutcome(Type.DURATION_REQUIRED, discovery, null);
    }

    public Optional<DegradedPersistence> getWarningIfAny() {
        return Optional.ofNullable(warning);
    }
}
