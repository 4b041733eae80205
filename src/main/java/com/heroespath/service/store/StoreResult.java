package com.heroespath.service.store;

import java.util.Optional;

/**
 * 저장소 호출 결과와 (있다면) 저하 모드 경고
 */
public final class StoreResult<T> {

    private final T value;
    private final DegradedPersistence warning;

    private StoreResult(T value, DegradedPersistence warning) {
        this.value = value;
        this.warning = warning;
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(value, null);
    }

    public static <T> StoreResult<T> degraded(T value, DegradedPersistence warning) {
        return new StoreResult<>(value, warning);
    }

    public T getValue() {
        return value;
    }

    public boolean isDegraded() {
        return warning != null;
    }

    public Optional<DegradedPersistence> getWarning() {
        return Optional.ofNullable(warning);
    }
}
