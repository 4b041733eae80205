package com.heroespath.exception;

import java.util.List;

/**
 * 모든 Places API 세대 호출이 실패한 경우
 * 호출자는 빈 결과로 처리하고, 자동 재시도는 하지 않는다
 */
public class PlacesUnavailableException extends RuntimeException {

    private final List<String> failures;

    public PlacesUnavailableException(String operation, List<String> failures) {
        super("Places lookup unavailable for " + operation + ": " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
