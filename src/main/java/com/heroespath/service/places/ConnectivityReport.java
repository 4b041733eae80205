package com.heroespath.service.places;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세대별 연결 확인 결과. 값이 null이면 정상, 아니면 실패 사유
 */
@Data
public class ConnectivityReport {
    private String probePlaceId;
    private Map<String, String> failures = new LinkedHashMap<>();
    private Map<String, Boolean> available = new LinkedHashMap<>();

    public void record(LookupResult<?> result) {
        available.put(result.getGeneration(), result.isSuccess());
        if (!result.isSuccess()) {
            failures.put(result.getGeneration(), result.getError());
        }
    }

    public boolean isAnyAvailable() {
        return available.containsValue(Boolean.TRUE);
    }
}
