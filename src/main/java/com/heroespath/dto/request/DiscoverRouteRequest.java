package com.heroespath.dto.request;

import com.heroespath.model.RouteSample;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 완료된 경로의 탐색 요청
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoverRouteRequest {
    private List<RouteSample> coords = new ArrayList<>();
    private List<String> typeFilters; // 비어 있으면 사용자 설정 타입, "all"이면 필터 없음
    private String language = "en";
}
