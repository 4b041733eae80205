package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 경로 하나의 discovery가 어느 검색에서 왔는지 집계
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationStats {
    private String routeId;
    private int totalDiscoveries;
    private int routeDiscoveries; // 경로 검색에서만
    private int pingDiscoveries; // ping에서만
    private int mixedSourceDiscoveries; // 둘 다
}
