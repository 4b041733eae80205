package com.heroespath.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteReviewProgress {
    private String routeId;
    private int totalCount;
    private int reviewedCount;
    private int completionPercentage;
    private boolean completed; // 검토할 것이 없으면 완료로 본다

    public static RouteReviewProgress of(String routeId, int total, int reviewed) {
        int percentage = total > 0 ? (int) Math.round(reviewed * 100.0 / total) : 0;
        return new RouteReviewProgress(routeId, total, reviewed, percentage, reviewed == total);
    }
}
