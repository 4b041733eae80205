package com.heroespath.dto.response;

import com.heroespath.model.RouteReviewProgress;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteSetResponse {
    private String routeId;
    private List<DiscoveryResponse> discoveries;
    private RouteReviewProgress progress;
    private boolean degraded;
}
