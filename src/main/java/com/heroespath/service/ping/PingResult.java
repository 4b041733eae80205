package com.heroespath.service.ping;

import com.heroespath.model.StandardPlace;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PingResult {
    PingOutcome outcome;
    String pingId; // FOUND일 때만
    @Builder.Default
    List<StandardPlace> places = List.of();
    int creditsRemaining;
    long cooldownRemainingSeconds;
}
