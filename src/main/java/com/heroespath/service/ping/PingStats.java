package com.heroespath.service.ping;

import lombok.Value;

@Value
public class PingStats {
    int creditsRemaining;
    long totalPingsUsed;
    int creditsPerPeriod;
    long cooldownSeconds;
}
