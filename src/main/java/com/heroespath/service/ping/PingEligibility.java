package com.heroespath.service.ping;

import lombok.Value;

@Value
public class PingEligibility {
    boolean canPing;
    PingOutcome blockedBy; // canPing이면 null
    long cooldownRemainingSeconds;
    int creditsRemaining;

    public static PingEligibility allowed(int creditsRemaining) {
        return new PingEligibility(true, null, 0, creditsRemaining);
    }

    public static PingEligibility cooldown(long remainingSeconds, int creditsRemaining) {
        return new PingEligibility(false, PingOutcome.COOLDOWN, remainingSeconds, creditsRemaining);
    }

    public static PingEligibility noCredits() {
        return new PingEligibility(false, PingOutcome.NO_CREDITS, 0, 0);
    }
}
