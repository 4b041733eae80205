package com.heroespath.exception;

import com.heroespath.model.DiscoveryStatus;

public class IllegalReviewTransitionException extends RuntimeException {

    private final DiscoveryStatus from;
    private final DiscoveryStatus to;

    public IllegalReviewTransitionException(DiscoveryStatus from, DiscoveryStatus to) {
        super("Review transition not allowed: " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public DiscoveryStatus getFrom() {
        return from;
    }

    public DiscoveryStatus getTo() {
        return to;
    }
}
