package com.heroespath.model;

public enum DismissDuration {
    TEMPORARY(DiscoveryStatus.DISMISSED_TEMPORARY),
    FOREVER(DiscoveryStatus.DISMISSED_FOREVER);

    private final DiscoveryStatus targetStatus;

    DismissDuration(DiscoveryStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public DiscoveryStatus getTargetStatus() {
        return targetStatus;
    }
}
