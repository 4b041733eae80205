package com.heroespath.model;

public enum DiscoveryStatus {
    UNREVIEWED,
    SAVED,
    DISMISSED_TEMPORARY,
    DISMISSED_FOREVER;

    public boolean isDismissed() {
        return this == DISMISSED_TEMPORARY || this == DISMISSED_FOREVER;
    }

    public boolean isReviewed() {
        return this != UNREVIEWED;
    }
}
