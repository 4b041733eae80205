package com.heroespath.service.taxonomy;

import lombok.Value;

@Value
public class PlaceClassification {
    public static final PlaceClassification UNKNOWN = new PlaceClassification("unknown", "unknown");

    String category;
    String subtype;

    public boolean isUnknown() {
        return UNKNOWN.equals(this);
    }
}
