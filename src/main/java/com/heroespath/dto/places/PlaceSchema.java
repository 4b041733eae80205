package com.heroespath.dto.places;

/**
 * 응답 스키마 버전. StandardPlace.sourceSchema에 기록된다
 */
public enum PlaceSchema {
    CURRENT_V1("places.v1"),
    LEGACY("maps.place.legacy");

    private final String version;

    PlaceSchema(String version) {
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
