package com.heroespath.exception;

/**
 * 좌표가 없는 장소를 저장하려 할 때. 저장 전에 거부한다
 */
public class InvalidPlaceLocationException extends RuntimeException {

    private final String placeId;

    public InvalidPlaceLocationException(String placeId) {
        super("Place has no numeric coordinates: " + placeId);
        this.placeId = placeId;
    }

    public String getPlaceId() {
        return placeId;
    }
}
