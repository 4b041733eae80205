package com.heroespath.exception;

public class DiscoveryNotFoundException extends RuntimeException {

    public DiscoveryNotFoundException(String message) {
        super(message);
    }
}
