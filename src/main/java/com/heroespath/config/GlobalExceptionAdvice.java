package com.heroespath.config;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.IllegalReviewTransitionException;
import com.heroespath.exception.InvalidPlaceLocationException;
import com.heroespath.exception.PlacesUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionAdvice {

    @ExceptionHandler(DiscoveryNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(DiscoveryNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidPlaceLocationException.class, IllegalArgumentException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IllegalReviewTransitionException.class)
    public ResponseEntity<Map<String, Object>> onIllegalTransition(IllegalReviewTransitionException e) {
        return body(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(PlacesUnavailableException.class)
    public ResponseEntity<Map<String, Object>> onPlacesUnavailable(PlacesUnavailableException e) {
        log.warn("[GlobalExceptionAdvice] places unavailable: {}", e.getFailures());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getClass().getSimpleName(),
                "message", e.getMessage() != null ? e.getMessage() : ""
        ));
    }
}
