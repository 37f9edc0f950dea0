package com.studygroups.studygroups_api.exception;

/**
 * Thrown when a matching run is requested while another one still holds the lock.
 */
public class MatchingInProgressException extends RuntimeException {

    public MatchingInProgressException(String message) {
        super(message);
    }
}
