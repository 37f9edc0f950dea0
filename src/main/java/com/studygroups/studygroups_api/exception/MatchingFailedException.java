package com.studygroups.studygroups_api.exception;

/**
 * Wraps a storage or roster failure that aborted a matching run.
 */
public class MatchingFailedException extends RuntimeException {

    public MatchingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
