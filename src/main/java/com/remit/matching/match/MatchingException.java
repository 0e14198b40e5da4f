package com.remit.matching.match;

/**
 * Thrown when a matching run cannot be carried out, for instance because the
 * invoice snapshot could not be fetched or the run was interrupted.
 */
public class MatchingException extends RuntimeException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
