package com.neuroscape.generation;

/**
 * Thrown when a level cannot be generated under the requested constraints, e.g. when no
 * spawn layout satisfies the minimum enemy distance within the retry budget.
 */
public class GenerationFailedException extends RuntimeException {

    public GenerationFailedException(String message) {
        super(message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
