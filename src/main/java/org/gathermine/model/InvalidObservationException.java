package org.gathermine.model;

/**
 * Thrown when input handed to the core violates a precondition, such as a coordinate outside
 * of [0,100] or a zone whose canonical id cannot be ordered numerically.
 * <p>
 * These values are never coerced, because they would corrupt the packing and the ordering
 * of the persisted tables.
 */
public class InvalidObservationException extends IllegalArgumentException {

    /**
     * Constructs the exception with a detail message.
     * @param message The detail message.
     */
    public InvalidObservationException(String message) {
        super(message);
    }

    /**
     * Constructs the exception with a detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public InvalidObservationException(String message, Throwable cause) {
        super(message, cause);
    }
}
