package org.gathermine.feed;

/**
 * Thrown when an observation feed cannot be turned into source objects.
 */
public class FeedFormatException extends Exception {

    public FeedFormatException(String message) {
        super(message);
    }

    public FeedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
