package io.skywatch.schedule;

/**
 * Schedule configuration that cannot produce a usable cycle.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
