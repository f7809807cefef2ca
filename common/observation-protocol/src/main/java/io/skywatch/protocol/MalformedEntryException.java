package io.skywatch.protocol;

/**
 * Raised when a stream entry does not follow the wire contract.
 */
public class MalformedEntryException extends RuntimeException {

    private final String entryId;

    public MalformedEntryException(String entryId, String message) {
        super(message);
        this.entryId = entryId;
    }

    public MalformedEntryException(String entryId, String message, Throwable cause) {
        super(message, cause);
        this.entryId = entryId;
    }

    public String entryId() {
        return entryId;
    }
}
