package io.skywatch.bus;

import java.util.Objects;

/**
 * Bus-assigned identifier of a stream entry, rendered on the wire as {@code <millis>-<seq>}.
 */
public record EntryId(long millis, long sequence) implements Comparable<EntryId> {

    /** Position before the first entry of any stream. */
    public static final EntryId ZERO = new EntryId(0L, 0L);

    public EntryId {
        if (millis < 0 || sequence < 0) {
            throw new IllegalArgumentException("entry id components must be >= 0");
        }
    }

    public static EntryId parse(String value) {
        Objects.requireNonNull(value, "value");
        String trimmed = value.trim();
        int dash = trimmed.indexOf('-');
        try {
            if (dash < 0) {
                return new EntryId(Long.parseLong(trimmed), 0L);
            }
            return new EntryId(
                Long.parseLong(trimmed.substring(0, dash)),
                Long.parseLong(trimmed.substring(dash + 1)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid entry id '" + value + "'", ex);
        }
    }

    public boolean isAfter(EntryId other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(EntryId other) {
        int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return millis + "-" + sequence;
    }
}
