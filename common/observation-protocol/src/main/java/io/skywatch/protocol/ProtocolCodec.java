package io.skywatch.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.skywatch.bus.StreamEntry;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts protocol records to and from flat stream-entry fields.
 * <p>
 * Scalar fields are plain strings, nested mappings are JSON and timestamps are ISO-8601 UTC.
 */
public final class ProtocolCodec {

    public static final String SEQUENCE = "sequence";
    public static final String OP = "op";
    public static final String ARGS = "args";
    public static final String ISSUED_AT = "issued_at";
    public static final String RESULT = "result";
    public static final String DETAIL = "detail";
    public static final String EMITTED_AT = "emitted_at";
    public static final String SOURCE = "source";
    public static final String VALUES = "values";
    public static final String RECORDED_AT = "recorded_at";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Mapper configured for the wire: ISO timestamps and map keys in sorted order, so that the
     * same record always encodes to the same fields.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public static ProtocolCodec withDefaults() {
        return new ProtocolCodec(defaultObjectMapper());
    }

    public Map<String, String> encodeCommand(Command command) {
        Objects.requireNonNull(command, "command");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SEQUENCE, Long.toString(command.sequence()));
        fields.put(OP, command.op());
        fields.put(ARGS, toJson(command.args()));
        fields.put(ISSUED_AT, command.issuedAt().toString());
        return fields;
    }

    public Command decodeCommand(StreamEntry entry) {
        Objects.requireNonNull(entry, "entry");
        String id = entry.id().toString();
        long sequence = parseSequence(id, entry.field(SEQUENCE));
        String op = require(id, entry, OP);
        Map<String, Object> args = parseJson(id, ARGS, entry.field(ARGS));
        Instant issuedAt = parseInstant(id, ISSUED_AT, require(id, entry, ISSUED_AT));
        try {
            return new Command(sequence, op, args, issuedAt);
        } catch (IllegalArgumentException ex) {
            throw new MalformedEntryException(id, "Invalid command in entry " + id + ": " + ex.getMessage(), ex);
        }
    }

    public Map<String, String> encodeStatus(StatusRecord status) {
        Objects.requireNonNull(status, "status");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SEQUENCE, Long.toString(status.sequence()));
        fields.put(RESULT, status.result().wireName());
        fields.put(DETAIL, toJson(status.detail()));
        fields.put(EMITTED_AT, status.emittedAt().toString());
        return fields;
    }

    public StatusRecord decodeStatus(StreamEntry entry) {
        Objects.requireNonNull(entry, "entry");
        String id = entry.id().toString();
        long sequence = parseSequence(id, entry.field(SEQUENCE));
        CommandResult result;
        try {
            result = CommandResult.fromWire(require(id, entry, RESULT));
        } catch (IllegalArgumentException ex) {
            throw new MalformedEntryException(id, ex.getMessage(), ex);
        }
        Map<String, Object> detail = parseJson(id, DETAIL, entry.field(DETAIL));
        Instant emittedAt = parseInstant(id, EMITTED_AT, require(id, entry, EMITTED_AT));
        return new StatusRecord(sequence, result, detail, emittedAt);
    }

    public Map<String, String> encodeData(DataRecord record) {
        Objects.requireNonNull(record, "record");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SOURCE, record.source());
        fields.put(VALUES, toJson(record.values()));
        fields.put(RECORDED_AT, record.recordedAt().toString());
        return fields;
    }

    public DataRecord decodeData(StreamEntry entry) {
        Objects.requireNonNull(entry, "entry");
        String id = entry.id().toString();
        String source = require(id, entry, SOURCE);
        Map<String, Object> values = parseJson(id, VALUES, entry.field(VALUES));
        Instant recordedAt = parseInstant(id, RECORDED_AT, require(id, entry, RECORDED_AT));
        return new DataRecord(source, values, recordedAt);
    }

    public String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not JSON-serialisable: " + ex.getOriginalMessage(), ex);
        }
    }

    public Map<String, Object> fromJson(String json) {
        return parseJson("n/a", "value", json);
    }

    private Map<String, Object> parseJson(String id, String field, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            LinkedHashMap<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException ex) {
            throw new MalformedEntryException(id, "Field '" + field + "' of entry " + id + " is not a JSON object", ex);
        }
    }

    private static long parseSequence(String id, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedEntryException(id, "Entry " + id + " has no '" + SEQUENCE + "' field");
        }
        try {
            long sequence = Long.parseLong(raw.trim());
            if (sequence < 0) {
                throw new MalformedEntryException(id, "Entry " + id + " has negative sequence " + sequence);
            }
            return sequence;
        } catch (NumberFormatException ex) {
            throw new MalformedEntryException(id, "Entry " + id + " has non-numeric sequence '" + raw + "'", ex);
        }
    }

    private static Instant parseInstant(String id, String field, String raw) {
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new MalformedEntryException(id, "Field '" + field + "' of entry " + id + " is not an ISO-8601 instant", ex);
        }
    }

    private static String require(String id, StreamEntry entry, String field) {
        String value = entry.field(field);
        if (value == null || value.isBlank()) {
            throw new MalformedEntryException(id, "Entry " + id + " has no '" + field + "' field");
        }
        return value;
    }
}
