package io.skywatch.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.skywatch.bus.EntryId;
import io.skywatch.bus.StreamEntry;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProtocolCodecTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ProtocolCodec codec = ProtocolCodec.withDefaults();

    @Test
    void encodesCommandWithJsonArgsAndIsoTimestamp() {
        Command command = Command.of(7, CommandOp.SWITCH, Map.of("path", "RFANT"), NOW);

        Map<String, String> fields = codec.encodeCommand(command);

        assertThat(fields)
            .containsEntry("sequence", "7")
            .containsEntry("op", "switch")
            .containsEntry("args", "{\"path\":\"RFANT\"}")
            .containsEntry("issued_at", "2024-03-01T12:00:00Z");
        assertThat(codec.decodeCommand(entry(fields))).isEqualTo(command);
    }

    @Test
    void statusEncodingDoesNotDependOnMapOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", 1);
        Map<String, Object> second = new HashMap<>();
        second.put("a", 1);
        second.put("b", 2);

        assertThat(codec.encodeStatus(StatusRecord.ok(3, first, NOW)))
            .isEqualTo(codec.encodeStatus(StatusRecord.ok(3, second, NOW)));
    }

    @Test
    void decodesErrorStatusCause() {
        Map<String, String> fields = codec.encodeStatus(
            StatusRecord.error(4, "switch timeout", Map.of("kind", "switch"), NOW));

        StatusRecord status = codec.decodeStatus(entry(fields));

        assertThat(status.isOk()).isFalse();
        assertThat(status.cause()).isEqualTo("switch timeout");
        assertThat(status.detail()).containsEntry("kind", "switch");
    }

    @Test
    void rejectsEntriesWithoutSequence() {
        StreamEntry entry = entry(Map.of("op", "switch", "issued_at", NOW.toString()));

        assertThatThrownBy(() -> codec.decodeCommand(entry))
            .isInstanceOf(MalformedEntryException.class)
            .hasMessageContaining("sequence");
    }

    @Test
    void rejectsZeroSequenceCommand() {
        StreamEntry entry = entry(Map.of("sequence", "0", "op", "switch", "issued_at", NOW.toString()));

        assertThatThrownBy(() -> codec.decodeCommand(entry)).isInstanceOf(MalformedEntryException.class);
    }

    @Test
    void rejectsNonJsonArgs() {
        StreamEntry entry = entry(Map.of(
            "sequence", "5", "op", "switch", "args", "path=RFANT", "issued_at", NOW.toString()));

        assertThatThrownBy(() -> codec.decodeCommand(entry))
            .isInstanceOf(MalformedEntryException.class)
            .satisfies(ex -> assertThat(((MalformedEntryException) ex).entryId()).isEqualTo("1-0"));
    }

    @Test
    void rejectsUnknownResultAndBadTimestamp() {
        assertThatThrownBy(() -> codec.decodeStatus(entry(Map.of(
            "sequence", "1", "result", "maybe", "emitted_at", NOW.toString()))))
            .isInstanceOf(MalformedEntryException.class);
        assertThatThrownBy(() -> codec.decodeStatus(entry(Map.of(
            "sequence", "1", "result", "ok", "emitted_at", "yesterday"))))
            .isInstanceOf(MalformedEntryException.class);
    }

    @Test
    void unknownOpIsStillAWellFormedCommand() {
        Command command = codec.decodeCommand(entry(Map.of(
            "sequence", "9", "op", "telescope-dance", "issued_at", NOW.toString())));

        assertThat(command.args()).isEmpty();
        assertThat(CommandOp.fromWire(command.op())).isEmpty();
    }

    private static StreamEntry entry(Map<String, String> fields) {
        return new StreamEntry("ctrl:panda", EntryId.parse("1-0"), fields);
    }
}
