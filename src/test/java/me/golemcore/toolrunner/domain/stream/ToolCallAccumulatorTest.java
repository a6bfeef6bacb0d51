package me.golemcore.toolrunner.domain.stream;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallAccumulatorTest {

    private static final String ARGS = "{\"path\":\"/tmp\",\"recursive\":false,\"depth\":3}";

    private final ToolCallAccumulator accumulator = new ToolCallAccumulator(new ObjectMapper());

    private static LlmChunk.ToolCallDelta delta(int index, String id, String name, String fragment) {
        return LlmChunk.ToolCallDelta.builder()
                .index(index)
                .id(id)
                .name(name)
                .argumentsFragment(fragment)
                .build();
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 10 })
    void shouldReassembleArgumentsRegardlessOfFragmentation(int fragments) {
        int size = (int) Math.ceil(ARGS.length() / (double) fragments);
        for (int i = 0; i < fragments; i++) {
            int start = Math.min(i * size, ARGS.length());
            int end = Math.min(start + size, ARGS.length());
            accumulator.append(delta(0, i == 0 ? "call_1" : null, i == 0 ? "list_files" : null,
                    ARGS.substring(start, end)));
        }

        List<NormalizedToolCall> calls = accumulator.drain();

        assertEquals(1, calls.size());
        NormalizedToolCall call = calls.get(0);
        assertEquals("call_1", call.getId());
        assertEquals("list_files", call.getName());
        assertEquals(Map.of("path", "/tmp", "recursive", false, "depth", 3), call.getArguments());
        assertFalse(call.isMalformed());
    }

    @Test
    void shouldKeepCallsSeparatedByIndex() {
        accumulator.append(delta(1, "call_b", "write_file", "{\"path\":"));
        accumulator.append(delta(0, "call_a", "read_file", "{\"path\":\"a.txt\"}"));
        accumulator.append(delta(1, null, null, "\"b.txt\"}"));

        List<NormalizedToolCall> calls = accumulator.drain();

        assertEquals(2, calls.size());
        assertEquals("call_a", calls.get(0).getId());
        assertEquals(Map.of("path", "b.txt"), calls.get(1).getArguments());
    }

    @Test
    void shouldMarkUnparsableArgumentsAsMalformed() {
        accumulator.append(delta(0, "call_1", "read_file", "{\"path\": \"a.txt\""));

        NormalizedToolCall call = accumulator.drain().get(0);

        assertTrue(call.isMalformed());
        assertTrue(call.getError().startsWith("malformed tool arguments"));
        assertEquals(Map.of(), call.getArguments());
        assertEquals("{\"path\": \"a.txt\"", call.getRawArguments());
    }

    @Test
    void shouldTreatEmptyArgumentsAsEmptyObject() {
        accumulator.append(delta(0, "call_1", "list_files", null));

        NormalizedToolCall call = accumulator.drain().get(0);

        assertFalse(call.isMalformed());
        assertEquals(Map.of(), call.getArguments());
    }

    @Test
    void shouldGenerateMissingId() {
        accumulator.append(delta(0, null, "list_files", "{}"));

        List<NormalizedToolCall> calls = accumulator.drain();

        assertEquals(1, calls.size());
        assertTrue(calls.get(0).getId().startsWith("call_"));
        assertTrue(accumulator.isEmpty());
    }

    @Test
    void shouldReportNamelessCallWithIdAsMalformed() {
        accumulator.append(delta(0, "call_1", null, "{\"path\":\"/tmp\"}"));

        List<NormalizedToolCall> calls = accumulator.drain();

        assertEquals(1, calls.size());
        NormalizedToolCall call = calls.get(0);
        assertEquals("call_1", call.getId());
        assertEquals("unknown", call.getName());
        assertTrue(call.isMalformed());
        assertEquals("malformed tool arguments: missing tool name", call.getError());
        assertEquals("{\"path\":\"/tmp\"}", call.getRawArguments());
    }

    @Test
    void shouldDropCallWithoutIdAndName() {
        accumulator.append(delta(0, null, null, "{}"));

        assertTrue(accumulator.drain().isEmpty());
    }
}
