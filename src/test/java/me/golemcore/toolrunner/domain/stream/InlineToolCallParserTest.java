package me.golemcore.toolrunner.domain.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static me.golemcore.toolrunner.domain.stream.InlineToolCallParser.CALLS_BEGIN;
import static me.golemcore.toolrunner.domain.stream.InlineToolCallParser.CALLS_END;
import static me.golemcore.toolrunner.domain.stream.InlineToolCallParser.CALL_BEGIN;
import static me.golemcore.toolrunner.domain.stream.InlineToolCallParser.CALL_END;
import static me.golemcore.toolrunner.domain.stream.InlineToolCallParser.SEP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InlineToolCallParserTest {

    private InlineToolCallParser parser;

    @BeforeEach
    void setUp() {
        parser = new InlineToolCallParser(new ObjectMapper());
    }

    private static String twoCallsWithProse() {
        return "Let me look. "
                + CALLS_BEGIN
                + CALL_BEGIN + "read_file" + SEP + "{\"path\":\"a.txt\"}" + CALL_END
                + CALL_BEGIN + "list_files" + SEP + "{\"path\":\"/tmp\"}" + CALL_END
                + CALLS_END
                + " Done.";
    }

    @Test
    void shouldExtractCallsAndKeepSurroundingProse() {
        InlineToolCallParser.Result result = parser.feed(twoCallsWithProse());
        InlineToolCallParser.Result tail = parser.finish();

        assertEquals("Let me look.  Done.", result.visibleText() + tail.visibleText());
        assertEquals(2, result.getCalls().size());
        assertEquals("read_file", result.getCalls().get(0).getName());
        assertEquals(Map.of("path", "a.txt"), result.getCalls().get(0).getArguments());
        assertEquals("list_files", result.getCalls().get(1).getName());
        assertTrue(parser.isDetected());
    }

    @Test
    void shouldPassThroughTextWithoutMarkers() {
        InlineToolCallParser.Result result = parser.feed("Plain answer with <b>tags</b> and a < sign.");
        InlineToolCallParser.Result tail = parser.finish();

        assertEquals("Plain answer with <b>tags</b> and a < sign.", result.visibleText() + tail.visibleText());
        assertTrue(result.getCalls().isEmpty());
        assertFalse(parser.isDetected());
    }

    @Test
    void shouldHoldBackOnlyPossibleMarkerPrefix() {
        InlineToolCallParser.Result first = parser.feed("if a <");
        InlineToolCallParser.Result second = parser.feed(" b then");
        InlineToolCallParser.Result third = parser.feed(" x <｜tool");
        InlineToolCallParser.Result tail = parser.finish();

        assertEquals("if a ", first.visibleText());
        assertEquals("< b then", second.visibleText());
        assertEquals(" x ", third.visibleText());
        assertEquals("<｜tool", tail.visibleText());
        assertFalse(parser.isDetected());
    }

    @Test
    void shouldHandleMarkersSplitAcrossChunks() {
        String full = twoCallsWithProse();
        StringBuilder visible = new StringBuilder();
        List<NormalizedToolCall> calls = new ArrayList<>();
        for (int i = 0; i < full.length(); i += 3) {
            InlineToolCallParser.Result result = parser.feed(full.substring(i, Math.min(i + 3, full.length())));
            visible.append(result.visibleText());
            calls.addAll(result.getCalls());
        }
        InlineToolCallParser.Result tail = parser.finish();
        visible.append(tail.visibleText());
        calls.addAll(tail.getCalls());

        assertEquals("Let me look.  Done.", visible.toString());
        assertEquals(2, calls.size());
        assertFalse(visible.toString().contains("｜"));
    }

    @Test
    void shouldParseFunctionTypedCallWithCodeFence() {
        String text = CALLS_BEGIN + CALL_BEGIN + "function" + SEP + "read_file\n```json\n{\"path\":\"b.txt\"}\n```"
                + CALL_END + CALLS_END;

        NormalizedToolCall call = parser.feed(text).getCalls().get(0);

        assertEquals("read_file", call.getName());
        assertEquals(Map.of("path", "b.txt"), call.getArguments());
        assertFalse(call.isMalformed());
    }

    @Test
    void shouldReportTruncatedBlockAsMalformed() {
        InlineToolCallParser.Result result = parser.feed("Working on it "
                + CALLS_BEGIN
                + CALL_BEGIN + "read_file" + SEP + "{\"path\":\"a.txt\"}" + CALL_END
                + CALL_BEGIN + "write_file" + SEP + "{\"path\":\"b");
        InlineToolCallParser.Result tail = parser.finish();

        assertEquals("Working on it ", result.visibleText());
        assertTrue(result.getCalls().isEmpty());
        assertEquals(2, tail.getCalls().size());
        assertFalse(tail.getCalls().get(0).isMalformed());
        NormalizedToolCall truncated = tail.getCalls().get(1);
        assertTrue(truncated.isMalformed());
        assertEquals("write_file", truncated.getName());
    }

    @Test
    void shouldReportInvalidJsonAsMalformed() {
        NormalizedToolCall call = parser.parseCall("read_file" + SEP + "{not json}");

        assertTrue(call.isMalformed());
        assertEquals("read_file", call.getName());
        assertTrue(call.getError().startsWith("malformed tool arguments"));
    }

    @Test
    void shouldDropStrayClosingMarker() {
        InlineToolCallParser.Result result = parser.feed("before" + CALL_END + "after");
        InlineToolCallParser.Result tail = parser.finish();

        assertEquals("beforeafter", result.visibleText() + tail.visibleText());
        assertTrue(result.getCalls().isEmpty());
    }
}
