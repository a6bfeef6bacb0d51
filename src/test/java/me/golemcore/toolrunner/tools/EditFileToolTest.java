package me.golemcore.toolrunner.tools;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EditFileToolTest {

    @TempDir
    Path tempDir;

    private EditFileTool tool;
    private ToolContext context;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        ToolRunnerProperties properties = new ToolRunnerProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        tool = new EditFileTool(new WorkspacePathResolver(properties));
        context = ToolContext.builder().workingDirectory(tempDir).build();
        file = tempDir.resolve("app.conf");
        Files.writeString(file, "host = localhost\nport = 8080\nretry = 3\nport = 8080\n");
    }

    @Test
    void shouldReplaceUniqueMatch() throws Exception {
        ToolOutput output = tool.execute(Map.of("path", "app.conf", "oldText", "retry = 3",
                "newText", "retry = 5"), context).get();

        assertFalse(output.isError());
        assertEquals(1, output.getMetadata().get("replacements"));
        assertEquals(3, output.getMetadata().get("line"));
        assertEquals("host = localhost\nport = 8080\nretry = 5\nport = 8080\n", Files.readString(file));
    }

    @Test
    void shouldFailWithoutTouchingFileWhenTextIsMissing() throws Exception {
        ToolOutput output = tool.execute(Map.of("path", "app.conf", "oldText", "timeout = 1",
                "newText", "timeout = 2"), context).get();

        assertTrue(output.isError());
        assertTrue(output.getContent().startsWith("Could not find the specified text"));
        assertTrue(Files.readString(file).contains("retry = 3"));
    }

    @Test
    void shouldRejectAmbiguousMatchUnlessReplaceAll() throws Exception {
        ToolOutput ambiguous = tool.execute(Map.of("path", "app.conf", "oldText", "port = 8080",
                "newText", "port = 9090"), context).get();

        assertTrue(ambiguous.isError());
        assertTrue(ambiguous.getContent().startsWith("Found 2 occurrences"));
        assertFalse(Files.readString(file).contains("9090"));

        ToolOutput all = tool.execute(Map.of("path", "app.conf", "oldText", "port = 8080",
                "newText", "port = 9090", "replaceAll", true), context).get();

        assertFalse(all.isError());
        assertEquals(2, all.getMetadata().get("replacements"));
        assertEquals("host = localhost\nport = 9090\nretry = 3\nport = 9090\n", Files.readString(file));
    }

    @Test
    void shouldReportMissingFileAndParameters() throws Exception {
        ToolOutput missing = tool.execute(Map.of("path", "nope.conf", "oldText", "a", "newText", "b"),
                context).get();

        assertTrue(missing.isError());
        assertTrue(missing.getContent().startsWith("File not found"));
        assertTrue(tool.execute(Map.of("path", "app.conf", "newText", "b"), context).get().isError());
        assertTrue(tool.execute(Map.of("path", "app.conf", "oldText", "a"), context).get().isError());
    }

    @Test
    void shouldCountNonOverlappingOccurrences() {
        assertEquals(2, EditFileTool.countOccurrences("aaaa", "aa"));
        assertEquals(0, EditFileTool.countOccurrences("abc", "d"));
    }
}
