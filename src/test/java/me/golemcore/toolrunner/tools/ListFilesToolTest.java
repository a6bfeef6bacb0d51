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

class ListFilesToolTest {

    @TempDir
    Path tempDir;

    private ToolRunnerProperties properties;
    private ListFilesTool tool;

    @BeforeEach
    void setUp() {
        properties = new ToolRunnerProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        tool = new ListFilesTool(new WorkspacePathResolver(properties), properties);
    }

    @Test
    void shouldListDirectoriesBeforeFiles() throws Exception {
        Files.writeString(tempDir.resolve("b.txt"), "12345");
        Files.writeString(tempDir.resolve("a.txt"), "1");
        Files.createDirectory(tempDir.resolve("zeta"));

        ToolOutput output = tool.execute(Map.of(), ToolContext.builder().build()).get();

        assertFalse(output.isError());
        String content = output.getContent();
        assertTrue(content.startsWith("Directory: " + tempDir));
        assertTrue(content.contains("Entries: 3"));
        assertTrue(content.indexOf("[DIR]  zeta/") < content.indexOf("[FILE] a.txt"));
        assertTrue(content.indexOf("[FILE] a.txt") < content.indexOf("[FILE] b.txt"));
        assertTrue(content.contains("[FILE] b.txt (5 B)"));
        assertEquals(3, output.getMetadata().get("entries"));
    }

    @Test
    void shouldListAbsolutePathOutsideWorkspace(@TempDir Path other) throws Exception {
        Files.writeString(other.resolve("outside.txt"), "x");

        ToolOutput output = tool.execute(Map.of("path", other.toString()), ToolContext.builder().build()).get();

        assertFalse(output.isError());
        assertTrue(output.getContent().contains("outside.txt"));
    }

    @Test
    void shouldLimitListedEntries() throws Exception {
        properties.getTools().setMaxFilesList(2);
        tool = new ListFilesTool(new WorkspacePathResolver(properties), properties);
        for (int i = 0; i < 5; i++) {
            Files.writeString(tempDir.resolve("f" + i + ".txt"), "x");
        }

        ToolOutput output = tool.execute(Map.of(), ToolContext.builder().build()).get();

        assertTrue(output.getContent().contains("Entries: 5"));
        assertTrue(output.getContent().contains("... 3 more entries not shown"));
    }

    @Test
    void shouldFailForMissingDirectory() throws Exception {
        ToolOutput output = tool.execute(Map.of("path", "nope"), ToolContext.builder().build()).get();

        assertTrue(output.isError());
        assertTrue(output.getContent().startsWith("Directory not found"));
    }

    @Test
    void shouldFailForRegularFile() throws Exception {
        Files.writeString(tempDir.resolve("file.txt"), "x");

        ToolOutput output = tool.execute(Map.of("path", "file.txt"), ToolContext.builder().build()).get();

        assertTrue(output.getContent().startsWith("Not a directory"));
    }

    @Test
    void shouldFormatSizes() {
        assertEquals("512 B", ListFilesTool.formatSize(512));
        assertEquals("1.5 KB", ListFilesTool.formatSize(1536));
        assertEquals("2.0 MB", ListFilesTool.formatSize(2L * 1024 * 1024));
    }
}
