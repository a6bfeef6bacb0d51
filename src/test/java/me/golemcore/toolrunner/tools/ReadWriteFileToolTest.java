package me.golemcore.toolrunner.tools;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadWriteFileToolTest {

    @TempDir
    Path tempDir;

    private ReadFileTool readTool;
    private WriteFileTool writeTool;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        ToolRunnerProperties properties = new ToolRunnerProperties();
        properties.getTools().setWorkspace(tempDir.resolve("workspace").toString());
        WorkspacePathResolver resolver = new WorkspacePathResolver(properties);
        readTool = new ReadFileTool(resolver);
        writeTool = new WriteFileTool(resolver);
        context = ToolContext.builder().workingDirectory(tempDir).build();
    }

    @Test
    void shouldWriteThenReadRelativeToWorkingDirectory() throws Exception {
        ToolOutput written = writeTool.execute(Map.of("path", "nested/dir/note.md", "content", "# Title\n"),
                context).get();

        assertFalse(written.isError());
        assertTrue(Files.exists(tempDir.resolve("nested/dir/note.md")));

        ToolOutput read = readTool.execute(Map.of("path", "nested/dir/note.md"), context).get();
        assertEquals("# Title\n", read.getContent());
    }

    @Test
    void shouldAppendWhenRequested() throws Exception {
        Files.writeString(tempDir.resolve("log.txt"), "one\n");

        ToolOutput output = writeTool.execute(Map.of("path", "log.txt", "content", "two\n", "append", true),
                context).get();

        assertTrue(output.getContent().startsWith("Successfully appended to file"));
        assertEquals("one\ntwo\n", Files.readString(tempDir.resolve("log.txt")));
    }

    @Test
    void shouldFallBackToWorkspaceWithoutWorkingDirectory() throws Exception {
        writeTool.execute(Map.of("path", "a.txt", "content", "x"), ToolContext.builder().build()).get();

        assertTrue(Files.exists(tempDir.resolve("workspace/a.txt")));
    }

    @Test
    void shouldRequirePathAndContent() throws Exception {
        assertTrue(writeTool.execute(Map.of("content", "x"), context).get().isError());
        assertTrue(writeTool.execute(Map.of("path", "a.txt"), context).get().isError());
        assertTrue(readTool.execute(Map.of(), context).get().isError());
    }

    @Test
    void shouldReportMissingFile() throws Exception {
        ToolOutput output = readTool.execute(Map.of("path", "missing.txt"), context).get();

        assertTrue(output.isError());
        assertTrue(output.getContent().startsWith("File not found"));
    }

    @Test
    void shouldRejectDirectoryAndBinaryContent() throws Exception {
        Files.createDirectory(tempDir.resolve("dir"));
        Files.write(tempDir.resolve("blob.bin"), new byte[] { (byte) 0xC3, (byte) 0x28, (byte) 0xFF });

        assertTrue(readTool.execute(Map.of("path", "dir"), context).get().getContent().startsWith("Not a file"));
        assertTrue(readTool.execute(Map.of("path", "blob.bin"), context).get().getContent()
                .startsWith("Not a UTF-8 text file"));
    }

    @Test
    void shouldReadUnicodeText() throws Exception {
        Files.writeString(tempDir.resolve("uni.txt"), "Привет, мир", StandardCharsets.UTF_8);

        assertEquals("Привет, мир", readTool.execute(Map.of("path", "uni.txt"), context).get().getContent());
    }
}
