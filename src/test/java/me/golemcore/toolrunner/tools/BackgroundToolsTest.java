package me.golemcore.toolrunner.tools;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class BackgroundToolsTest {

    @TempDir
    Path tempDir;

    private BackgroundProcessStore store;
    private BashBackgroundTool startTool;
    private BashOutputTool outputTool;
    private KillBashTool killTool;
    private ListBackgroundTool listTool;
    private ToolContext alice;
    private ToolContext bob;

    @BeforeEach
    void setUp() {
        ToolRunnerProperties properties = new ToolRunnerProperties();
        properties.getTools().setWorkspace(tempDir.toString());
        properties.getTools().getBackground().setMaxProcessesPerSession(2);
        store = new BackgroundProcessStore(properties, Clock.systemUTC());
        startTool = new BashBackgroundTool(store, new WorkspacePathResolver(properties));
        outputTool = new BashOutputTool(store);
        killTool = new KillBashTool(store);
        listTool = new ListBackgroundTool(store);
        alice = ToolContext.builder().workingDirectory(tempDir).sessionId("alice").build();
        bob = ToolContext.builder().workingDirectory(tempDir).sessionId("bob").build();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void shouldCollectOutputOfFinishedProcess() throws Exception {
        String id = start(alice, "echo ready; echo oops 1>&2; echo done");
        BackgroundProcess process = store.find("alice", id).orElseThrow();
        waitUntilFinished(process);
        waitForLines(process, 2);

        ToolOutput output = outputTool.execute(Map.of("processId", id), alice).get();

        assertFalse(output.isError());
        assertEquals("COMPLETED", output.getMetadata().get("status"));
        assertTrue(output.getContent().contains("ready\ndone\n"));
        assertTrue(output.getContent().contains("oops"));
    }

    @Test
    void shouldFilterAndTailOutput() throws Exception {
        String id = start(alice, "for i in 1 2 3 4 5 6; do echo line$i; done; echo error-x");
        BackgroundProcess process = store.find("alice", id).orElseThrow();
        waitUntilFinished(process);
        waitForLines(process, 7);

        ToolOutput tail = outputTool.execute(Map.of("processId", id, "tailLines", 2), alice).get();
        assertTrue(tail.getContent().contains("line6\nerror-x\n"));
        assertFalse(tail.getContent().contains("line5"));

        ToolOutput filtered = outputTool.execute(Map.of("processId", id, "filter", "line[24]"), alice).get();
        assertTrue(filtered.getContent().contains("line2\nline4\n"));
        assertFalse(filtered.getContent().contains("line3"));

        ToolOutput invalid = outputTool.execute(Map.of("processId", id, "filter", "line[("), alice).get();
        assertTrue(invalid.isError());
    }

    @Test
    void shouldKillRunningProcessAndReportStatus() throws Exception {
        String id = start(alice, "sleep 30");
        BackgroundProcess process = store.find("alice", id).orElseThrow();

        ToolOutput killed = killTool.execute(Map.of("processId", id), alice).get();

        assertFalse(killed.isError());
        assertEquals(BackgroundProcess.Status.KILLED, process.getStatus());
        assertEquals(-1, process.getExitCode());
        process.process().onExit().get();

        ToolOutput again = killTool.execute(Map.of("processId", id, "signal", "SIGKILL"), alice).get();
        assertFalse(again.isError());
        assertTrue(again.getContent().contains("is not running (status: KILLED)"));
    }

    @Test
    void shouldIsolateSessions() throws Exception {
        String id = start(alice, "sleep 30");

        ToolOutput foreign = outputTool.execute(Map.of("processId", id), bob).get();
        assertEquals(ToolFailureKind.NOT_FOUND, foreign.getFailureKind());
        assertEquals(ToolFailureKind.NOT_FOUND,
                killTool.execute(Map.of("processId", id), bob).get().getFailureKind());
        assertEquals("No background processes", listTool.execute(Map.of(), bob).get().getContent());

        ToolOutput listed = listTool.execute(Map.of(), alice).get();
        assertEquals(1, listed.getMetadata().get("count"));
        assertTrue(listed.getContent().contains(id + " [RUNNING]"));
        assertTrue(store.find("alice", id).orElseThrow().isRunning());
    }

    @Test
    void shouldHideCompletedProcessesWhenAsked() throws Exception {
        String id = start(alice, "true");
        waitUntilFinished(store.find("alice", id).orElseThrow());

        assertEquals(1, listTool.execute(Map.of(), alice).get().getMetadata().get("count"));
        assertEquals("No running background processes",
                listTool.execute(Map.of("showCompleted", false), alice).get().getContent());
    }

    @Test
    void shouldLimitRunningProcessesPerSession() throws Exception {
        start(alice, "sleep 30");
        start(alice, "sleep 30");

        ToolOutput third = startTool.execute(Map.of("command", "sleep 30"), alice).get();

        assertEquals(ToolFailureKind.LIMIT_EXCEEDED, third.getFailureKind());
        assertFalse(startTool.execute(Map.of("command", "sleep 30"), bob).get().isError());
    }

    @Test
    void shouldRejectBlockedCommand() throws Exception {
        ToolOutput output = startTool.execute(Map.of("command", "sudo su"), alice).get();

        assertTrue(output.isError());
        assertTrue(store.list("alice").isEmpty());
    }

    @Test
    void shouldKillEverythingOnShutdown() throws Exception {
        BackgroundProcess first = store.find("alice", start(alice, "sleep 30")).orElseThrow();
        BackgroundProcess second = store.find("bob", start(bob, "sleep 30")).orElseThrow();

        store.shutdown();

        assertEquals(BackgroundProcess.Status.KILLED, first.getStatus());
        assertEquals(BackgroundProcess.Status.KILLED, second.getStatus());
        assertTrue(store.list("alice").isEmpty());
    }

    @Test
    void shouldUseDefaultSessionWithoutSessionId() {
        assertEquals("default", BackgroundProcessStore.sessionOf(ToolContext.builder().build()));
        assertEquals("default", BackgroundProcessStore.sessionOf(null));
        assertEquals("alice", BackgroundProcessStore.sessionOf(alice));
    }

    private String start(ToolContext context, String command) throws Exception {
        ToolOutput output = startTool.execute(Map.of("command", command), context).get();
        assertFalse(output.isError(), output.getContent());
        return (String) output.getMetadata().get("processId");
    }

    private static void waitUntilFinished(BackgroundProcess process) throws Exception {
        process.process().onExit().get();
        long deadline = System.currentTimeMillis() + 5_000;
        while (process.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }

    private static void waitForLines(BackgroundProcess process, int lines) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (process.stdoutLineCount() + process.stderrLineCount() < lines
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
    }
}
