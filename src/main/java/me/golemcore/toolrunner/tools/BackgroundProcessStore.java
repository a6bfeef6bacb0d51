/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.toolrunner.tools;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the background processes started by {@code bash_background}, grouped by
 * the session id of the {@link ToolContext} that started them. A session only
 * sees and controls its own processes.
 *
 * <p>
 * {@link #closeSession(String)} kills and forgets a session's processes;
 * {@link #shutdown()} does so for every session when the application stops.
 */
@Component
@Slf4j
public class BackgroundProcessStore {

    static final String DEFAULT_SESSION = "default";

    private final Map<String, Map<String, BackgroundProcess>> sessions = new ConcurrentHashMap<>();
    private final ToolRunnerProperties.BackgroundProcessProperties settings;
    private final Clock clock;
    private final ExecutorService readers;

    public BackgroundProcessStore(ToolRunnerProperties properties, Clock clock) {
        this.settings = properties.getTools().getBackground();
        this.clock = clock;
        this.readers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "background-output");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static String sessionOf(ToolContext context) {
        String sessionId = context != null ? context.getSessionId() : null;
        return sessionId != null && !sessionId.isBlank() ? sessionId : DEFAULT_SESSION;
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Starts {@code command} under {@code /bin/sh -c} and begins collecting its
     * output.
     *
     * @throws IllegalStateException
     *             if the session already runs the maximum number of processes
     * @throws IOException
     *             if the process cannot be started
     */
    public BackgroundProcess start(String session, String command, String description, Path workDir)
            throws IOException {
        Map<String, BackgroundProcess> processes = sessions.computeIfAbsent(session,
                key -> new ConcurrentHashMap<>());
        long running = processes.values().stream().filter(BackgroundProcess::isRunning).count();
        if (running >= settings.getMaxProcessesPerSession()) {
            throw new IllegalStateException("Too many background processes running (" + running
                    + "). Stop one with kill_bash first.");
        }

        ProcessBuilder pb = ShellCommandPolicy.processBuilder(command, workDir);
        pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        Process process = pb.start();

        String id = newId(processes);
        BackgroundProcess background = new BackgroundProcess(id, command, description, process, clock.instant(),
                settings.getMaxOutputLines());
        processes.put(id, background);

        readers.execute(() -> drain(process.getInputStream(), background.stdout(), id));
        readers.execute(() -> drain(process.getErrorStream(), background.stderr(), id));
        process.onExit().thenAccept(exited -> {
            background.markExited(exited.exitValue(), clock.instant());
            log.info("[Background] Process {} ({}) exited with {}", id, session, exited.exitValue());
        });

        log.info("[Background] Started {} for session {} (pid {}): {}", id, session, process.pid(), command);
        return background;
    }

    public Optional<BackgroundProcess> find(String session, String processId) {
        Map<String, BackgroundProcess> processes = sessions.get(session);
        return processes != null ? Optional.ofNullable(processes.get(processId)) : Optional.empty();
    }

    /**
     * Processes of one session, oldest first.
     */
    public List<BackgroundProcess> list(String session) {
        Map<String, BackgroundProcess> processes = sessions.get(session);
        if (processes == null) {
            return List.of();
        }
        List<BackgroundProcess> result = new ArrayList<>(processes.values());
        result.sort(Comparator.comparing(BackgroundProcess::getStartedAt));
        return result;
    }

    /**
     * Stops a running process. {@code force} skips the graceful signal.
     *
     * @return false if the process had already finished
     */
    public boolean kill(BackgroundProcess background, boolean force) {
        if (!background.markKilled(clock.instant())) {
            return false;
        }
        Process process = background.process();
        if (force) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        } else {
            ShellCommandPolicy.terminate(process);
        }
        log.info("[Background] Killed {} (force: {})", background.getId(), force);
        return true;
    }

    /**
     * Kills every process of the session and forgets it.
     *
     * @return number of processes that were still running
     */
    public int closeSession(String session) {
        Map<String, BackgroundProcess> processes = sessions.remove(session);
        if (processes == null) {
            return 0;
        }
        int killed = 0;
        for (BackgroundProcess background : processes.values()) {
            if (kill(background, false)) {
                killed++;
            }
        }
        log.debug("[Background] Closed session {}, killed {} processes", session, killed);
        return killed;
    }

    @PreDestroy
    public void shutdown() {
        int killed = 0;
        for (String session : new ArrayList<>(sessions.keySet())) {
            killed += closeSession(session);
        }
        if (killed > 0) {
            log.info("[Background] Killed {} background processes on shutdown", killed);
        }
        readers.shutdownNow();
        try {
            if (!readers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Background] Output readers did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void drain(InputStream stream, BackgroundProcess.LineBuffer buffer, String id) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                buffer.add(line);
                line = reader.readLine();
            }
        } catch (IOException e) {
            log.debug("[Background] Output of {} closed: {}", id, e.getMessage());
        }
    }

    private static String newId(Map<String, BackgroundProcess> existing) {
        String id = UUID.randomUUID().toString().substring(0, 6);
        while (existing.containsKey(id)) {
            id = UUID.randomUUID().toString().substring(0, 6);
        }
        return id;
    }
}
