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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A shell command started by {@code bash_background}, with the last lines of
 * its stdout and stderr.
 */
public final class BackgroundProcess {

    /**
     * Lifecycle of a background command.
     */
    public enum Status {
        RUNNING, COMPLETED, FAILED, KILLED
    }

    private final String id;
    private final String command;
    private final String description;
    private final Process process;
    private final Instant startedAt;
    private final LineBuffer stdout;
    private final LineBuffer stderr;

    private Status status = Status.RUNNING;
    private Integer exitCode;
    private Instant completedAt;

    BackgroundProcess(String id, String command, String description, Process process, Instant startedAt,
            int maxLines) {
        this.id = id;
        this.command = command;
        this.description = description;
        this.process = process;
        this.startedAt = startedAt;
        this.stdout = new LineBuffer(maxLines);
        this.stderr = new LineBuffer(maxLines);
    }

    public String getId() {
        return id;
    }

    public String getCommand() {
        return command;
    }

    public String getDescription() {
        return description;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getPid() {
        return process.pid();
    }

    public synchronized Status getStatus() {
        return status;
    }

    public synchronized Integer getExitCode() {
        return exitCode;
    }

    public synchronized boolean isRunning() {
        return status == Status.RUNNING;
    }

    public long runtimeSeconds(Clock clock) {
        Instant end;
        synchronized (this) {
            end = completedAt != null ? completedAt : clock.instant();
        }
        return Duration.between(startedAt, end).toSeconds();
    }

    public List<String> stdoutTail(int lines, Pattern filter) {
        return stdout.tail(lines, filter);
    }

    public List<String> stderrTail(int lines, Pattern filter) {
        return stderr.tail(lines, filter);
    }

    public int stdoutLineCount() {
        return stdout.total();
    }

    public int stderrLineCount() {
        return stderr.total();
    }

    Process process() {
        return process;
    }

    LineBuffer stdout() {
        return stdout;
    }

    LineBuffer stderr() {
        return stderr;
    }

    synchronized void markExited(int code, Instant at) {
        if (status != Status.RUNNING) {
            return;
        }
        status = code == 0 ? Status.COMPLETED : Status.FAILED;
        exitCode = code;
        completedAt = at;
    }

    synchronized boolean markKilled(Instant at) {
        if (status != Status.RUNNING) {
            return false;
        }
        status = Status.KILLED;
        exitCode = -1;
        completedAt = at;
        return true;
    }

    /**
     * Keeps the most recent lines of one output stream.
     */
    static final class LineBuffer {
        private final int capacity;
        private final Deque<String> lines = new ArrayDeque<>();
        private int total;

        LineBuffer(int capacity) {
            this.capacity = Math.max(1, capacity);
        }

        synchronized void add(String line) {
            if (line.isBlank()) {
                return;
            }
            lines.addLast(line);
            total++;
            while (lines.size() > capacity) {
                lines.removeFirst();
            }
        }

        synchronized List<String> tail(int count, Pattern filter) {
            List<String> matching = new ArrayList<>();
            for (String line : lines) {
                if (filter == null || filter.matcher(line).find()) {
                    matching.add(line);
                }
            }
            int from = Math.max(0, matching.size() - Math.max(0, count));
            return new ArrayList<>(matching.subList(from, matching.size()));
        }

        synchronized int total() {
            return total;
        }
    }
}
