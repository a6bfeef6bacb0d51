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

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Command screening, environment sanitizing and process-tree termination
 * shared by the foreground and background shell tools.
 */
final class ShellCommandPolicy {

    static final String BLOCKED_MESSAGE = "Command blocked for security reasons";

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*",
            "mkfs", "dd if=/dev",
            ":(){ :|:& };:", // Fork bomb
            "shutdown", "reboot", "halt", "poweroff",
            "passwd", "useradd", "userdel", "usermod",
            "chmod 777 /",
            "sudo su", "su -",
            "> /dev/sda");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile(">(\\s*)/dev/(?!null)"),
            Pattern.compile("curl.*\\|.*sh"),
            Pattern.compile("wget.*\\|.*sh"),
            Pattern.compile("eval\\s*\\$"),
            Pattern.compile("base64\\s*-d.*\\|.*(sh|bash)"),
            Pattern.compile("/etc/shadow"));

    private static final Set<String> ALLOWED_ENV_VARS = Set.of(
            "PATH", "HOME", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private ShellCommandPolicy() {
    }

    /**
     * @return true if the command matches a blocked command or pattern
     */
    static boolean isBlocked(String command) {
        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                return true;
            }
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A {@code /bin/sh -c} builder running in {@code workDir} with only the
     * allow-listed environment variables.
     */
    static ProcessBuilder processBuilder(String command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.directory(workDir.toFile());
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(ALLOWED_ENV_VARS);
        env.put("PWD", workDir.toString());
        return pb;
    }

    /**
     * Stops the process and its descendants, forcibly after a two second grace.
     */
    static void terminate(Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
