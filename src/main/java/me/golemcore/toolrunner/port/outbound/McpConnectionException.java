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

package me.golemcore.toolrunner.port.outbound;

/**
 * A tool server could not be reached, did not complete the handshake, or is
 * not connected.
 */
public class McpConnectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String serverName;

    public McpConnectionException(String serverName, String message) {
        super(message);
        this.serverName = serverName;
    }

    public McpConnectionException(String serverName, String message, Throwable cause) {
        super(message, cause);
        this.serverName = serverName;
    }

    public String getServerName() {
        return serverName;
    }
}
