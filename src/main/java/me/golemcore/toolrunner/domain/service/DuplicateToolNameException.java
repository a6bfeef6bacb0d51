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

package me.golemcore.toolrunner.domain.service;

/**
 * Thrown when a tool name is already registered by a different owner.
 */
public class DuplicateToolNameException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final String existingOwner;

    public DuplicateToolNameException(String toolName, String existingOwner, String newOwner) {
        super("Tool '" + toolName + "' is already registered by '" + existingOwner
                + "', cannot register it for '" + newOwner + "'");
        this.toolName = toolName;
        this.existingOwner = existingOwner;
    }

    public String getToolName() {
        return toolName;
    }

    public String getExistingOwner() {
        return existingOwner;
    }
}
