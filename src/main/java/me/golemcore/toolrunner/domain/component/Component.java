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

package me.golemcore.toolrunner.domain.component;

/**
 * Base interface for pluggable runtime components. Each component type (tool,
 * llm) extends this interface to provide specialized capabilities while
 * keeping a common lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier for this component.
     *
     * @return the component type (e.g., "tool", "llm")
     */
    String getComponentType();

    /**
     * Checks whether this component is currently enabled and available for use.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
