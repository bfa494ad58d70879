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

package me.golemcore.taskcore.port.outbound;

import me.golemcore.taskcore.domain.model.PluginDescriptor;
import me.golemcore.taskcore.domain.model.PluginExecutionException;
import me.golemcore.taskcore.domain.model.PluginLoadException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runtime that understands the plugin file format and executes plugin entry
 * points in isolation from the host process.
 */
public interface PluginRuntimePort {

    /**
     * Parse and validate a plugin file on disk.
     */
    PluginDescriptor load(Path file) throws PluginLoadException;

    /**
     * Validate plugin source text before it is written to disk.
     *
     * @return the declared descriptor, without a location
     */
    PluginDescriptor inspect(String source) throws PluginLoadException;

    /**
     * Run the plugin entry point. Blocks the calling thread until the plugin
     * finishes; an interrupt aborts the invocation.
     */
    String execute(PluginDescriptor plugin, String action, Map<String, Object> arguments)
            throws PluginExecutionException, InterruptedException;
}
