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

package me.golemcore.taskcore.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.taskcore.domain.component.CapabilityComponent;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.ToolResult;
import me.golemcore.taskcore.domain.service.PluginHostService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs any loaded plugin by name. Plugin errors and timeouts come back as
 * text, not as a failed result.
 */
@Component
@RequiredArgsConstructor
public class RunPluginTool implements CapabilityComponent {

    public static final String NAME = "run_plugin";

    private final PluginHostService pluginHost;

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Run an action of an installed plugin. Use list_plugins to see what is available.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "plugin_name", Map.of(
                                        "type", "string",
                                        "description", "Name of the plugin"),
                                "action", Map.of(
                                        "type", "string",
                                        "description", "Action to run"),
                                "arguments", Map.of(
                                        "type", "object",
                                        "description", "Arguments passed to the plugin as a JSON object")),
                        "required", List.of("plugin_name", "action")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object pluginName = parameters.get("plugin_name");
        if (pluginName == null || pluginName.toString().isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("plugin_name is required"));
        }
        Map<String, Object> arguments;
        try {
            arguments = pluginHost.toArguments(parameters.get("arguments"));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(e.getMessage()));
        }
        Object action = parameters.get("action");
        String output = pluginHost.run(pluginName.toString(), action != null ? action.toString() : null, arguments);
        return CompletableFuture.completedFuture(ToolResult.success(output));
    }
}
