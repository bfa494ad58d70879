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
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.domain.model.PluginStatus;
import me.golemcore.taskcore.domain.model.ToolResult;
import me.golemcore.taskcore.domain.service.PluginHostService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists loaded plugins with their actions and readiness.
 */
@Component
@RequiredArgsConstructor
public class ListPluginsTool implements CapabilityComponent {

    public static final String NAME = "list_plugins";

    private final PluginHostService pluginHost;

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.simple(NAME,
                "List the installed plugins with their actions and whether they are ready to run.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        List<PluginStatus> plugins = pluginHost.listPlugins();
        if (plugins.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.success("No plugins are loaded."));
        }

        StringBuilder sb = new StringBuilder("Plugins:\n");
        for (PluginStatus status : plugins) {
            PluginManifest manifest = status.manifest();
            sb.append("- ").append(manifest.getName())
                    .append(" (").append(manifest.getVersion()).append(")");
            if (!manifest.isEnabled()) {
                sb.append(" [disabled]");
            } else if (!status.ready()) {
                sb.append(" [not ready, missing env: ").append(String.join(", ", status.missingEnv())).append(']');
            }
            if (manifest.getDescription() != null && !manifest.getDescription().isBlank()) {
                sb.append(": ").append(manifest.getDescription());
            }
            if (!manifest.getDeclaredActions().isEmpty()) {
                sb.append(" | actions: ").append(String.join(", ", manifest.getDeclaredActions()));
            }
            sb.append('\n');
        }
        return CompletableFuture.completedFuture(ToolResult.success(sb.toString().trim(), plugins));
    }
}
