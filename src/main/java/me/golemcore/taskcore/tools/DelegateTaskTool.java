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
import me.golemcore.taskcore.domain.service.RoleCatalog;
import me.golemcore.taskcore.domain.service.SubAgentService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hands a mission to a sub-agent running under a restricted role.
 *
 * <p>
 * Runs on the calling thread: the sub-agent's answer is part of the caller's
 * current tool round.
 */
@Component
@RequiredArgsConstructor
public class DelegateTaskTool implements CapabilityComponent {

    public static final String NAME = "delegate_task";

    private final SubAgentService subAgentService;
    private final RoleCatalog roleCatalog;

    @Override
    public CapabilityDefinition getDefinition() {
        return CapabilityDefinition.builder()
                .name(NAME)
                .description("Delegate a focused mission to a specialist sub-agent and get its answer back. "
                        + "Available roles: " + String.join(", ", roleCatalog.availableRoles()))
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "role", Map.of(
                                        "type", "string",
                                        "description", "Sub-agent role"),
                                "mission", Map.of(
                                        "type", "string",
                                        "description", "What the sub-agent should do"),
                                "context", Map.of(
                                        "type", "string",
                                        "description", "Optional background for the sub-agent")),
                        "required", List.of("role", "mission")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object role = parameters.get("role");
        if (role == null || role.toString().isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("role is required"));
        }
        Object mission = parameters.get("mission");
        Object context = parameters.get("context");
        String answer = subAgentService.delegate(role.toString(),
                mission != null ? mission.toString() : null,
                context != null ? context.toString() : null);
        return CompletableFuture.completedFuture(ToolResult.success(answer));
    }
}
