package me.golemcore.taskcore.domain.system.toolloop;

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

import me.golemcore.taskcore.domain.model.ConversationTurn;
import me.golemcore.taskcore.domain.service.CapabilityRegistry;

/**
 * Executes permitted tool calls through the {@link CapabilityRegistry}.
 */
public class RegistryToolExecutor implements ToolExecutorPort {

    private final CapabilityRegistry registry;

    public RegistryToolExecutor(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public ToolExecutionOutcome execute(ConversationTurn.ToolCall toolCall) {
        return ToolExecutionOutcome.of(toolCall, registry.invoke(toolCall.getName(), toolCall.getArguments()));
    }
}
