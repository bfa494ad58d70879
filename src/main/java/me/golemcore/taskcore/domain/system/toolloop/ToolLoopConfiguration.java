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

import me.golemcore.taskcore.domain.service.CapabilityRegistry;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring wiring for ToolCallingLoop (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(CapabilityRegistry capabilityRegistry) {
        return new RegistryToolExecutor(capabilityRegistry);
    }

    @Bean
    public ToolCallingLoop toolCallingLoop(LlmPort llmPort, CapabilityRegistry capabilityRegistry,
            ToolExecutorPort toolExecutorPort, TaskCoreProperties properties) {
        return new DefaultToolCallingLoop(llmPort, capabilityRegistry, toolExecutorPort, properties.getToolLoop());
    }
}
