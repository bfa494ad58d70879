package me.golemcore.taskcore.domain.component;

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

import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in capability exposed to the model.
 *
 * <p>
 * Every Spring bean implementing this interface is registered in the
 * {@link me.golemcore.taskcore.domain.service.CapabilityRegistry} at startup.
 */
public interface CapabilityComponent {

    CapabilityDefinition getDefinition();

    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getCapabilityName() {
        return getDefinition().getName();
    }

    default boolean isEnabled() {
        return true;
    }
}
