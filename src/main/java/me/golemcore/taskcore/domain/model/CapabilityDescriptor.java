package me.golemcore.taskcore.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Registered capability: schema plus invoker. The name is the only identity.
 *
 * <p>
 * {@code owner} groups descriptors contributed by the same source (a plugin
 * name, or {@code "builtin"}) so they can be swapped together.
 */
@Value
@Builder
public class CapabilityDescriptor {

    public static final String OWNER_BUILTIN = "builtin";

    String name;
    String description;
    Map<String, Object> parameterSchema;
    CapabilityInvoker invoker;
    @Builder.Default
    String owner = OWNER_BUILTIN;

    public CapabilityDefinition toDefinition() {
        return CapabilityDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(parameterSchema != null ? parameterSchema
                        : Map.of("type", "object", "properties", Map.of()))
                .build();
    }
}
