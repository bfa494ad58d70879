package me.golemcore.taskcore.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.component.CapabilityComponent;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.CapabilityDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the enabled {@link CapabilityComponent} beans at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CapabilityBootstrap {

    private final CapabilityRegistry registry;
    private final List<CapabilityComponent> components;

    @PostConstruct
    public void registerBuiltins() {
        List<CapabilityDescriptor> descriptors = new ArrayList<>();
        for (CapabilityComponent component : components) {
            if (!component.isEnabled()) {
                log.info("[Capabilities] skipping disabled component '{}'", component.getCapabilityName());
                continue;
            }
            descriptors.add(toDescriptor(component));
        }
        registry.replace(List.of(), descriptors);
        log.info("[Capabilities] registered {} built-in capabilities: {}", descriptors.size(),
                descriptors.stream().map(CapabilityDescriptor::getName).toList());
    }

    static CapabilityDescriptor toDescriptor(CapabilityComponent component) {
        CapabilityDefinition definition = component.getDefinition();
        return CapabilityDescriptor.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .parameterSchema(definition.getInputSchema())
                .invoker(args -> component.execute(args).join().toText())
                .owner(CapabilityDescriptor.OWNER_BUILTIN)
                .build();
    }
}
