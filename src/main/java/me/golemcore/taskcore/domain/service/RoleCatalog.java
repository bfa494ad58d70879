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
import me.golemcore.taskcore.domain.model.RoleProfile;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role profiles available to the tool-calling loop.
 *
 * <p>
 * The primary {@code assistant} role is unrestricted and drives every lane
 * item. Sub-agent roles come from {@code taskcore.roles.*} (predefined) and
 * from {@link #registerRole(RoleProfile)} at runtime (custom). A custom role
 * with the name of a predefined one shadows it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleCatalog {

    public static final String ASSISTANT_ROLE = "assistant";

    private final TaskCoreProperties properties;

    private Map<String, RoleProfile> predefined = Map.of();
    private final Map<String, RoleProfile> custom = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        Map<String, RoleProfile> roles = new LinkedHashMap<>();
        for (Map.Entry<String, TaskCoreProperties.RoleProperties> entry : properties.getRoles().entrySet()) {
            roles.put(entry.getKey(), toProfile(entry.getKey(), entry.getValue()));
        }
        this.predefined = Collections.unmodifiableMap(roles);
        log.info("[Roles] predefined sub-agent roles: {}", predefined.keySet());
    }

    public RoleProfile assistantRole() {
        TaskCoreProperties.AssistantProperties assistant = properties.getAssistant();
        return RoleProfile.builder()
                .name(ASSISTANT_ROLE)
                .displayName("Assistant")
                .systemInstructions(assistant.getSystemInstructions())
                .capabilityWhitelist(null)
                .maxReplyTokens(assistant.getMaxReplyTokens())
                .build();
    }

    public Optional<RoleProfile> find(String roleName) {
        if (roleName == null) {
            return Optional.empty();
        }
        RoleProfile role = custom.get(roleName);
        return role != null ? Optional.of(role) : Optional.ofNullable(predefined.get(roleName));
    }

    public void registerRole(RoleProfile role) {
        Objects.requireNonNull(role, "role");
        if (role.getName() == null || role.getName().isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (ASSISTANT_ROLE.equals(role.getName())) {
            throw new IllegalArgumentException("Role name '" + ASSISTANT_ROLE + "' is reserved");
        }
        custom.put(role.getName(), role);
        log.info("[Roles] custom role registered: '{}'", role.getName());
    }

    /**
     * Predefined role names first, then custom ones not shadowing a predefined
     * name.
     */
    public List<String> availableRoles() {
        List<String> names = new ArrayList<>(predefined.keySet());
        custom.keySet().stream()
                .filter(name -> !predefined.containsKey(name))
                .sorted()
                .forEach(names::add);
        return names;
    }

    public List<RoleProfile> listRoles() {
        return availableRoles().stream()
                .map(this::find)
                .flatMap(Optional::stream)
                .toList();
    }

    private RoleProfile toProfile(String name, TaskCoreProperties.RoleProperties props) {
        return RoleProfile.builder()
                .name(name)
                .displayName(props.getDisplayName())
                .systemInstructions(props.getSystemInstructions())
                .capabilityWhitelist(props.getTools() != null ? new LinkedHashSet<>(props.getTools()) : null)
                .maxReplyTokens(props.getMaxReplyTokens())
                .build();
    }
}
