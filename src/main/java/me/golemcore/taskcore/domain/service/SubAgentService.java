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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.RoleProfile;
import me.golemcore.taskcore.domain.system.toolloop.ToolCallingLoop;
import me.golemcore.taskcore.domain.system.toolloop.ToolLoopTurnResult;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Runs ephemeral sub-agents: the same tool-calling loop under a restricted
 * role, with the answer wrapped in a block labeled with the role's display
 * name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubAgentService {

    static final int MAX_DELEGATION_DEPTH = 2;
    private static final String RULE = "─".repeat(40);

    private static final ThreadLocal<Integer> DEPTH = ThreadLocal.withInitial(() -> 0);

    private final RoleCatalog roleCatalog;
    private final ToolCallingLoop toolCallingLoop;

    public String delegate(String roleName, String mission, String context) {
        RoleProfile role = roleCatalog.find(roleName).orElse(null);
        if (role == null) {
            return "Error: sub-agent role '" + roleName + "' does not exist. Available roles: "
                    + String.join(", ", roleCatalog.availableRoles());
        }
        if (mission == null || mission.isBlank()) {
            return "Error: mission must not be empty";
        }

        int depth = DEPTH.get();
        if (depth >= MAX_DELEGATION_DEPTH) {
            log.warn("[SubAgent] delegation depth {} reached, refusing '{}'", depth, roleName);
            return "Error: delegation depth limit reached (" + MAX_DELEGATION_DEPTH + ")";
        }

        log.info("[SubAgent] spawning '{}' for mission: {}", role.resolveDisplayName(), abbreviate(mission));
        DEPTH.set(depth + 1);
        try {
            ToolLoopTurnResult result = toolCallingLoop.execute(role, mission, context);
            log.info("[SubAgent] '{}' finished after {} tool call(s)", role.resolveDisplayName(),
                    result.toolExecutions());
            return wrap(role, result.content());
        } finally {
            if (depth == 0) {
                DEPTH.remove();
            } else {
                DEPTH.set(depth);
            }
        }
    }

    static String wrap(RoleProfile role, String content) {
        return "[" + role.resolveDisplayName().toUpperCase(Locale.ROOT) + "]\n"
                + RULE + "\n"
                + content + "\n"
                + RULE;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
