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

import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.ConversationTurn;
import me.golemcore.taskcore.domain.model.LlmRequest;
import me.golemcore.taskcore.domain.model.LlmResponse;
import me.golemcore.taskcore.domain.model.RoleProfile;
import me.golemcore.taskcore.domain.service.CapabilityRegistry;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Contract: 1) LLM returns tool calls, 2) permitted calls are executed and
 * denied ones answered with a fixed marker, 3) results are appended in request
 * order and the LLM is asked again, up to {@code maxRounds} rounds. The last
 * response content is the answer. Reaching the round limit is not an error.
 *
 * <p>
 * The whitelist is checked on every call even though the model is only offered
 * permitted capabilities: a model may still name one it was never shown.
 */
public class DefaultToolCallingLoop implements ToolCallingLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolCallingLoop.class);

    static final String CONTEXT_OPEN = "[RECENT CONVERSATION CONTEXT]";
    static final String CONTEXT_CLOSE = "[END CONTEXT]";

    private final LlmPort llmPort;
    private final CapabilityRegistry registry;
    private final ToolExecutorPort toolExecutor;
    private final TaskCoreProperties.ToolLoopProperties settings;

    public DefaultToolCallingLoop(LlmPort llmPort, CapabilityRegistry registry, ToolExecutorPort toolExecutor,
            TaskCoreProperties.ToolLoopProperties settings) {
        this.llmPort = llmPort;
        this.registry = registry;
        this.toolExecutor = toolExecutor;
        this.settings = settings != null ? settings : new TaskCoreProperties.ToolLoopProperties();
    }

    @Override
    public ToolLoopTurnResult execute(RoleProfile role, String initialPrompt, String contextHint) {
        List<CapabilityDefinition> tools = effectiveCapabilities(role);
        Set<String> permitted = new LinkedHashSet<>();
        for (CapabilityDefinition tool : tools) {
            permitted.add(tool.getName());
        }

        List<ConversationTurn> turns = new ArrayList<>();
        turns.add(ConversationTurn.system(buildSystemContent(role, contextHint)));
        turns.add(ConversationTurn.user(initialPrompt != null ? initialPrompt : ""));

        int maxRounds = Math.max(0, settings.getMaxRounds());
        int rounds = 0;
        int toolExecutions = 0;

        // 1) Initial LLM call
        LlmResponse response = chat(role, turns, tools);
        int llmCalls = 1;

        while (response != null && response.hasToolCalls() && rounds < maxRounds) {
            rounds++;

            // 2) Append assistant turn with its tool calls
            turns.add(ConversationTurn.builder()
                    .role(ConversationTurn.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .toolCalls(List.copyOf(response.getToolCalls()))
                    .build());

            // 3) Execute in request order, denying anything outside the effective set
            for (ConversationTurn.ToolCall call : response.getToolCalls()) {
                ToolExecutionOutcome outcome = executeCall(role, permitted, call);
                toolExecutions++;
                turns.add(ConversationTurn.toolResult(call, outcome.content()));
            }

            // 4) Ask again with the results
            response = chat(role, turns, tools);
            llmCalls++;
        }

        boolean roundLimitReached = response != null && response.hasToolCalls();
        if (roundLimitReached) {
            log.info("[ToolLoop] role '{}' reached max rounds ({}), returning last content", role.getName(),
                    maxRounds);
        }

        String content = response != null ? response.getContent() : null;
        if (content == null || content.isBlank()) {
            content = settings.getFallbackReply();
        }
        log.debug("[ToolLoop] role '{}' finished: llmCalls={}, toolExecutions={}", role.getName(), llmCalls,
                toolExecutions);
        return new ToolLoopTurnResult(content, Collections.unmodifiableList(turns), llmCalls, toolExecutions,
                roundLimitReached);
    }

    private ToolExecutionOutcome executeCall(RoleProfile role, Set<String> permitted,
            ConversationTurn.ToolCall call) {
        if (!permitted.contains(call.getName())) {
            log.warn("[ToolLoop] role '{}' requested '{}' outside its capabilities", role.getName(),
                    call.getName());
            return ToolExecutionOutcome.denied(call);
        }
        try {
            return toolExecutor.execute(call);
        } catch (RuntimeException e) {
            return ToolExecutionOutcome.of(call, "Error executing '" + call.getName() + "': " + e.getMessage());
        }
    }

    private List<CapabilityDefinition> effectiveCapabilities(RoleProfile role) {
        List<CapabilityDefinition> all = registry.listDefinitions();
        if (!role.isRestricted()) {
            return all;
        }
        return all.stream()
                .filter(def -> role.permits(def.getName()))
                .toList();
    }

    private String buildSystemContent(RoleProfile role, String contextHint) {
        String instructions = role.getSystemInstructions() != null ? role.getSystemInstructions() : "";
        if (contextHint == null || contextHint.isBlank()) {
            return instructions;
        }
        return CONTEXT_OPEN + "\n" + contextHint.strip() + "\n" + CONTEXT_CLOSE + "\n\n" + instructions;
    }

    private LlmResponse chat(RoleProfile role, List<ConversationTurn> turns, List<CapabilityDefinition> tools) {
        LlmRequest request = LlmRequest.builder()
                .turns(List.copyOf(turns))
                .tools(tools)
                .maxTokens(role.getMaxReplyTokens() > 0 ? role.getMaxReplyTokens() : null)
                .build();
        return llmPort.chat(request)
                .orTimeout(settings.getLlmTimeoutMs(), TimeUnit.MILLISECONDS)
                .join();
    }
}
