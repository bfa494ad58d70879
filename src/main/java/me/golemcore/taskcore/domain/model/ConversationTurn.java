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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One turn of a tool-calling conversation.
 */
@Data
@Builder
public class ConversationTurn {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role; // system, user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool result turns
    private String toolName; // Tool name for tool result turns

    public static ConversationTurn system(String content) {
        return ConversationTurn.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static ConversationTurn user(String content) {
        return ConversationTurn.builder().role(ROLE_USER).content(content).build();
    }

    public static ConversationTurn toolResult(ToolCall call, String content) {
        return ConversationTurn.builder()
                .role(ROLE_TOOL)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .content(content)
                .build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Tool call requested by the model.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
