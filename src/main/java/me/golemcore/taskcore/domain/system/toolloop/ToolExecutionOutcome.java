package me.golemcore.taskcore.domain.system.toolloop;

import me.golemcore.taskcore.domain.model.ConversationTurn;

public record ToolExecutionOutcome(String toolCallId, String toolName, String content, boolean denied) {

    static final String DENIAL_TEMPLATE = "[DENIED] capability '%s' not permitted for this role";

    public static ToolExecutionOutcome denied(ConversationTurn.ToolCall toolCall) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(),
                String.format(DENIAL_TEMPLATE, toolCall.getName()), true);
    }

    public static ToolExecutionOutcome of(ConversationTurn.ToolCall toolCall, String content) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), content, false);
    }
}
