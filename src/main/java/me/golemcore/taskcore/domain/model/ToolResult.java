package me.golemcore.taskcore.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a built-in capability component execution.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;

    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Text handed back to the model.
     */
    public String toText() {
        if (success) {
            return output != null ? output : "";
        }
        return "Error: " + (error != null ? error : "unknown failure");
    }
}
