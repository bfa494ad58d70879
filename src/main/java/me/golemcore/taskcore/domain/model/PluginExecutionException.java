package me.golemcore.taskcore.domain.model;

/**
 * Raised when a plugin process fails or exits with a non-zero code.
 */
public class PluginExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public PluginExecutionException(String message) {
        super(message);
    }

    public PluginExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
