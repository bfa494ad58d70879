package me.golemcore.taskcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore TaskCore.
 *
 * <p>
 * TaskCore is the task-execution core of a conversational assistant. It accepts
 * work from many concurrent transports and processes it in order per lane,
 * safely across restarts.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Lane Queue</b> - strict FIFO per originating identity, concurrent
 * across identities, backed by write-ahead records on disk</li>
 * <li><b>Tool-Calling Loop</b> - bounded model conversation with a
 * role-specific capability whitelist</li>
 * <li><b>Sub-Agents</b> - delegated missions run under restricted roles</li>
 * <li><b>Plugins</b> - hot-reloadable subprocess plugins with a wall-clock
 * timeout</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → REST controllers, SubmissionPort
 * Domain Layer       → LaneQueueService, ToolCallingLoop, PluginHostService
 * Infrastructure     → LLM/Storage/Plugin runtime/HTTP adapters
 * </pre>
 *
 * <p>
 * All configuration via {@code application.properties} under
 * {@code taskcore.*}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskCoreApplication.class, args);
    }

}
