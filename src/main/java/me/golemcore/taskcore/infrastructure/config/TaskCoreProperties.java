package me.golemcore.taskcore.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the task core, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code taskcore.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - local storage root for write-ahead records
 * and plugin manifests</li>
 * <li>{@link LaneProperties} - shutdown grace and startup recovery</li>
 * <li>{@link ToolLoopProperties} - tool-calling loop bounds</li>
 * <li>{@link AssistantProperties} - primary assistant role</li>
 * <li>{@link RoleProperties} - predefined sub-agent roles</li>
 * <li>{@link PluginProperties} - plugin directory and execution limits</li>
 * <li>{@link LlmProperties} - model provider</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "taskcore")
@Data
public class TaskCoreProperties {

    private StorageProperties storage = new StorageProperties();
    private LaneProperties lanes = new LaneProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private AssistantProperties assistant = new AssistantProperties();
    private Map<String, RoleProperties> roles = new LinkedHashMap<>();
    private PluginProperties plugins = new PluginProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/taskcore";
    }

    @Data
    public static class DirectoriesProperties {
        private String queue = "queue";
        private String manifests = "plugin-manifests";
    }

    // ==================== LANES ====================

    @Data
    public static class LaneProperties {
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private boolean recoverOnStartup = true;
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        private int maxRounds = 5;
        private String fallbackReply = "(no response from the model)";
        private long llmTimeoutMs = 120000;
    }

    @Data
    public static class AssistantProperties {
        private String systemInstructions = "You are a helpful assistant. Use the available tools when they help.";
        private int maxReplyTokens = 4096;
        private String failureReply = "Sorry, something went wrong while processing your request.";
    }

    @Data
    public static class RoleProperties {
        private String displayName;
        private String systemInstructions;
        /**
         * Allowed capability names. Unset means unrestricted.
         */
        private List<String> tools;
        private int maxReplyTokens = 4096;
    }

    // ==================== PLUGINS ====================

    @Data
    public static class PluginProperties {
        private boolean enabled = true;
        private String directory = "${user.home}/.golemcore/taskcore/plugins";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxConcurrentRuns = 4;
        private int maxOutputChars = 20000;
        private boolean installEnabled = true;
        private List<String> allowedInterpreters = new ArrayList<>(List.of("sh", "bash", "python3", "node"));
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature;
        private long timeoutMs = 60000;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
