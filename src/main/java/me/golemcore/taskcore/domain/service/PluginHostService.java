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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.domain.model.CapabilityDescriptor;
import me.golemcore.taskcore.domain.model.PluginDescriptor;
import me.golemcore.taskcore.domain.model.PluginExecutionException;
import me.golemcore.taskcore.domain.model.PluginLoadException;
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.domain.model.PluginStatus;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.PluginRuntimePort;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Discovers, loads, reloads and runs script plugins.
 *
 * <p>
 * Every loaded plugin contributes a {@code plugin_<name>} capability to the
 * {@link CapabilityRegistry}, plus one {@code plugin_<name>_<tool>} capability
 * per declared tool. Loading and reloading swap these entries in a single
 * registry update, so callers see either the old or the new version.
 *
 * <p>
 * Runs go through a bounded worker pool. A run that exceeds the configured
 * timeout is reported to the caller immediately; its worker is interrupted,
 * which destroys the plugin process.
 */
@Service
@Slf4j
public class PluginHostService {

    public static final String CAPABILITY_PREFIX = "plugin_";
    static final String OWNER_PREFIX = "plugin:";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final CapabilityRegistry registry;
    private final PluginRuntimePort runtime;
    private final PluginManifestStore manifestStore;
    private final Environment environment;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TaskCoreProperties.PluginProperties settings;
    private final ExecutorService runExecutor;

    private final Object lifecycleLock = new Object();
    private final Map<String, LoadedPlugin> plugins = new ConcurrentHashMap<>();
    private Path pluginDirectory;

    public PluginHostService(CapabilityRegistry registry, PluginRuntimePort runtime,
            PluginManifestStore manifestStore, Environment environment, ObjectMapper objectMapper, Clock clock,
            TaskCoreProperties properties) {
        this.registry = registry;
        this.runtime = runtime;
        this.manifestStore = manifestStore;
        this.environment = environment;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getPlugins();
        this.runExecutor = Executors.newFixedThreadPool(Math.max(1, settings.getMaxConcurrentRuns()),
                new PluginThreadFactory());
    }

    @PostConstruct
    public void init() {
        this.pluginDirectory = Paths.get(settings.getDirectory()
                .replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        if (!settings.isEnabled()) {
            log.info("[Plugins] plugin host disabled");
            return;
        }
        try {
            Files.createDirectories(pluginDirectory);
        } catch (IOException e) {
            log.warn("[Plugins] cannot create plugin directory {}: {}", pluginDirectory, e.getMessage());
            return;
        }
        List<String> loaded = discover(pluginDirectory);
        log.info("[Plugins] {} plugin(s) loaded from {}: {}", loaded.size(), pluginDirectory, loaded);
    }

    @PreDestroy
    public void shutdown() {
        runExecutor.shutdownNow();
    }

    /**
     * Load every plugin file in the directory. Files whose name starts with
     * {@code .} or {@code _} are ignored. A file that fails to load is logged
     * and skipped.
     *
     * <p>
     * The stored manifest of a plugin seen before keeps its {@code source}, and
     * a plugin that was disabled stays disabled until {@link #reload(String)}.
     *
     * @return names of the plugins loaded by this scan
     */
    public List<String> discover(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.info("[Plugins] plugin directory {} does not exist", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> paths = Files.list(directory)) {
            files = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(p))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("[Plugins] failed to scan {}: {}", directory, e.getMessage());
            return List.of();
        }

        List<String> loaded = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Path file : files) {
            try {
                PluginDescriptor descriptor = runtime.load(file);
                String name = descriptor.getName();
                if (!seen.add(name)) {
                    log.warn("[Plugins] duplicate plugin name '{}' in {}, skipped", name, file.getFileName());
                    continue;
                }
                LoadedPlugin existing = plugins.get(name);
                if (existing != null && !descriptor.getLocation().equals(existing.descriptor().getLocation())) {
                    log.warn("[Plugins] plugin '{}' already loaded from {}, skipped {}", name,
                            existing.descriptor().getLocation(), file.getFileName());
                    continue;
                }
                PluginManifest previous = existing != null ? existing.manifest()
                        : manifestStore.find(name).orElse(null);
                String source = previous != null ? previous.getSource() : PluginManifest.SOURCE_LOCAL;
                if (previous != null && !previous.isEnabled()) {
                    keepDisabled(descriptor, source);
                    continue;
                }
                activate(descriptor, source);
                loaded.add(name);
            } catch (PluginLoadException e) {
                log.warn("[Plugins] skipped {}: {}", file.getFileName(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Plugins] failed to load {}: {}", file.getFileName(), e.getMessage(), e);
            }
        }
        return loaded;
    }

    /**
     * Load a single plugin file, recording where it came from.
     */
    public PluginManifest load(Path file, String source) throws PluginLoadException {
        PluginDescriptor descriptor = runtime.load(file);
        LoadedPlugin existing = plugins.get(descriptor.getName());
        if (existing != null && !descriptor.getLocation().equals(existing.descriptor().getLocation())) {
            throw new PluginLoadException("plugin '" + descriptor.getName() + "' is already loaded from "
                    + existing.descriptor().getLocation().getFileName());
        }
        return activate(descriptor, source);
    }

    /**
     * Re-read the plugin's file and swap its capability. On failure the
     * previous version stays active.
     */
    public PluginManifest reload(String name) throws PluginLoadException {
        LoadedPlugin current = plugins.get(name);
        if (current == null) {
            throw new PluginLoadException("plugin '" + name + "' is not loaded");
        }
        PluginDescriptor fresh;
        try {
            fresh = runtime.load(current.descriptor().getLocation());
        } catch (PluginLoadException e) {
            log.warn("[Plugins] reload of '{}' failed, previous version stays active: {}", name, e.getMessage());
            throw e;
        }
        if (!name.equals(fresh.getName())) {
            log.warn("[Plugins] reload of '{}' failed, file now declares '{}'", name, fresh.getName());
            throw new PluginLoadException("plugin file now declares '" + fresh.getName()
                    + "' instead of '" + name + "'");
        }
        PluginManifest manifest = activate(fresh, current.manifest().getSource());
        log.info("[Plugins] reloaded '{}' (version {})", name, manifest.getVersion());
        return manifest;
    }

    /**
     * Rescan the plugin directory: drop plugins whose file is gone, reload the
     * rest and load new files.
     */
    public List<String> reloadAll() {
        for (LoadedPlugin plugin : List.copyOf(plugins.values())) {
            Path location = plugin.descriptor().getLocation();
            if (location == null || !Files.exists(location)) {
                unload(plugin.descriptor().getName());
            }
        }
        return discover(pluginDirectory);
    }

    /**
     * Unregister the plugin's capability and mark its manifest disabled.
     *
     * @return {@code false} if no such plugin is loaded
     */
    public boolean disable(String name) {
        PluginManifest disabled;
        synchronized (lifecycleLock) {
            LoadedPlugin plugin = plugins.get(name);
            if (plugin == null) {
                return false;
            }
            registry.replace(registry.namesOwnedBy(OWNER_PREFIX + name), List.of());
            disabled = manifestOf(plugin.descriptor(), plugin.manifest().getSource(), false,
                    plugin.manifest().getLoadedAt());
            plugins.put(name, new LoadedPlugin(plugin.descriptor(), disabled));
        }
        manifestStore.save(disabled);
        log.info("[Plugins] disabled '{}'", name);
        return true;
    }

    /**
     * Run a plugin action. Never throws: failures, timeouts and unknown plugins
     * are reported as strings.
     */
    public String run(String name, String action, Map<String, Object> arguments) {
        LoadedPlugin plugin = plugins.get(name);
        if (plugin == null || !plugin.manifest().isEnabled()) {
            return "Error: plugin '" + name + "' is not available. Loaded: " + describeLoaded();
        }
        PluginDescriptor descriptor = plugin.descriptor();

        String resolvedAction = action;
        if ((resolvedAction == null || resolvedAction.isBlank()) && descriptor.getActions().size() == 1) {
            resolvedAction = descriptor.getActions().get(0);
        }
        if (resolvedAction == null || resolvedAction.isBlank()) {
            return errorText(name, "an action is required. Valid actions: " + describeActions(descriptor));
        }
        if (!descriptor.declaresAction(resolvedAction)) {
            return errorText(name, "unknown action '" + resolvedAction + "'. Valid actions: "
                    + describeActions(descriptor));
        }

        String finalAction = resolvedAction;
        Map<String, Object> finalArguments = arguments != null ? arguments : Map.of();
        Future<String> future;
        try {
            future = runExecutor.submit(() -> runtime.execute(descriptor, finalAction, finalArguments));
        } catch (RejectedExecutionException e) {
            return errorText(name, "plugin host is shutting down");
        }

        Duration timeout = settings.getTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Plugins] '{}' action '{}' timed out after {}", name, finalAction, timeout);
            return "[TIMEOUT] plugin '" + name + "' exceeded the timeout of " + formatTimeout(timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PluginExecutionException) {
                log.debug("[Plugins] '{}' action '{}' failed: {}", name, finalAction, cause.getMessage());
            } else {
                log.warn("[Plugins] '{}' action '{}' failed: {}", name, finalAction, cause.getMessage(), cause);
            }
            return errorText(name, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return errorText(name, "interrupted");
        }
    }

    /**
     * Loaded plugins with their readiness, ordered by name.
     */
    public List<PluginStatus> listPlugins() {
        return plugins.values().stream()
                .sorted((a, b) -> a.descriptor().getName().compareTo(b.descriptor().getName()))
                .map(this::statusOf)
                .toList();
    }

    public Optional<PluginStatus> getPlugin(String name) {
        LoadedPlugin plugin = plugins.get(name);
        return plugin != null ? Optional.of(statusOf(plugin)) : Optional.empty();
    }

    public boolean isLoaded(String name) {
        return plugins.containsKey(name);
    }

    public Path getPluginDirectory() {
        return pluginDirectory;
    }

    /**
     * Accepts plugin arguments either as an object or as a JSON string.
     */
    public Map<String, Object> toArguments(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> arguments = new LinkedHashMap<>();
            map.forEach((k, v) -> arguments.put(String.valueOf(k), v));
            return arguments;
        }
        if (value instanceof String text) {
            if (text.isBlank()) {
                return Map.of();
            }
            try {
                return objectMapper.readValue(text, ARGUMENTS_TYPE);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("arguments must be a JSON object: " + e.getOriginalMessage(), e);
            }
        }
        throw new IllegalArgumentException("arguments must be a JSON object");
    }

    private PluginManifest activate(PluginDescriptor descriptor, String source) {
        String name = descriptor.getName();
        PluginManifest manifest = manifestOf(descriptor, source, true, clock.instant());
        synchronized (lifecycleLock) {
            registry.replace(registry.namesOwnedBy(OWNER_PREFIX + name), toCapabilities(descriptor));
            plugins.put(name, new LoadedPlugin(descriptor, manifest));
        }
        manifestStore.save(manifest);
        log.info("[Plugins] loaded '{}' {} from {}", name, manifest.getVersion(),
                descriptor.getLocation() != null ? descriptor.getLocation().getFileName() : source);
        return manifest;
    }

    private void unload(String name) {
        LoadedPlugin removed;
        synchronized (lifecycleLock) {
            removed = plugins.remove(name);
            if (removed != null) {
                registry.replace(registry.namesOwnedBy(OWNER_PREFIX + name), List.of());
            }
        }
        if (removed != null) {
            log.info("[Plugins] unloaded '{}', its file is gone", name);
        }
    }

    private void keepDisabled(PluginDescriptor descriptor, String source) {
        String name = descriptor.getName();
        PluginManifest manifest = manifestOf(descriptor, source, false, clock.instant());
        synchronized (lifecycleLock) {
            registry.replace(registry.namesOwnedBy(OWNER_PREFIX + name), List.of());
            plugins.put(name, new LoadedPlugin(descriptor, manifest));
        }
        manifestStore.save(manifest);
        log.info("[Plugins] '{}' is disabled, not registering its capabilities", name);
    }

    private List<CapabilityDescriptor> toCapabilities(PluginDescriptor descriptor) {
        List<CapabilityDescriptor> capabilities = new ArrayList<>();
        capabilities.add(toCapability(descriptor));
        for (String tool : descriptor.getTools()) {
            capabilities.add(toToolCapability(descriptor, tool));
        }
        return capabilities;
    }

    private CapabilityDescriptor toToolCapability(PluginDescriptor descriptor, String tool) {
        String name = descriptor.getName();
        return CapabilityDescriptor.builder()
                .name(toolCapabilityName(name, tool))
                .description(descriptor.getDisplayName() + ": runs the '" + tool + "' action.")
                .parameterSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("arguments", Map.of(
                                "type", "object",
                                "description", "Arguments passed to the plugin as a JSON object")),
                        "required", List.of()))
                .invoker(args -> run(name, tool, toArguments(args.get("arguments"))))
                .owner(OWNER_PREFIX + name)
                .build();
    }

    static String toolCapabilityName(String pluginName, String tool) {
        return CAPABILITY_PREFIX + pluginName + "_" + tool;
    }

    private CapabilityDescriptor toCapability(PluginDescriptor descriptor) {
        String name = descriptor.getName();

        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "string");
        action.put("description", "Action to run");
        if (!descriptor.getActions().isEmpty()) {
            action.put("enum", descriptor.getActions());
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("action", action);
        properties.put("arguments", Map.of(
                "type", "object",
                "description", "Arguments passed to the plugin as a JSON object"));

        StringBuilder description = new StringBuilder(descriptor.getDisplayName());
        if (descriptor.getDescription() != null && !descriptor.getDescription().isBlank()) {
            description.append(": ").append(descriptor.getDescription());
        }
        if (!descriptor.getActions().isEmpty()) {
            description.append(" Actions: ").append(String.join(", ", descriptor.getActions())).append('.');
        }

        return CapabilityDescriptor.builder()
                .name(CAPABILITY_PREFIX + name)
                .description(description.toString())
                .parameterSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", descriptor.getActions().size() == 1 ? List.of() : List.of("action")))
                .invoker(args -> run(name, stringArg(args.get("action")), toArguments(args.get("arguments"))))
                .owner(OWNER_PREFIX + name)
                .build();
    }

    private PluginManifest manifestOf(PluginDescriptor descriptor, String source, boolean enabled,
            Instant loadedAt) {
        return PluginManifest.builder()
                .name(descriptor.getName())
                .displayName(descriptor.getDisplayName())
                .description(descriptor.getDescription())
                .version(descriptor.getVersion() != null ? descriptor.getVersion() : PluginManifest.DEFAULT_VERSION)
                .author(descriptor.getAuthor() != null ? descriptor.getAuthor() : PluginManifest.DEFAULT_AUTHOR)
                .source(source != null ? source : PluginManifest.SOURCE_LOCAL)
                .declaredActions(new ArrayList<>(descriptor.getActions()))
                .declaredTools(new ArrayList<>(descriptor.getTools()))
                .requiredEnvVars(new ArrayList<>(descriptor.getRequiredEnv()))
                .loadedAt(loadedAt)
                .enabled(enabled)
                .build();
    }

    private PluginStatus statusOf(LoadedPlugin plugin) {
        List<String> missing = plugin.descriptor().getRequiredEnv().stream()
                .filter(var -> {
                    String value = environment.getProperty(var);
                    return value == null || value.isBlank();
                })
                .toList();
        return PluginStatus.of(plugin.manifest(), missing);
    }

    private String describeLoaded() {
        List<String> names = plugins.values().stream()
                .filter(p -> p.manifest().isEnabled())
                .map(p -> p.descriptor().getName())
                .sorted()
                .toList();
        return names.isEmpty() ? "(none)" : String.join(", ", names);
    }

    private static String describeActions(PluginDescriptor descriptor) {
        return descriptor.getActions().isEmpty() ? "(any)" : String.join(", ", descriptor.getActions());
    }

    private static String errorText(String name, String message) {
        return "Error in plugin '" + name + "': " + message;
    }

    private static String stringArg(Object value) {
        return value != null ? value.toString() : null;
    }

    private static boolean isIgnored(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.startsWith(".") || fileName.startsWith("_");
    }

    static String formatTimeout(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    private record LoadedPlugin(PluginDescriptor descriptor, PluginManifest manifest) {
    }

    private static final class PluginThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "plugin-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
