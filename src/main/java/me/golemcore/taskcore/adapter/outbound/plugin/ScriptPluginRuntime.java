package me.golemcore.taskcore.adapter.outbound.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.taskcore.domain.model.PluginDescriptor;
import me.golemcore.taskcore.domain.model.PluginExecutionException;
import me.golemcore.taskcore.domain.model.PluginLoadException;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import me.golemcore.taskcore.port.outbound.PluginRuntimePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs plugins as script subprocesses.
 *
 * <p>
 * A plugin is a script whose leading comment lines declare its contract:
 *
 * <pre>
 * #!/bin/sh
 * # plugin.name: weather
 * # plugin.execute: sh
 * # plugin.version: 1.0.0
 * # plugin.actions: current, forecast
 * # plugin.tools: forecast
 * # plugin.requires-env: WEATHER_API_KEY
 * </pre>
 *
 * <p>
 * {@code plugin.name} and {@code plugin.execute} (the interpreter, which must
 * be allowed by {@code taskcore.plugins.allowed-interpreters}) are required.
 * Comments may start with {@code #} or {@code //}. Each entry of
 * {@code plugin.tools} names a declared action that gets a capability of its
 * own next to the plugin's main one.
 *
 * <p>
 * Invocation: {@code <interpreter> <file> <action>} in the plugin's directory,
 * arguments as one JSON object on stdin, {@code PLUGIN_NAME} and
 * {@code PLUGIN_ACTION} in the environment. Trimmed stdout is the result; a
 * non-zero exit code is a failure reported with stderr. Interrupting the
 * calling thread destroys the process.
 *
 * <p>
 * Not a long-lived process: every call spawns a fresh one, so a reload only
 * needs to re-read the header.
 */
@Component
public class ScriptPluginRuntime implements PluginRuntimePort {

    private static final Logger log = LoggerFactory.getLogger(ScriptPluginRuntime.class);

    private static final int MAX_HEADER_LINES = 64;
    private static final long DRAIN_JOIN_MS = 1000;
    private static final Pattern DECLARATION = Pattern
            .compile("^\\s*(?:#|//)\\s*plugin\\.([a-z][a-z-]*)\\s*:\\s*(.*?)\\s*$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,63}$");

    static final String KEY_NAME = "name";
    static final String KEY_EXECUTE = "execute";

    private final ObjectMapper objectMapper;
    private final Set<String> allowedInterpreters;
    private final int maxOutputChars;

    public ScriptPluginRuntime(ObjectMapper objectMapper, TaskCoreProperties properties) {
        this.objectMapper = objectMapper;
        TaskCoreProperties.PluginProperties plugins = properties.getPlugins();
        this.allowedInterpreters = Set.copyOf(plugins.getAllowedInterpreters());
        this.maxOutputChars = plugins.getMaxOutputChars();
    }

    @Override
    public PluginDescriptor load(Path file) throws PluginLoadException {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PluginLoadException("Cannot read plugin file " + file.getFileName() + ": " + e.getMessage(),
                    e);
        }
        return parse(source).toBuilder()
                .location(file.toAbsolutePath().normalize())
                .build();
    }

    @Override
    public PluginDescriptor inspect(String source) throws PluginLoadException {
        return parse(source);
    }

    @Override
    public String execute(PluginDescriptor plugin, String action, Map<String, Object> arguments)
            throws PluginExecutionException, InterruptedException {
        if (plugin.getLocation() == null) {
            throw new PluginExecutionException("plugin has no file location");
        }

        List<String> command = new ArrayList<>(plugin.getInterpreter());
        command.add(plugin.getLocation().toString());
        command.add(action != null ? action : "");

        ProcessBuilder pb = new ProcessBuilder(command);
        Path workDir = plugin.getLocation().getParent();
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.redirectErrorStream(false);
        Map<String, String> env = pb.environment();
        env.put("PLUGIN_NAME", plugin.getName());
        env.put("PLUGIN_ACTION", action != null ? action : "");

        String input = serializeArguments(arguments);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new PluginExecutionException("failed to start: " + e.getMessage(), e);
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = startDrain(process.getInputStream(), stdout, "plugin-stdout-" + plugin.getName());
        Thread stderrThread = startDrain(process.getErrorStream(), stderr, "plugin-stderr-" + plugin.getName());
        startDaemon(() -> writeInput(process, plugin.getName(), input), "plugin-stdin-" + plugin.getName());

        try {
            int exitCode = process.waitFor();
            stdoutThread.join(DRAIN_JOIN_MS);
            stderrThread.join(DRAIN_JOIN_MS);

            String output = snapshot(stdout).trim();
            if (exitCode != 0) {
                String error = snapshot(stderr).trim();
                throw new PluginExecutionException("exit code " + exitCode
                        + (error.isEmpty() ? "" : ": " + error));
            }
            log.debug("[Plugin:{}] action '{}' finished, {} chars", plugin.getName(), action, output.length());
            return output.isEmpty() ? "(no output)" : output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            log.info("[Plugin:{}] invocation interrupted, process destroyed", plugin.getName());
            throw e;
        }
    }

    private String serializeArguments(Map<String, Object> arguments) throws PluginExecutionException {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            throw new PluginExecutionException("arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    // Runs on its own thread: a plugin that never reads stdin must not block the caller
    private void writeInput(Process process, String pluginName, String input) {
        try (BufferedWriter writer = new BufferedWriter(
                new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8))) {
            writer.write(input);
            writer.newLine();
        } catch (IOException e) {
            log.debug("[Plugin:{}] stdin closed early: {}", pluginName, e.getMessage());
        }
    }

    private Thread startDrain(InputStream stream, StringBuilder sink, String threadName) {
        return startDaemon(() -> drain(stream, sink), threadName);
    }

    private static Thread startDaemon(Runnable task, String threadName) {
        Thread thread = new Thread(task, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void drain(InputStream stream, StringBuilder sink) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                synchronized (sink) {
                    if (sink.length() < maxOutputChars) {
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        sink.append(line, 0, Math.min(line.length(), maxOutputChars - sink.length()));
                    }
                }
                line = reader.readLine();
            }
        } catch (IOException e) {
            log.debug("[Plugin] output drain ended: {}", e.getMessage());
        }
    }

    private String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }

    PluginDescriptor parse(String source) throws PluginLoadException {
        if (source == null || source.isBlank()) {
            throw new PluginLoadException("plugin source is empty");
        }
        Map<String, String> declarations = readDeclarations(source);

        String name = declarations.get(KEY_NAME);
        if (name == null || name.isBlank()) {
            throw new PluginLoadException("missing 'plugin.name' declaration");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new PluginLoadException("invalid plugin name '" + name + "' (expected [a-z0-9_-]+)");
        }
        String execute = declarations.get(KEY_EXECUTE);
        if (execute == null || execute.isBlank()) {
            throw new PluginLoadException("plugin '" + name + "' is missing the 'plugin.execute' entry point");
        }
        List<String> interpreter = Arrays.stream(execute.trim().split("\\s+")).toList();
        if (!allowedInterpreters.contains(interpreter.get(0))) {
            throw new PluginLoadException("plugin '" + name + "' uses interpreter '" + interpreter.get(0)
                    + "' which is not allowed " + allowedInterpreters);
        }

        List<String> actions = splitList(declarations.get("actions"));
        List<String> tools = splitList(declarations.get("tools"));
        for (String tool : tools) {
            if (!NAME_PATTERN.matcher(tool).matches()) {
                throw new PluginLoadException("plugin '" + name + "' declares invalid tool name '" + tool + "'");
            }
            if (!actions.isEmpty() && !actions.contains(tool)) {
                throw new PluginLoadException("plugin '" + name + "' exposes tool '" + tool
                        + "' which is not a declared action");
            }
        }

        return PluginDescriptor.builder()
                .name(name)
                .displayName(declarations.getOrDefault("display-name", name))
                .description(declarations.getOrDefault("description", ""))
                .version(declarations.get("version"))
                .author(declarations.get("author"))
                .actions(actions)
                .tools(tools)
                .requiredEnv(splitList(declarations.get("requires-env")))
                .interpreter(interpreter)
                .build();
    }

    private Map<String, String> readDeclarations(String source) throws PluginLoadException {
        Map<String, String> declarations = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(source))) {
            String line = reader.readLine();
            int count = 0;
            while (line != null && count < MAX_HEADER_LINES) {
                Matcher matcher = DECLARATION.matcher(line);
                if (matcher.matches()) {
                    declarations.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
                }
                line = reader.readLine();
                count++;
            }
        } catch (IOException e) {
            throw new PluginLoadException("cannot read plugin header: " + e.getMessage(), e);
        }
        return declarations;
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
