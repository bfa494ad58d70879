package me.golemcore.taskcore.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.taskcore.adapter.outbound.plugin.ScriptPluginRuntime;
import me.golemcore.taskcore.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.PluginLoadException;
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.domain.model.PluginStatus;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class PluginHostServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path pluginDir;
    private TaskCoreProperties properties;
    private MockEnvironment environment;
    private CapabilityRegistry registry;
    private ObjectMapper objectMapper;
    private PluginManifestStore manifestStore;
    private PluginHostService host;

    @BeforeEach
    void setUp() {
        pluginDir = tempDir.resolve("plugins");
        properties = new TaskCoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("storage").toString());
        properties.getPlugins().setDirectory(pluginDir.toString());
        properties.getPlugins().setTimeout(Duration.ofSeconds(1));

        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        environment = new MockEnvironment();
        registry = new CapabilityRegistry();
        manifestStore = new PluginManifestStore(storage, objectMapper, properties);
        host = newHost(registry);
    }

    @AfterEach
    void tearDown() {
        host.shutdown();
    }

    @Test
    void shouldDiscoverPluginsAndRegisterCapabilities() throws IOException {
        writePlugin("weather.sh", "weather", "current, forecast", "echo \"$1\"");
        writePlugin("greeter.sh", "greeter", "", "echo hello");

        host.init();

        assertEquals(List.of("greeter", "weather"),
                host.listPlugins().stream().map(s -> s.manifest().getName()).toList());
        assertTrue(registry.contains("plugin_weather"));
        assertTrue(registry.contains("plugin_greeter"));
        assertEquals(Set.of("plugin_weather"), registry.namesOwnedBy("plugin:weather"));
    }

    @Test
    void shouldIgnoreHiddenAndUnderscoreFiles() throws IOException {
        writePlugin(".hidden.sh", "hidden", "", "echo x");
        writePlugin("_draft.sh", "draft", "", "echo x");
        writePlugin("real.sh", "real", "", "echo x");

        host.init();

        assertEquals(List.of("real"), host.listPlugins().stream().map(s -> s.manifest().getName()).toList());
    }

    @Test
    void shouldSkipDuplicateNamesAndBrokenFiles() throws IOException {
        writePlugin("a.sh", "same", "", "echo first");
        writePlugin("b.sh", "same", "", "echo second");
        Files.createDirectories(pluginDir);
        Files.writeString(pluginDir.resolve("broken.sh"), "#!/bin/sh\necho no header\n");

        host.init();

        assertEquals(1, host.listPlugins().size());
        assertEquals("first", host.run("same", "run", Map.of()));
    }

    @Test
    void shouldWriteManifestOnLoad() throws IOException {
        writePlugin("weather.sh", "weather", "current", "echo sunny");

        host.init();

        PluginManifest manifest = manifestStore.find("weather").orElseThrow();
        assertEquals("weather", manifest.getName());
        assertEquals(List.of("current"), manifest.getDeclaredActions());
        assertEquals(NOW, manifest.getLoadedAt());
        assertEquals(PluginManifest.SOURCE_LOCAL, manifest.getSource());
        assertTrue(manifest.isEnabled());
        assertTrue(Files.exists(tempDir.resolve("storage/plugin-manifests/weather.json")));
    }

    @Test
    void shouldRunDeclaredActionThroughCapability() throws IOException {
        writePlugin("weather.sh", "weather", "current, forecast", """
                read -r input
                echo "$1 $input"
                """);
        host.init();

        String output = registry.invoke("plugin_weather",
                Map.of("action", "forecast", "arguments", Map.of("city", "Oslo")));

        assertEquals("forecast {\"city\":\"Oslo\"}", output);
    }

    @Test
    void shouldUseSingleDeclaredActionWhenNoneGiven() throws IOException {
        writePlugin("clock.sh", "clock", "now", "echo \"$1\"");
        host.init();

        assertEquals("now", host.run("clock", null, Map.of()));
        CapabilityDefinition definition = registry.listDefinitions().get(0);
        assertEquals(List.of(), definition.getInputSchema().get("required"));
    }

    @Test
    void shouldRejectMissingAndUnknownActions() throws IOException {
        writePlugin("weather.sh", "weather", "current, forecast", "echo ok");
        host.init();

        assertEquals("Error in plugin 'weather': an action is required. Valid actions: current, forecast",
                host.run("weather", " ", Map.of()));
        assertEquals("Error in plugin 'weather': unknown action 'rain'. Valid actions: current, forecast",
                host.run("weather", "rain", Map.of()));
    }

    @Test
    void shouldDescribeLoadedPluginsForUnknownName() throws IOException {
        assertEquals("Error: plugin 'ghost' is not available. Loaded: (none)", host.run("ghost", "x", Map.of()));

        writePlugin("weather.sh", "weather", "", "echo ok");
        host.init();

        assertEquals("Error: plugin 'ghost' is not available. Loaded: weather", host.run("ghost", "x", Map.of()));
    }

    @Test
    void shouldTimeOutSlowPlugin() throws IOException {
        writePlugin("slow.sh", "slow", "", "sleep 60");
        host.init();

        long started = System.nanoTime();
        String output = host.run("slow", "run", Map.of());
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals("[TIMEOUT] plugin 'slow' exceeded the timeout of 1s", output);
        assertTrue(elapsedMillis < 10_000, "timeout must return promptly");
    }

    @Test
    void shouldReportFailingPlugin() throws IOException {
        writePlugin("bad.sh", "bad", "", "echo oops >&2\nexit 2");
        host.init();

        assertEquals("Error in plugin 'bad': exit code 2: oops", host.run("bad", "run", Map.of()));
    }

    @Test
    void failingPluginShouldNotAffectOtherPlugins() throws IOException {
        writePlugin("bad.sh", "bad", "", "exit 1");
        writePlugin("good.sh", "good", "", "echo fine");
        host.init();

        assertTrue(host.run("bad", "run", Map.of()).startsWith("Error in plugin 'bad'"));
        assertEquals("fine", host.run("good", "run", Map.of()));
        assertEquals("fine", registry.invoke("plugin_good", Map.of()));
    }

    @Test
    void timedOutPluginShouldNotAffectOtherPlugins() throws IOException {
        writePlugin("slow.sh", "slow", "", "sleep 60");
        writePlugin("good.sh", "good", "", "echo fine");
        host.init();

        assertTrue(host.run("slow", "run", Map.of()).startsWith("[TIMEOUT]"));
        assertEquals("fine", host.run("good", "run", Map.of()));
    }

    @Test
    void timeoutShouldFreeWorkerOfPluginThatIgnoresLargeInput() throws IOException {
        properties.getPlugins().setMaxConcurrentRuns(1);
        host.shutdown();
        host = newHost(registry);
        writePlugin("deaf.sh", "deaf", "", "sleep 60");
        writePlugin("good.sh", "good", "", "echo fine");
        host.init();

        String output = host.run("deaf", "run", Map.of("blob", "x".repeat(1_000_000)));

        assertEquals("[TIMEOUT] plugin 'deaf' exceeded the timeout of 1s", output);
        assertEquals("fine", host.run("good", "run", Map.of()));
    }

    @Test
    void restartShouldKeepInstallSourceFromStoredManifest() throws Exception {
        host.init();
        Path file = writePlugin("weather.sh", "weather", "current", "echo sunny");
        host.load(file, "https://example.com/weather.sh");
        host.shutdown();

        CapabilityRegistry restartedRegistry = new CapabilityRegistry();
        host = newHost(restartedRegistry);
        host.init();

        assertEquals("https://example.com/weather.sh", host.getPlugin("weather").orElseThrow().manifest().getSource());
        assertEquals("https://example.com/weather.sh", manifestStore.find("weather").orElseThrow().getSource());
        assertTrue(restartedRegistry.contains("plugin_weather"));
    }

    @Test
    void restartShouldKeepDisabledPluginDisabledUntilReload() throws Exception {
        writePlugin("weather.sh", "weather", "", "echo ok");
        host.init();
        host.disable("weather");
        host.shutdown();

        CapabilityRegistry restartedRegistry = new CapabilityRegistry();
        host = newHost(restartedRegistry);
        host.init();

        assertFalse(host.getPlugin("weather").orElseThrow().manifest().isEnabled());
        assertFalse(restartedRegistry.contains("plugin_weather"));
        assertTrue(host.reloadAll().isEmpty());
        assertFalse(restartedRegistry.contains("plugin_weather"));

        host.reload("weather");
        assertTrue(restartedRegistry.contains("plugin_weather"));
        assertTrue(manifestStore.find("weather").orElseThrow().isEnabled());
    }

    @Test
    void declaredToolsShouldGetTheirOwnCapabilities() throws Exception {
        Files.createDirectories(pluginDir);
        Path file = pluginDir.resolve("weather.sh");
        Files.writeString(file, header("weather", "current, forecast")
                + "# plugin.tools: forecast\nread -r input\necho \"$1 $input\"\n");
        host.init();

        assertEquals(Set.of("plugin_weather", "plugin_weather_forecast"), registry.namesOwnedBy("plugin:weather"));
        assertEquals("forecast {\"days\":3}",
                registry.invoke("plugin_weather_forecast", Map.of("arguments", Map.of("days", 3))));
        assertEquals(List.of("forecast"), manifestStore.find("weather").orElseThrow().getDeclaredTools());

        Files.writeString(file, header("weather", "current, forecast") + "echo v2\n");
        host.reload("weather");

        assertEquals(Set.of("plugin_weather"), registry.namesOwnedBy("plugin:weather"));
    }

    @Test
    void reloadShouldSwapToNewVersion() throws Exception {
        Path file = writePlugin("weather.sh", "weather", "current", "echo v1");
        host.init();
        assertEquals("v1", host.run("weather", "current", Map.of()));

        Files.writeString(file, header("weather", "current, forecast") + "echo v2\n");
        PluginManifest manifest = host.reload("weather");

        assertEquals(List.of("current", "forecast"), manifest.getDeclaredActions());
        assertEquals("v2", host.run("weather", "forecast", Map.of()));
        assertEquals(1, registry.namesOwnedBy("plugin:weather").size());
    }

    @Test
    void failedReloadShouldKeepPreviousVersion() throws Exception {
        Path file = writePlugin("weather.sh", "weather", "current", "echo v1");
        host.init();

        Files.writeString(file, "#!/bin/sh\n# plugin.name: weather\necho broken\n");

        assertThrows(PluginLoadException.class, () -> host.reload("weather"));
        assertTrue(registry.contains("plugin_weather"));
        assertEquals("v1", host.run("weather", "current", Map.of()));
    }

    @Test
    void reloadShouldRejectRenamedPluginAndUnknownName() throws Exception {
        Path file = writePlugin("weather.sh", "weather", "", "echo v1");
        host.init();
        Files.writeString(file, header("climate", "") + "echo v2\n");

        assertThrows(PluginLoadException.class, () -> host.reload("weather"));
        assertThrows(PluginLoadException.class, () -> host.reload("ghost"));
        assertTrue(registry.contains("plugin_weather"));
        assertFalse(registry.contains("plugin_climate"));
    }

    @Test
    void disableShouldUnregisterCapabilityAndMarkManifest() throws Exception {
        writePlugin("weather.sh", "weather", "", "echo ok");
        host.init();

        assertTrue(host.disable("weather"));

        assertFalse(registry.contains("plugin_weather"));
        assertFalse(host.getPlugin("weather").orElseThrow().manifest().isEnabled());
        assertFalse(manifestStore.find("weather").orElseThrow().isEnabled());
        assertTrue(host.run("weather", "run", Map.of()).startsWith("Error: plugin 'weather' is not available"));
        assertFalse(host.disable("ghost"));

        host.reload("weather");
        assertTrue(registry.contains("plugin_weather"));
    }

    @Test
    void reloadAllShouldDropDeletedFilesAndPickUpNewOnes() throws IOException {
        Path old = writePlugin("old.sh", "old", "", "echo old");
        host.init();

        Files.delete(old);
        writePlugin("fresh.sh", "fresh", "", "echo fresh");

        List<String> loaded = host.reloadAll();

        assertEquals(List.of("fresh"), loaded);
        assertFalse(host.isLoaded("old"));
        assertFalse(registry.contains("plugin_old"));
        assertTrue(registry.contains("plugin_fresh"));
    }

    @Test
    void loadShouldRejectSameNameFromAnotherFile() throws IOException {
        writePlugin("weather.sh", "weather", "", "echo ok");
        host.init();
        Path other = writePlugin("weather2.sh", "weather", "", "echo other");

        assertThrows(PluginLoadException.class, () -> host.load(other, "https://example.com/weather2.sh"));
    }

    @Test
    void pluginWithMissingEnvShouldNotBeReady() throws IOException {
        Files.createDirectories(pluginDir);
        Files.writeString(pluginDir.resolve("mail.sh"), header("mail", "")
                + "# plugin.requires-env: MAIL_TOKEN, MAIL_HOST\necho ok\n");
        environment.setProperty("MAIL_HOST", "smtp.example.com");
        host.init();

        PluginStatus status = host.getPlugin("mail").orElseThrow();

        assertFalse(status.ready());
        assertEquals(List.of("MAIL_TOKEN"), status.missingEnv());
    }

    @Test
    void disabledHostShouldNotLoadAnything() throws IOException {
        properties.getPlugins().setEnabled(false);
        writePlugin("weather.sh", "weather", "", "echo ok");

        host.init();

        assertTrue(host.listPlugins().isEmpty());
    }

    @Test
    void toArgumentsShouldAcceptMapOrJson() {
        assertEquals(Map.of("a", 1), host.toArguments("{\"a\":1}"));
        assertEquals(Map.of("b", "x"), host.toArguments(Map.of("b", "x")));
        assertEquals(Map.of(), host.toArguments(null));
        assertThrows(IllegalArgumentException.class, () -> host.toArguments("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> host.toArguments(42));
    }

    @Test
    void formatTimeoutShouldPrintSeconds() {
        assertEquals("30s", PluginHostService.formatTimeout(Duration.ofSeconds(30)));
        assertEquals("1.5s", PluginHostService.formatTimeout(Duration.ofMillis(1500)));
    }

    private PluginHostService newHost(CapabilityRegistry capabilityRegistry) {
        return new PluginHostService(capabilityRegistry, new ScriptPluginRuntime(objectMapper, properties),
                manifestStore, environment, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC), properties);
    }

    private Path writePlugin(String fileName, String name, String actions, String body) throws IOException {
        Files.createDirectories(pluginDir);
        Path file = pluginDir.resolve(fileName);
        Files.writeString(file, header(name, actions) + body + "\n");
        return file;
    }

    private static String header(String name, String actions) {
        StringBuilder header = new StringBuilder("#!/bin/sh\n")
                .append("# plugin.name: ").append(name).append('\n')
                .append("# plugin.execute: sh\n");
        if (!actions.isEmpty()) {
            header.append("# plugin.actions: ").append(actions).append('\n');
        }
        return header.toString();
    }
}
