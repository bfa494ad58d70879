package me.golemcore.taskcore.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.taskcore.adapter.outbound.http.OkHttpPluginSourceAdapter;
import me.golemcore.taskcore.adapter.outbound.plugin.ScriptPluginRuntime;
import me.golemcore.taskcore.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.taskcore.domain.model.PluginInstallException;
import me.golemcore.taskcore.domain.model.PluginManifest;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class PluginInstallServiceTest {

    private static final String WEATHER_SOURCE = """
            #!/bin/sh
            # plugin.name: weather
            # plugin.execute: sh
            # plugin.actions: current
            echo sunny
            """;

    @TempDir
    Path tempDir;

    private MockWebServer mockServer;
    private TaskCoreProperties properties;
    private CapabilityRegistry registry;
    private PluginHostService host;
    private PluginInstallService installService;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new TaskCoreProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("storage").toString());
        properties.getPlugins().setDirectory(tempDir.resolve("plugins").toString());

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ScriptPluginRuntime runtime = new ScriptPluginRuntime(objectMapper, properties);

        registry = new CapabilityRegistry();
        host = new PluginHostService(registry, runtime, new PluginManifestStore(storage, objectMapper, properties),
                new MockEnvironment(), objectMapper, Clock.systemUTC(), properties);
        host.init();
        installService = new PluginInstallService(host, runtime,
                new OkHttpPluginSourceAdapter(new OkHttpClient()), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        host.shutdown();
        mockServer.shutdown();
    }

    @Test
    void shouldInstallAndLoadPlugin() throws Exception {
        mockServer.enqueue(new MockResponse().setBody(WEATHER_SOURCE));
        String url = mockServer.url("/plugins/weather.sh").toString();

        PluginManifest manifest = installService.installFromUrl(url);

        assertEquals("weather", manifest.getName());
        assertEquals(url, manifest.getSource());
        assertTrue(Files.exists(host.getPluginDirectory().resolve("weather.sh")));
        assertTrue(registry.contains("plugin_weather"));
        assertEquals("sunny", host.run("weather", "current", Map.of()));

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/plugins/weather.sh", request.getPath());
    }

    @Test
    void shouldNotOverwriteExistingFile() throws Exception {
        Files.writeString(host.getPluginDirectory().resolve("weather.sh"), "# keep me\n");
        String url = mockServer.url("/weather.sh").toString();

        PluginInstallException e = assertThrows(PluginInstallException.class,
                () -> installService.installFromUrl(url));

        assertEquals("A plugin file named 'weather.sh' already exists", e.getMessage());
        assertEquals("# keep me\n", Files.readString(host.getPluginDirectory().resolve("weather.sh")));
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldRejectInvalidSourceWithoutWritingFile() {
        mockServer.enqueue(new MockResponse().setBody("#!/bin/sh\necho no header\n"));
        String url = mockServer.url("/broken.sh").toString();

        PluginInstallException e = assertThrows(PluginInstallException.class,
                () -> installService.installFromUrl(url));

        assertTrue(e.getMessage().startsWith("Validation failed: "));
        assertFalse(Files.exists(host.getPluginDirectory().resolve("broken.sh")));
    }

    @Test
    void shouldReportHttpErrors() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));
        String url = mockServer.url("/missing.sh").toString();

        PluginInstallException e = assertThrows(PluginInstallException.class,
                () -> installService.installFromUrl(url));

        assertTrue(e.getMessage().startsWith("Download failed: HTTP 404"));
    }

    @Test
    void shouldRejectPluginNameAlreadyLoaded() throws Exception {
        mockServer.enqueue(new MockResponse().setBody(WEATHER_SOURCE));
        installService.installFromUrl(mockServer.url("/weather.sh").toString());
        mockServer.enqueue(new MockResponse().setBody(WEATHER_SOURCE));

        PluginInstallException e = assertThrows(PluginInstallException.class,
                () -> installService.installFromUrl(mockServer.url("/weather-copy.sh").toString()));

        assertEquals("A plugin named 'weather' is already loaded", e.getMessage());
        assertFalse(Files.exists(host.getPluginDirectory().resolve("weather-copy.sh")));
    }

    @Test
    void shouldRefuseWhenInstallIsDisabled() {
        properties.getPlugins().setInstallEnabled(false);

        assertThrows(PluginInstallException.class,
                () -> installService.installFromUrl(mockServer.url("/weather.sh").toString()));
    }

    @Test
    void shouldConvertGithubBlobUrlToRawUrl() {
        assertEquals("https://raw.githubusercontent.com/acme/plugins/main/weather.sh",
                PluginInstallService.toRawUrl("https://github.com/acme/plugins/blob/main/weather.sh"));
        assertEquals("https://example.com/weather.sh",
                PluginInstallService.toRawUrl("https://example.com/weather.sh"));
    }

    @Test
    void shouldDeriveFileNameFromUrl() {
        assertEquals("weather.sh", PluginInstallService.fileNameOf("https://example.com/a/b/weather.sh"));
        assertThrows(PluginInstallException.class,
                () -> PluginInstallService.fileNameOf("ftp://example.com/weather.sh"));
        assertThrows(PluginInstallException.class,
                () -> PluginInstallService.fileNameOf("https://example.com/dir/"));
        assertThrows(PluginInstallException.class,
                () -> PluginInstallService.fileNameOf("https://example.com/_hidden.sh"));
        assertThrows(PluginInstallException.class,
                () -> PluginInstallService.fileNameOf("https://example.com/%2E%2E"));
    }
}
