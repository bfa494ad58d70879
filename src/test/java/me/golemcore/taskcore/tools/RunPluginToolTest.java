package me.golemcore.taskcore.tools;

import me.golemcore.taskcore.domain.model.ToolResult;
import me.golemcore.taskcore.domain.service.PluginHostService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunPluginToolTest {

    private PluginHostService pluginHost;
    private RunPluginTool tool;

    @BeforeEach
    void setUp() {
        pluginHost = mock(PluginHostService.class);
        tool = new RunPluginTool(pluginHost);
    }

    @Test
    void shouldRequirePluginNameAndAction() {
        assertEquals(List.of("plugin_name", "action"), tool.getDefinition().getInputSchema().get("required"));
    }

    @Test
    void shouldRunPluginWithParsedArguments() throws Exception {
        Map<String, Object> arguments = Map.of("city", "Oslo");
        when(pluginHost.toArguments("{\"city\":\"Oslo\"}")).thenReturn(arguments);
        when(pluginHost.run("weather", "current", arguments)).thenReturn("sunny");

        ToolResult result = tool.execute(Map.of(
                "plugin_name", "weather",
                "action", "current",
                "arguments", "{\"city\":\"Oslo\"}")).get();

        assertTrue(result.isSuccess());
        assertEquals("sunny", result.getOutput());
    }

    @Test
    void shouldReturnPluginErrorsAsOutput() throws Exception {
        when(pluginHost.toArguments(any())).thenReturn(Map.of());
        when(pluginHost.run(anyString(), any(), any()))
                .thenReturn("[TIMEOUT] plugin 'slow' exceeded the timeout of 30s");

        ToolResult result = tool.execute(Map.of("plugin_name", "slow", "action", "run")).get();

        assertTrue(result.isSuccess());
        assertEquals("[TIMEOUT] plugin 'slow' exceeded the timeout of 30s", result.toText());
    }

    @Test
    void shouldFailWithoutPluginName() throws Exception {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("action", "run");

        ToolResult result = tool.execute(parameters).get();

        assertFalse(result.isSuccess());
        verify(pluginHost, never()).run(any(), any(), any());
    }

    @Test
    void shouldFailOnMalformedArguments() throws Exception {
        when(pluginHost.toArguments("not json"))
                .thenThrow(new IllegalArgumentException("arguments must be a JSON object"));

        ToolResult result = tool.execute(Map.of(
                "plugin_name", "weather",
                "action", "current",
                "arguments", "not json")).get();

        assertFalse(result.isSuccess());
        assertEquals("arguments must be a JSON object", result.getError());
    }
}
