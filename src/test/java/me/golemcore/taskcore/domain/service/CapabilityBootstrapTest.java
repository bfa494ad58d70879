package me.golemcore.taskcore.domain.service;

import me.golemcore.taskcore.domain.component.CapabilityComponent;
import me.golemcore.taskcore.domain.model.CapabilityDefinition;
import me.golemcore.taskcore.domain.model.CapabilityDescriptor;
import me.golemcore.taskcore.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityBootstrapTest {

    @Test
    void shouldRegisterEnabledComponentsOnly() {
        CapabilityRegistry registry = new CapabilityRegistry();
        CapabilityBootstrap bootstrap = new CapabilityBootstrap(registry, List.of(
                component("echo", true, ToolResult.success("echoed")),
                component("hidden", false, ToolResult.success("never"))));

        bootstrap.registerBuiltins();

        assertEquals(Set.of("echo"), registry.names());
        assertEquals(Set.of("echo"), registry.namesOwnedBy(CapabilityDescriptor.OWNER_BUILTIN));
    }

    @Test
    void shouldTurnToolResultsIntoText() {
        CapabilityRegistry registry = new CapabilityRegistry();
        new CapabilityBootstrap(registry, List.of(
                component("echo", true, ToolResult.success("echoed")),
                component("broken", true, ToolResult.failure("no network")))).registerBuiltins();

        assertEquals("echoed", registry.invoke("echo", Map.of()));
        assertEquals("Error: no network", registry.invoke("broken", Map.of()));
    }

    @Test
    void shouldReportComponentExceptions() {
        CapabilityComponent failing = new CapabilityComponent() {
            @Override
            public CapabilityDefinition getDefinition() {
                return CapabilityDefinition.simple("failing", "always fails");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
            }
        };
        CapabilityRegistry registry = new CapabilityRegistry();
        new CapabilityBootstrap(registry, List.of(failing)).registerBuiltins();

        assertEquals("Error executing 'failing': disk full", registry.invoke("failing", Map.of()));
    }

    private static CapabilityComponent component(String name, boolean enabled, ToolResult result) {
        return new CapabilityComponent() {
            @Override
            public CapabilityDefinition getDefinition() {
                return CapabilityDefinition.simple(name, name + " capability");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(result);
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }
}
