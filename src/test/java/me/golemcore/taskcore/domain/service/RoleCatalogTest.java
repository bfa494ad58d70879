package me.golemcore.taskcore.domain.service;

import me.golemcore.taskcore.domain.model.RoleProfile;
import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleCatalogTest {

    private RoleCatalog catalog;

    @BeforeEach
    void setUp() {
        TaskCoreProperties properties = new TaskCoreProperties();
        TaskCoreProperties.RoleProperties researcher = new TaskCoreProperties.RoleProperties();
        researcher.setDisplayName("Researcher");
        researcher.setSystemInstructions("Research carefully.");
        researcher.setTools(List.of("current_datetime"));
        properties.getRoles().put("researcher", researcher);

        TaskCoreProperties.RoleProperties writer = new TaskCoreProperties.RoleProperties();
        writer.setSystemInstructions("Write well.");
        writer.setTools(List.of());
        properties.getRoles().put("writer", writer);

        TaskCoreProperties.RoleProperties free = new TaskCoreProperties.RoleProperties();
        free.setSystemInstructions("Anything goes.");
        properties.getRoles().put("free", free);

        catalog = new RoleCatalog(properties);
        catalog.init();
    }

    @Test
    void shouldLoadPredefinedRolesWithWhitelists() {
        RoleProfile researcher = catalog.find("researcher").orElseThrow();

        assertEquals("Researcher", researcher.resolveDisplayName());
        assertEquals(Set.of("current_datetime"), researcher.getCapabilityWhitelist());
        assertTrue(researcher.permits("current_datetime"));
        assertFalse(researcher.permits("run_plugin"));
    }

    @Test
    void emptyWhitelistShouldAllowNothing() {
        RoleProfile writer = catalog.find("writer").orElseThrow();

        assertTrue(writer.isRestricted());
        assertFalse(writer.permits("current_datetime"));
        assertEquals("writer", writer.resolveDisplayName());
    }

    @Test
    void unsetWhitelistShouldBeUnrestricted() {
        RoleProfile free = catalog.find("free").orElseThrow();

        assertFalse(free.isRestricted());
        assertTrue(free.permits("anything"));
    }

    @Test
    void assistantRoleShouldBeUnrestricted() {
        RoleProfile assistant = catalog.assistantRole();

        assertEquals(RoleCatalog.ASSISTANT_ROLE, assistant.getName());
        assertFalse(assistant.isRestricted());
    }

    @Test
    void customRolesShouldBeListedAfterPredefinedOnes() {
        catalog.registerRole(RoleProfile.builder()
                .name("tester")
                .systemInstructions("Test things.")
                .capabilityWhitelist(Set.of())
                .build());

        List<String> roles = catalog.availableRoles();

        assertEquals(List.of("researcher", "writer", "free", "tester"), roles);
        assertTrue(catalog.find("tester").isPresent());
        assertEquals(4, catalog.listRoles().size());
    }

    @Test
    void registeredWhitelistShouldNotFollowCallerChanges() {
        Set<String> tools = new HashSet<>(Set.of("current_datetime"));
        catalog.registerRole(RoleProfile.builder()
                .name("scheduler")
                .systemInstructions("Plan the day.")
                .capabilityWhitelist(tools)
                .build());

        tools.add("run_plugin");
        tools.remove("current_datetime");

        RoleProfile role = catalog.find("scheduler").orElseThrow();
        assertTrue(role.permits("current_datetime"));
        assertFalse(role.permits("run_plugin"));
        assertThrows(UnsupportedOperationException.class, () -> role.getCapabilityWhitelist().add("run_plugin"));
    }

    @Test
    void shouldRejectReservedOrBlankRoleNames() {
        RoleProfile reserved = RoleProfile.builder().name(RoleCatalog.ASSISTANT_ROLE).build();
        RoleProfile blank = RoleProfile.builder().name(" ").build();

        assertThrows(IllegalArgumentException.class, () -> catalog.registerRole(reserved));
        assertThrows(IllegalArgumentException.class, () -> catalog.registerRole(blank));
    }

    @Test
    void unknownRoleShouldBeEmpty() {
        assertTrue(catalog.find("astronaut").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
    }
}
