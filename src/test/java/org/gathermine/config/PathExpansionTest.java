package org.gathermine.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for variable expansion in configured paths.
 */
@Tag("unit")
class PathExpansionTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("gathermine.test.wow");
        System.clearProperty("gathermine.test.account");
    }

    @Test
    void testExpandPath_NoVariables() {
        String path = "/games/wow/_classic_/WTF";
        assertEquals(path, PathExpansion.expandPath(path));
    }

    @Test
    void testExpandPath_NullPath() {
        assertNull(PathExpansion.expandPath(null));
    }

    @Test
    void testExpandPath_MultipleSystemProperties() {
        System.setProperty("gathermine.test.wow", "/games/wow");
        System.setProperty("gathermine.test.account", "HERO");

        String expanded = PathExpansion.expandPath(
                "${gathermine.test.wow}/WTF/Account/${gathermine.test.account}/SavedVariables/GatherMate2.lua");

        assertEquals("/games/wow/WTF/Account/HERO/SavedVariables/GatherMate2.lua", expanded);
    }

    @Test
    void testExpandPath_SystemPropertyWinsOverEnvironment() {
        String envName = System.getenv().keySet().stream().findFirst().orElse(null);
        if (envName == null) {
            return;
        }
        System.setProperty(envName, "/from/property");
        try {
            assertEquals("/from/property/x", PathExpansion.expandPath("${" + envName + "}/x"));
        } finally {
            System.clearProperty(envName);
        }
    }

    @Test
    void testExpandPath_UndefinedVariable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PathExpansion.expandPath("${gathermine.test.undefined}/x"));
        assertTrue(e.getMessage().contains("gathermine.test.undefined"));
    }

    @Test
    void testExpandPath_UnclosedVariable() {
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandPath("${gathermine.test.wow/x"));
    }
}
