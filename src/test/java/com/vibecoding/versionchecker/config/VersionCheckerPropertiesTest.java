package com.vibecoding.versionchecker.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionCheckerPropertiesTest {

    @Test
    void validateConfig_Defaults_ShouldPass() {
        VersionCheckerProperties properties = new VersionCheckerProperties();

        assertDoesNotThrow(properties::validateConfig);
        assertFalse(properties.isTestAllContainers());
        assertTrue(properties.isWatchAllNamespaces());
    }

    @Test
    void validateConfig_ZeroParallelism_ShouldFail() {
        VersionCheckerProperties properties = new VersionCheckerProperties();
        properties.getReconcile().setContainerParallelism(0);

        assertThrows(IllegalStateException.class, properties::validateConfig);
    }

    @Test
    void validateConfig_NegativeTimeout_ShouldFail() {
        VersionCheckerProperties properties = new VersionCheckerProperties();
        properties.setCheckTimeout(-1L);

        assertThrows(IllegalStateException.class, properties::validateConfig);
    }

    @Test
    void isWatchAllNamespaces_NamespaceSet_ShouldBeFalse() {
        VersionCheckerProperties properties = new VersionCheckerProperties();
        properties.getWatch().setNamespace("prod");

        assertFalse(properties.isWatchAllNamespaces());
    }
}
