package org.hexwar.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hexwar.junit.extensions.logging.ExpectLog;
import org.hexwar.junit.extensions.logging.LogLevel;
import org.hexwar.junit.extensions.logging.LogWatchExtension;
import org.hexwar.runtime.rules.GameSettings;
import org.hexwar.runtime.rules.RulesLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks the precedence of configuration layers: system properties over the file layer over
 * {@code reference.conf}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String TEST_CONFIG = "org/hexwar/node/config/test-config.conf";

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("hexwar.settings.seed");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("File layer overrides reference defaults and keeps the rest")
    void load_fileOverridesReference() {
        Config config = ConfigLoader.load(TEST_CONFIG);

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(500, config.getInt("hexwar.settings.starting-coins"));
        assertEquals(2, config.getInt("hexwar.settings.player-count"));
        assertEquals("hexwar-rules.conf", config.getString(RulesLoader.RULES_RESOURCE_PATH));
    }

    @Test
    @DisplayName("System property overrides the file layer")
    void load_systemPropertyOverridesFile() {
        System.setProperty("test.value", "system-value");
        System.setProperty("hexwar.settings.seed", "99");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(TEST_CONFIG);

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        GameSettings settings = RulesLoader.loadSettings(config);
        assertEquals(99L, settings.seed());
        assertEquals(500, settings.startingCoins());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN,
            messagePattern = "Configuration file 'missing-config.conf' not found or is empty. Using defaults.")
    @DisplayName("Missing resource falls back to reference defaults")
    void load_missingResourceUsesDefaults() {
        Config config = ConfigLoader.load("missing-config.conf");

        assertFalse(config.hasPath("test.value"));
        assertEquals(42L, config.getLong("hexwar.settings.seed"));
    }

    @Test
    @DisplayName("Working directory layer is optional")
    void load_withoutWorkingDirectoryFile() {
        Config config = ConfigLoader.load();

        assertTrue(config.hasPath("hexwar.combat.distribution-trials"));
        assertTrue(config.hasPath("logging.default-level"));
    }
}
