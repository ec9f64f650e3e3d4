package org.gathermine.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MinerConfigurationTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("gathermine.test.wtf");
    }

    @Test
    void defaultsComeFromReferenceConf() {
        MinerConfiguration configuration = MinerConfiguration.from(ConfigFactory.load());

        assertThat(configuration.getTablePrefix()).isEqualTo("GatherMate2");
        assertThat(configuration.getOutputDirectory()).isEqualTo(Path.of("."));
        assertThat(configuration.getCacheDirectory()).isEqualTo(Path.of("."));
        assertThat(configuration.getSavedVariablesPath()).isEmpty();
        assertThat(configuration.zoneRegistry().resolve("331")).isPresent();
    }

    @Test
    void savedVariablesPathIsExpanded() {
        System.setProperty("gathermine.test.wtf", "/games/wow/WTF");
        Config config = ConfigFactory.parseString("""
            gathermine.saved-variables {
              enabled = true
              path = "${gathermine.test.wtf}/GatherMate2.lua"
            }
            """).withFallback(ConfigFactory.load());

        MinerConfiguration configuration = MinerConfiguration.from(config);

        assertThat(configuration.getSavedVariablesPath()).contains(Path.of("/games/wow/WTF/GatherMate2.lua"));
    }

    @Test
    void enabledMergeNeedsAPath() {
        Config config = ConfigFactory.parseString("gathermine.saved-variables.enabled = true")
                .withFallback(ConfigFactory.load());

        assertThatThrownBy(() -> MinerConfiguration.from(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("saved-variables.path");
    }

    @Test
    void blankPrefixIsRejected() {
        Config config = ConfigFactory.parseString("gathermine.table-prefix = \"\"").withFallback(ConfigFactory.load());

        assertThatThrownBy(() -> MinerConfiguration.from(config)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overridesReturnCopies() {
        MinerConfiguration defaults = MinerConfiguration.from(ConfigFactory.load());

        MinerConfiguration changed = defaults
                .withOutputDirectory(Path.of("out"))
                .withSavedVariables(Path.of("GatherMate2.lua"));

        assertThat(changed.getOutputDirectory()).isEqualTo(Path.of("out"));
        assertThat(changed.getSavedVariablesPath()).contains(Path.of("GatherMate2.lua"));
        assertThat(defaults.getOutputDirectory()).isEqualTo(Path.of("."));
        assertThat(defaults.getSavedVariablesPath()).isEmpty();
    }
}
