package io.imagexform.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable counts as set only when it
 * is defined and non-blank after trimming.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Test
    @DisplayName("every key has an environment override")
    void allOverrides() {
        envVars.put("ENGINE_TYPE", "java2d");
        envVars.put("MAGICK_EXECUTABLE", "/opt/im/bin/magick");
        envVars.put("MAGICK_TIMEOUT_MS", "2500");
        envVars.put("PIPELINE_DEFINITION", "/etc/image-xform/avatar.yaml");
        envVars.put("LOG_FORMAT", "text");
        envVars.put("LOG_LEVEL", "WARN");

        XformConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config).isEqualTo(new XformConfig(
                "java2d", "/opt/im/bin/magick", 2500, "/etc/image-xform/avatar.yaml", "text", "WARN"));
    }

    @Test
    @DisplayName("values are trimmed")
    void trimmed() {
        envVars.put("MAGICK_EXECUTABLE", "  convert6  ");

        assertThat(ConfigLoader.load(fullConfigPath, envLookup()).magickExecutable()).isEqualTo("convert6");
    }

    @Test
    @DisplayName("blank values leave the YAML value in place")
    void blankIsUnset() {
        envVars.put("ENGINE_TYPE", "   ");
        envVars.put("LOG_LEVEL", "");

        XformConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.engineType()).isEqualTo("magick");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
    }

    @Test
    @DisplayName("overrides apply without a config file")
    void withoutFile() {
        envVars.put("ENGINE_TYPE", "magick");

        assertThat(ConfigLoader.load(null, envLookup()).engineType()).isEqualTo("magick");
    }

    @Test
    @DisplayName("a non-numeric timeout names the variable")
    void invalidTimeout() {
        envVars.put("MAGICK_TIMEOUT_MS", "soon");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("MAGICK_TIMEOUT_MS")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("an invalid override is validated like a YAML value")
    void invalidEngine() {
        envVars.put("ENGINE_TYPE", "gimp");

        assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("'gimp'");
    }
}
