package com.columnhierarchy.core.config;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.ResolutionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("column-hierarchy.yaml");
        Files.writeString(configFile, """
            resolution:
              mode: anchored
              registry: registry.yaml
              minSubsetSize: 3
              maxFieldsPerColumnSet: 12
              includeInputColumnSets: false
              failOnUnresolvedAnchor: true

            naming:
              typeNamePrefix: Row
              firstTypeId: 10
              capabilityMarker: IRow

            emitters:
              enabled:
                - java
                - mermaid
              packageName: com.example.rows

            output:
              directory: ./build/rows
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.effectiveMode()).isEqualTo(ResolutionMode.ANCHORED);
        assertThat(config.resolution().registry()).isEqualTo("registry.yaml");
        assertThat(config.effectiveEmitters()).containsExactly("java", "mermaid");
        assertThat(config.emitters().packageName()).isEqualTo("com.example.rows");
        assertThat(config.effectiveOutputDirectory()).isEqualTo("./build/rows");

        ResolutionSettings settings = config.toResolutionSettings();
        assertThat(settings.minSubsetSize()).isEqualTo(3);
        assertThat(settings.maxFieldsPerColumnSet()).isEqualTo(12);
        assertThat(settings.includeInputColumnSets()).isFalse();
        assertThat(settings.failOnUnresolvedAnchor()).isTrue();
        assertThat(settings.typeNamePrefix()).isEqualTo("Row");
        assertThat(settings.firstTypeId()).isEqualTo(10);
        assertThat(settings.capabilityMarker()).isEqualTo("IRow");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_malformedYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("broken.yaml");
        Files.writeString(configFile, "resolution: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("extra.yaml");
        Files.writeString(configFile, """
            project:
              name: legacy
            naming:
              typeNamePrefix: Shape
              color: blue
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.toResolutionSettings().typeNamePrefix()).isEqualTo("Shape");
        assertThat(config.effectiveMode()).isEqualTo(ResolutionMode.UNANCHORED);
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_outOfRangeValue_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("range.yaml");
        Files.writeString(configFile, "resolution:\n  minSubsetSize: 0\n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void parse_unknownMode_throwsInvalidInput() throws IOException {
        Path configFile = tempDir.resolve("mode.yaml");
        Files.writeString(configFile, "resolution:\n  mode: sideways\n");

        assertThatThrownBy(() -> ConfigLoader.parse(configFile))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("sideways");
    }

    @Test
    void parse_emptyFile_throwsIOException() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        assertThatThrownBy(() -> ConfigLoader.parse(configFile))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void parse_directory_throwsIOException() {
        assertThatThrownBy(() -> ConfigLoader.parse(tempDir)).isInstanceOf(IOException.class);
    }

    @Test
    void parse_malformedYaml_throwsIOException() throws IOException {
        Path configFile = tempDir.resolve("broken.yaml");
        Files.writeString(configFile, "resolution: [unclosed");

        assertThatThrownBy(() -> ConfigLoader.parse(configFile)).isInstanceOf(IOException.class);
    }
}
