package com.pypeek.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("pypeek.yaml");
        Files.writeString(configFile, """
            source:
              extensions: [".py", ".pyw"]
              allowShebang: false

            output:
              format: JSON
              showConditions: true
            """);

        PeekConfig config = ConfigLoader.load(configFile);

        assertThat(config.source().extensions()).containsExactly(".py", ".pyw");
        assertThat(config.source().allowShebang()).isFalse();
        assertThat(config.output().format()).isEqualTo("json");
        assertThat(config.output().showConditions()).isTrue();
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pypeek.yaml");
        Files.writeString(configFile, """
            output:
              showConditions: true
            unknownSection:
              ignored: 1
            """);

        PeekConfig config = ConfigLoader.load(configFile);

        assertThat(config.source().extensions()).containsExactly(".py");
        assertThat(config.source().allowShebang()).isTrue();
        assertThat(config.output().format()).isEqualTo(PeekConfig.DEFAULT_FORMAT);
        assertThat(config.output().showConditions()).isTrue();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        PeekConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(PeekConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pypeek.yaml");
        Files.writeString(configFile, "source: [unclosed\n  - broken: {");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PeekConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("pypeek.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(PeekConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(PeekConfig.defaults());
    }

    @Test
    void loadFromDirectory_readsDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "output:\n  format: json\n");

        assertThat(ConfigLoader.loadFromDirectory(tempDir).output().format()).isEqualTo("json");
    }

    @Test
    void loadFromDirectory_withoutFile_returnsDefaults() {
        assertThat(ConfigLoader.loadFromDirectory(tempDir)).isEqualTo(PeekConfig.defaults());
    }
}
