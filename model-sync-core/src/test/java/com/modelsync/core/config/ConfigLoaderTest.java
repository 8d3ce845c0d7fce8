package com.modelsync.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_returnsDefaults() {
        ModelSyncConfig config = ConfigLoader.load(tempDir.resolve("model-sync.yaml"));

        assertThat(config).isEqualTo(ModelSyncConfig.defaults());
        assertThat(config.sync().textDebounceMs()).isEqualTo(100L);
        assertThat(config.sync().editBatchDebounceMs()).isEqualTo(50L);
        assertThat(config.layout().algorithm()).isEqualTo("grid");
        assertThat(config.ports().size()).isEqualTo(10.0);
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(ModelSyncConfig.defaults());
    }

    @Test
    void load_partialYaml_fillsRemainingDefaults() throws IOException {
        Path file = tempDir.resolve("model-sync.yaml");
        Files.writeString(file, """
            sync:
              textDebounceMs: 250
              validateEdits: false
            layout:
              algorithm: tree
              autoLayout: false
            unknownSection:
              ignored: true
            """);

        ModelSyncConfig config = ConfigLoader.load(file);

        assertThat(config.sync().textDebounceMs()).isEqualTo(250L);
        assertThat(config.sync().editBatchDebounceMs()).isEqualTo(50L);
        assertThat(config.sync().validateEdits()).isFalse();
        assertThat(config.layout().algorithm()).isEqualTo("tree");
        assertThat(config.layout().autoLayout()).isFalse();
        assertThat(config.layout().nodeSpacing()).isEqualTo(50.0);
        assertThat(config.ports()).isEqualTo(ModelSyncConfig.PortSettings.defaults());
    }

    @Test
    void load_negativeDebounceAndPortSize_areNormalized() throws IOException {
        Path file = tempDir.resolve("model-sync.yaml");
        Files.writeString(file, """
            sync:
              editBatchDebounceMs: -5
            ports:
              size: 0
            """);

        ModelSyncConfig config = ConfigLoader.load(file);

        assertThat(config.sync().editBatchDebounceMs()).isZero();
        assertThat(config.ports().size()).isEqualTo(10.0);
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("model-sync.yaml");
        Files.writeString(file, "sync: [unclosed\n  : :");

        assertThat(ConfigLoader.load(file)).isEqualTo(ModelSyncConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("model-sync.yaml");
        Files.writeString(file, "");

        assertThat(ConfigLoader.load(file)).isEqualTo(ModelSyncConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ModelSyncConfig.defaults());
    }
}
