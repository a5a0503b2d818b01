package com.codelens.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("codelens.yaml");
        Files.writeString(configFile, """
            project:
              name: "erpnext"

            analysis:
              ignore_patterns: ["__pycache__", "*.egg-info"]
              max_file_size_bytes: 2048
              parallelism: 2
              source_preview_lines: 5

            domain:
              concepts:
                billing: ["invoice", "bill"]
              path_patterns: ["billing"]

            query:
              max_results: 25

            output:
              directory: "./out"
            """);

        CodeLensConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("erpnext");
        assertThat(config.analysis().ignorePatterns()).containsExactly("__pycache__", "*.egg-info");
        assertThat(config.analysis().maxFileSizeBytes()).isEqualTo(2048L);
        assertThat(config.analysis().parallelism()).isEqualTo(2);
        assertThat(config.analysis().sourcePreviewLines()).isEqualTo(5);
        assertThat(config.domain().concepts()).containsEntry("billing", List.of("invoice", "bill"));
        assertThat(config.domain().pathPatterns()).containsExactly("billing");
        assertThat(config.query().maxResults()).isEqualTo(25);
        assertThat(config.output().directory()).isEqualTo("./out");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codelens.yaml");
        Files.writeString(configFile, """
            project:
              name: "MinimalProject"
            unknown_section:
              key: value
            """);

        CodeLensConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("MinimalProject");
        assertThat(config.analysis().ignorePatterns())
            .isEqualTo(CodeLensConfig.AnalysisSettings.DEFAULT_IGNORE_PATTERNS);
        assertThat(config.analysis().maxFileSizeBytes())
            .isEqualTo(CodeLensConfig.AnalysisSettings.DEFAULT_MAX_FILE_SIZE_BYTES);
        assertThat(config.analysis().parallelism()).isPositive();
        assertThat(config.domain().concepts()).isNull();
        assertThat(config.query().maxResults()).isEqualTo(CodeLensConfig.QuerySettings.DEFAULT_MAX_RESULTS);
        assertThat(config.output().directory()).isEqualTo(".");
    }

    @Test
    void load_invalidValues_fallBackToDefaults() throws IOException {
        Path configFile = tempDir.resolve("codelens.yaml");
        Files.writeString(configFile, """
            analysis:
              max_file_size_bytes: -1
              parallelism: 0
            query:
              max_results: 0
            """);

        CodeLensConfig config = ConfigLoader.load(configFile);

        assertThat(config.analysis().maxFileSizeBytes())
            .isEqualTo(CodeLensConfig.AnalysisSettings.DEFAULT_MAX_FILE_SIZE_BYTES);
        assertThat(config.analysis().parallelism()).isPositive();
        assertThat(config.query().maxResults()).isEqualTo(10);
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        CodeLensConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(CodeLensConfig.defaults());
        assertThat(config.project().name()).isNull();
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codelens.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        CodeLensConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CodeLensConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("codelens.yaml");
        Files.writeString(configFile, "");

        CodeLensConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(CodeLensConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        CodeLensConfig config = ConfigLoader.load(directory);

        assertThat(config).isEqualTo(CodeLensConfig.defaults());
    }
}
