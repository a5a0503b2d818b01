package com.codelens.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for CodeLens.
 *
 * <p>Loaded from {@code codelens.yaml}. Every section is optional; missing sections and
 * missing keys fall back to the defaults documented on each nested record.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "erpnext"
 *
 * analysis:
 *   ignore_patterns: ["__pycache__", ".git", "venv", "*.egg-info"]
 *   max_file_size_bytes: 10485760
 *   parallelism: 4
 *   source_preview_lines: 10
 *
 * domain:
 *   concepts:
 *     ledger: ["ledger", "posting", "debit", "credit"]
 *   path_patterns: ["accounts", "ledger"]
 *
 * query:
 *   max_results: 10
 *
 * output:
 *   directory: "./codelens-out"
 * }</pre>
 *
 * @param project project metadata
 * @param analysis file collection and parsing settings
 * @param domain domain vocabulary overrides
 * @param query query engine settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeLensConfig(
    @JsonProperty("project") ProjectSettings project,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("domain") DomainSettings domain,
    @JsonProperty("query") QuerySettings query,
    @JsonProperty("output") OutputSettings output
) {
    public CodeLensConfig {
        project = project == null ? new ProjectSettings(null) : project;
        analysis = analysis == null ? AnalysisSettings.defaults() : analysis;
        domain = domain == null ? new DomainSettings(null, null) : domain;
        query = query == null ? new QuerySettings(null) : query;
        output = output == null ? new OutputSettings(null) : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CodeLensConfig defaults() {
        return new CodeLensConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name; the root directory name is used when absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectSettings(
        @JsonProperty("name") String name
    ) {}

    /**
     * File collection and parsing settings.
     *
     * @param ignorePatterns directory and file names or globs to skip
     * @param maxFileSizeBytes files larger than this are not parsed
     * @param parallelism number of parser threads
     * @param sourcePreviewLines lines of each definition kept as source preview
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("ignore_patterns") List<String> ignorePatterns,
        @JsonProperty("max_file_size_bytes") Long maxFileSizeBytes,
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("source_preview_lines") Integer sourcePreviewLines
    ) {
        public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of(
            "__pycache__", ".git", "venv", "env", ".venv", ".pytest_cache", ".tox", "*.egg-info", "node_modules");
        public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;
        public static final int DEFAULT_SOURCE_PREVIEW_LINES = 10;

        public AnalysisSettings {
            ignorePatterns = ignorePatterns == null ? DEFAULT_IGNORE_PATTERNS : List.copyOf(ignorePatterns);
            if (maxFileSizeBytes == null || maxFileSizeBytes <= 0) {
                maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
            }
            if (parallelism == null || parallelism <= 0) {
                parallelism = Runtime.getRuntime().availableProcessors();
            }
            if (sourcePreviewLines == null || sourcePreviewLines < 0) {
                sourcePreviewLines = DEFAULT_SOURCE_PREVIEW_LINES;
            }
        }

        public static AnalysisSettings defaults() {
            return new AnalysisSettings(null, null, null, null);
        }
    }

    /**
     * Domain vocabulary overrides. Absent values keep the built-in accounting vocabulary.
     *
     * @param concepts concept label to keyword list
     * @param pathPatterns substrings (or regexes) that mark a file path as domain-related
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DomainSettings(
        @JsonProperty("concepts") Map<String, List<String>> concepts,
        @JsonProperty("path_patterns") List<String> pathPatterns
    ) {}

    /**
     * Query engine settings.
     *
     * @param maxResults default number of results
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QuerySettings(
        @JsonProperty("max_results") Integer maxResults
    ) {
        public static final int DEFAULT_MAX_RESULTS = 10;

        public QuerySettings {
            if (maxResults == null || maxResults <= 0) {
                maxResults = DEFAULT_MAX_RESULTS;
            }
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory for the analysis export and the semantic index
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory
    ) {
        public OutputSettings {
            directory = directory == null || directory.isBlank() ? "." : directory;
        }
    }
}
