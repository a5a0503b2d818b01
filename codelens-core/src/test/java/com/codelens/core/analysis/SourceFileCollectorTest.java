package com.codelens.core.analysis;

import com.codelens.core.config.CodeLensConfig.AnalysisSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceFileCollector}.
 */
class SourceFileCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void collect_defaultPatterns_skipsIgnoredAndHiddenEntries() throws IOException {
        write("app/models.py");
        write("app/__pycache__/models.cpython-311.py");
        write("venv/lib/site.py");
        write("pkg.egg-info/setup.py");
        write(".hidden/secret.py");
        write("app/.hidden.py");
        write("app/README.md");
        write("main.py");

        List<Path> files = new SourceFileCollector(AnalysisSettings.DEFAULT_IGNORE_PATTERNS).collect(tempDir);

        assertThat(files)
            .extracting(file -> SourceFileCollector.relativePath(tempDir, file))
            .containsExactly("app/models.py", "main.py");
    }

    @Test
    void collect_customGlob_skipsMatchingFiles() throws IOException {
        write("accounts/ledger.py");
        write("accounts/test_ledger.py");

        List<Path> files = new SourceFileCollector(List.of("test_*.py")).collect(tempDir);

        assertThat(files)
            .extracting(file -> SourceFileCollector.relativePath(tempDir, file))
            .containsExactly("accounts/ledger.py");
    }

    @Test
    void collect_results_areSortedByRelativePath() throws IOException {
        write("z.py");
        write("b/a.py");
        write("a.py");

        List<Path> files = new SourceFileCollector(List.of()).collect(tempDir);

        assertThat(files)
            .extracting(file -> SourceFileCollector.relativePath(tempDir, file))
            .containsExactly("a.py", "b/a.py", "z.py");
    }

    private void write(String relativePath) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x = 1\n");
    }
}
