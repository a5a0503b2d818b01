package com.codelens.core.analysis;

import com.codelens.core.config.CodeLensConfig.AnalysisSettings;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.FunctionEntity;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.model.Relationship;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ProjectAnalyzer}.
 */
class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    private final ProjectAnalyzer analyzer = new ProjectAnalyzer(null, AnalysisSettings.defaults());

    @Test
    void analyze_emptyDirectory_returnsEmptyAnalysis() {
        ProjectAnalysis analysis = analyzer.analyze(tempDir);

        assertThat(analysis.fileAnalyses()).isEmpty();
        assertThat(analysis.allEntities()).isEmpty();
        assertThat(analysis.errors()).isEmpty();
        assertThat(analysis.projectName()).isEqualTo(tempDir.getFileName().toString());
    }

    @Test
    void analyze_callAcrossFiles_producesQualifiedCrossFileRelationship() throws IOException {
        Files.writeString(tempDir.resolve("a.py"), """
            def helper():
                return 1
            """);
        Files.writeString(tempDir.resolve("b.py"), """
            def process():
                return helper()
            """);

        ProjectAnalysis analysis = analyzer.analyze(tempDir);

        assertThat(analysis.fileAnalyses()).extracting(FileAnalysis::filePath).containsExactly("a.py", "b.py");
        assertThat(analysis.crossFileRelationships()).singleElement().satisfies(relationship -> {
            assertThat(relationship.source()).isEqualTo("b.py::process");
            assertThat(relationship.target()).isEqualTo("a.py::helper");
            assertThat(relationship.crossFile()).isTrue();
            assertThat(relationship.fileMetadata(Relationship.SOURCE_FILE)).isEqualTo("b.py");
            assertThat(relationship.fileMetadata(Relationship.TARGET_FILE)).isEqualTo("a.py");
        });
    }

    @Test
    void analyze_brokenFile_recordsErrorAndContinues() throws IOException {
        Files.writeString(tempDir.resolve("good.py"), "def ok():\n    pass\n");
        Files.writeString(tempDir.resolve("bad.py"), "def broken(:\n    pass\n");

        ProjectAnalysis analysis = analyzer.analyze(tempDir);

        assertThat(analysis.fileAnalyses()).hasSize(2);
        assertThat(analysis.allFunctions()).extracting(FunctionEntity::name).containsExactly("ok");
        assertThat(analysis.errors()).singleElement().asString().startsWith("bad.py: Syntax error at line 1");
    }

    @Test
    void analyze_configuredName_overridesDirectoryName() throws IOException {
        Files.writeString(tempDir.resolve("m.py"), "x = 1\n");

        ProjectAnalysis analysis = new ProjectAnalyzer("erpnext", AnalysisSettings.defaults()).analyze(tempDir);

        assertThat(analysis.projectName()).isEqualTo("erpnext");
    }

    @Test
    void analyze_testDirectory_marksTestFiles() throws IOException {
        Files.createDirectories(tempDir.resolve("tests"));
        Files.writeString(tempDir.resolve("tests/ledger_cases.py"), "def check():\n    pass\n");
        Files.writeString(tempDir.resolve("ledger.py"), "def post():\n    pass\n");

        ProjectAnalysis analysis = analyzer.analyze(tempDir);

        assertThat(analysis.fileAnalyses())
            .extracting(FileAnalysis::filePath, FileAnalysis::testFile)
            .containsExactly(
                tuple("ledger.py", false),
                tuple("tests/ledger_cases.py", true));
    }

    @Test
    void analyze_singleThread_matchesParallelResult() throws IOException {
        for (int i = 0; i < 6; i++) {
            Files.writeString(tempDir.resolve("module" + i + ".py"),
                "def f" + i + "():\n    return f" + ((i + 1) % 6) + "()\n");
        }

        ProjectAnalysis parallel = new ProjectAnalyzer("p", new AnalysisSettings(null, null, 4, null)).analyze(tempDir);
        ProjectAnalysis sequential = new ProjectAnalyzer("p", new AnalysisSettings(null, null, 1, null)).analyze(tempDir);

        assertThat(parallel).isEqualTo(sequential);
        assertThat(parallel.crossFileRelationships()).hasSize(6);
    }

    @Test
    void analyze_missingRoot_throws() {
        assertThatThrownBy(() -> analyzer.analyze(tempDir.resolve("missing")))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("not a directory");
    }

    @Test
    void defaultProjectName_filesystemRoot_usesFullPath() {
        Path filesystemRoot = tempDir.toAbsolutePath().getRoot();

        assertThat(ProjectAnalyzer.defaultProjectName(filesystemRoot)).isEqualTo(filesystemRoot.toString());
        assertThat(ProjectAnalyzer.defaultProjectName(tempDir.resolve("shop").toAbsolutePath())).isEqualTo("shop");
    }

    @Test
    void isTestPath_segmentContainingTest_isTest() {
        assertThat(ProjectAnalyzer.isTestPath("tests/unit/ledger.py")).isTrue();
        assertThat(ProjectAnalyzer.isTestPath("accounts/test_ledger.py")).isTrue();
        assertThat(ProjectAnalyzer.isTestPath("accounts/TestCases.py")).isTrue();
        assertThat(ProjectAnalyzer.isTestPath("accounts/ledger.py")).isFalse();
    }
}
