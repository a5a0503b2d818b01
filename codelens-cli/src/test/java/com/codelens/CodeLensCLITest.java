package com.codelens;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.codelens.core.analysis.ProjectAnalyzer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the CodeLens command line.
 */
class CodeLensCLITest {

    @TempDir
    Path tempDir;

    private Path project;
    private Path missingConfig;
    private Level rootLevel;
    private Level projectLevel;

    @BeforeEach
    void setUp() throws IOException {
        project = tempDir.resolve("shop");
        Files.createDirectories(project.resolve("accounts"));
        Files.writeString(project.resolve("accounts/ledger.py"), """
            def make_gl_entries(voucher):
                \"\"\"Post general ledger entries for a voucher.\"\"\"
                return post_ledger(voucher)


            def post_ledger(voucher):
                return voucher
            """);
        Files.writeString(project.resolve("accounts/invoice.py"), """
            class SalesInvoice:
                def submit(self):
                    make_gl_entries(self)
            """);
        missingConfig = tempDir.resolve("absent.yaml");
        rootLevel = rootLogger().getLevel();
        projectLevel = projectLogger().getLevel();
    }

    @AfterEach
    void restoreLogLevels() {
        rootLogger().setLevel(rootLevel);
        projectLogger().setLevel(projectLevel);
    }

    @Test
    void quietOption_disablesInfoForProjectLoggers() {
        projectLogger().setLevel(Level.INFO);

        CodeLensCLI.commandLine().execute(
            "-q", "analyze", project.toString(), "-c", missingConfig.toString(),
            "-o", tempDir.resolve("quiet.json").toString());

        org.slf4j.Logger analyzerLog = LoggerFactory.getLogger(ProjectAnalyzer.class);
        assertThat(analyzerLog.isInfoEnabled()).isFalse();
        assertThat(analyzerLog.isErrorEnabled()).isTrue();
    }

    @Test
    void verboseOption_enablesDebugForProjectLoggers() {
        projectLogger().setLevel(Level.INFO);

        CodeLensCLI.commandLine().execute(
            "-v", "analyze", project.toString(), "-c", missingConfig.toString(),
            "-o", tempDir.resolve("verbose.json").toString());

        assertThat(LoggerFactory.getLogger(ProjectAnalyzer.class).isDebugEnabled()).isTrue();
    }

    @Test
    void noLogOption_keepsProjectLoggersAtInfo() {
        projectLogger().setLevel(Level.ERROR);

        CodeLensCLI.commandLine().execute("analyze", project.toString(), "-c", missingConfig.toString(),
            "-o", tempDir.resolve("default.json").toString());

        org.slf4j.Logger analyzerLog = LoggerFactory.getLogger(ProjectAnalyzer.class);
        assertThat(analyzerLog.isInfoEnabled()).isTrue();
        assertThat(analyzerLog.isDebugEnabled()).isFalse();
    }

    @Test
    void execute_version_returnsZero() {
        int exitCode = CodeLensCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
    }

    @Test
    void parseArgs_globalOptions_setFlags() {
        CodeLensCLI cli = new CodeLensCLI();
        new CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void analyze_writesAnalysisJson() throws IOException {
        Path output = tempDir.resolve("out/analysis.json");

        int exitCode = CodeLensCLI.commandLine().execute(
            "-q", "analyze", project.toString(), "-c", missingConfig.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(Files.readString(output))
            .contains("\"project_name\"")
            .contains("make_gl_entries");
    }

    @Test
    void indexThenQuery_returnsZero() {
        Path index = tempDir.resolve("out/shop_semantic_index.json");

        int indexExit = CodeLensCLI.commandLine().execute(
            "-q", "index", project.toString(), "-c", missingConfig.toString(), "-o", index.toString());
        int queryExit = CodeLensCLI.commandLine().execute(
            "-q", "query", index.toString(), "ledger", "entries", "-c", missingConfig.toString(), "-n", "3");
        int filesExit = CodeLensCLI.commandLine().execute(
            "-q", "query", index.toString(), "invoice", "--files", "-c", missingConfig.toString());
        int workflowsExit = CodeLensCLI.commandLine().execute("-q", "workflows", index.toString());

        assertThat(indexExit).isZero();
        assertThat(index).exists();
        assertThat(queryExit).isZero();
        assertThat(filesExit).isZero();
        assertThat(workflowsExit).isZero();
    }

    @Test
    void query_missingIndex_returnsOne() {
        int exitCode = CodeLensCLI.commandLine().execute(
            "-q", "query", tempDir.resolve("nope.json").toString(), "ledger", "-c", missingConfig.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void index_missingProject_returnsOne() {
        int exitCode = CodeLensCLI.commandLine().execute(
            "-q", "index", tempDir.resolve("missing").toString(), "-c", missingConfig.toString(),
            "-o", tempDir.resolve("index.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void query_withoutWords_returnsUsageError() {
        int exitCode = CodeLensCLI.commandLine().execute("-q", "query", "index.json");

        assertThat(exitCode).isEqualTo(2);
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }

    private static Logger projectLogger() {
        return (Logger) LoggerFactory.getLogger(CodeLensCLI.PROJECT_LOGGER_NAME);
    }
}
