package com.codelens.cli;

import com.codelens.core.analysis.ProjectAnalysisWriter;
import com.codelens.core.analysis.ProjectAnalyzer;
import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.config.ConfigLoader;
import com.codelens.core.model.ProjectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to parse a project and export its structural analysis as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze the current directory
 * codelens analyze
 *
 * # Analyze a project and choose the output file
 * codelens analyze /path/to/project -o analysis.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Parse a Python project and export entities and relationships",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codelens.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: <output directory>/<project>_analysis.json)"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        try {
            CodeLensConfig config = ConfigLoader.load(configPath);
            ProjectAnalysis analysis = new ProjectAnalyzer(config).analyze(projectPath);

            Path target = outputFile != null
                ? outputFile
                : Paths.get(config.output().directory(), analysis.projectName() + "_analysis.json");
            new ProjectAnalysisWriter().write(analysis, target);

            Summaries.printAnalysis(analysis);
            System.out.println("✓ Analysis saved to: " + target.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }
}
