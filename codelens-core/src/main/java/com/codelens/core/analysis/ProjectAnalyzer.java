package com.codelens.core.analysis;

import com.codelens.core.config.CodeLensConfig;
import com.codelens.core.config.CodeLensConfig.AnalysisSettings;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.ProjectAnalysis;
import com.codelens.core.model.Relationship;
import com.codelens.core.parser.PythonSourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Analyzes every Python file of a project and links the results across files.
 *
 * <p>Files are parsed in parallel on a fixed-size pool. All parse tasks are joined before
 * cross-file resolution starts, and the file analyses keep the order in which the files were
 * collected. A failure while analyzing one file is recorded as a project error and the scan
 * continues.
 */
public class ProjectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalyzer.class);

    /** MDC key holding the file being parsed. */
    public static final String MDC_FILE = "file";

    private static final String TEST_MARKER = "test";

    private final String projectName;
    private final int parallelism;
    private final SourceFileCollector collector;
    private final PythonSourceParser parser;
    private final CrossFileResolver resolver;

    public ProjectAnalyzer(CodeLensConfig config) {
        this(config.project().name(), config.analysis());
    }

    public ProjectAnalyzer(String projectName, AnalysisSettings settings) {
        this.projectName = projectName;
        this.parallelism = settings.parallelism();
        this.collector = new SourceFileCollector(settings.ignorePatterns());
        this.parser = new PythonSourceParser(settings);
        this.resolver = new CrossFileResolver();
    }

    /**
     * Analyzes the project below {@code root}.
     *
     * @param root project root directory
     * @return project analysis
     * @throws AnalysisException if the root is not a readable directory
     */
    public ProjectAnalysis analyze(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new AnalysisException("Project root is not a directory: " + root);
        }
        Path absoluteRoot = root.toAbsolutePath().normalize();
        String name = projectName != null && !projectName.isBlank()
            ? projectName
            : defaultProjectName(absoluteRoot);

        log.info("Starting project analysis: {} ({})", name, absoluteRoot);

        List<Path> files;
        try {
            files = collector.collect(absoluteRoot);
        } catch (IOException e) {
            throw new AnalysisException("Failed to walk project root " + absoluteRoot, e);
        }
        log.info("Found {} Python files to analyze", files.size());

        List<FileAnalysis> fileAnalyses = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        parseAll(absoluteRoot, files, fileAnalyses, errors);

        List<Relationship> crossFile = resolver.resolve(fileAnalyses);

        log.info("Project analysis complete: {} files, {} errors", fileAnalyses.size(), errors.size());
        return new ProjectAnalysis(name, fileAnalyses, crossFile, errors);
    }

    /**
     * Names a project after its root directory; a filesystem root has no file name and keeps
     * its full path.
     */
    static String defaultProjectName(Path absoluteRoot) {
        Path fileName = absoluteRoot.getFileName();
        return fileName == null ? absoluteRoot.toString() : fileName.toString();
    }

    private void parseAll(Path root, List<Path> files, List<FileAnalysis> fileAnalyses, List<String> errors) {
        if (files.isEmpty()) {
            return;
        }
        List<String> relativePaths = files.stream()
            .map(file -> SourceFileCollector.relativePath(root, file))
            .toList();

        List<Callable<FileAnalysis>> tasks = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            String relativePath = relativePaths.get(i);
            int position = i + 1;
            tasks.add(() -> parseOne(file, relativePath, position, files.size()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, files.size()), new ParserThreadFactory());
        try {
            List<Future<FileAnalysis>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                String relativePath = relativePaths.get(i);
                try {
                    FileAnalysis analysis = futures.get(i).get();
                    fileAnalyses.add(analysis);
                    for (String error : analysis.errors()) {
                        errors.add(relativePath + ": " + error);
                    }
                } catch (ExecutionException e) {
                    String error = "Failed to analyze " + relativePath + ": " + e.getCause();
                    log.error(error, e.getCause());
                    errors.add(error);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Project analysis was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private FileAnalysis parseOne(Path file, String relativePath, int position, int total) {
        MDC.put(MDC_FILE, relativePath);
        try {
            log.debug("Analyzing file {}/{}: {}", position, total, relativePath);
            FileAnalysis analysis = parser.parseFile(file, relativePath);
            return isTestPath(relativePath) ? analysis.withMetadata(FileAnalysis.IS_TEST_FILE, true) : analysis;
        } finally {
            MDC.remove(MDC_FILE);
        }
    }

    /**
     * Returns true when any segment of the path contains {@code test}.
     *
     * @param relativePath {@code /}-separated path
     * @return whether the path looks like test code
     */
    public static boolean isTestPath(String relativePath) {
        for (String segment : relativePath.split("/")) {
            if (segment.toLowerCase(Locale.ROOT).contains(TEST_MARKER)) {
                return true;
            }
        }
        return false;
    }

    private static final class ParserThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "codelens-parser-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
