package com.codelens.core.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the Python source files below a project root.
 *
 * <p>A directory or file is skipped when its name equals an ignore pattern, matches it as a
 * glob (for example {@code *.egg-info}), or starts with a dot. Skipped directories are not
 * descended.
 */
public class SourceFileCollector {

    private static final Logger log = LoggerFactory.getLogger(SourceFileCollector.class);

    private static final String PYTHON_EXTENSION = ".py";

    private final List<String> exactNames = new ArrayList<>();
    private final List<PathMatcher> globs = new ArrayList<>();

    public SourceFileCollector(List<String> ignorePatterns) {
        for (String pattern : ignorePatterns) {
            if (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0) {
                globs.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            } else {
                exactNames.add(pattern);
            }
        }
    }

    /**
     * Returns the Python files below {@code root}, sorted by their relative path.
     *
     * @param root project root directory
     * @return absolute file paths
     * @throws IOException if the directory tree cannot be walked
     */
    public List<Path> collect(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && ignored(dir.getFileName())) {
                    log.debug("Skipping directory {}", root.relativize(dir));
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (attrs.isRegularFile() && name.endsWith(PYTHON_EXTENSION) && !ignored(file.getFileName())) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot read {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.comparing(file -> relativePath(root, file)));
        return files;
    }

    /**
     * Returns {@code file} relative to {@code root} with {@code /} separators.
     *
     * @param root project root
     * @param file file below the root
     * @return relative path
     */
    public static String relativePath(Path root, Path file) {
        List<String> segments = new ArrayList<>();
        for (Path segment : root.relativize(file)) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }

    private boolean ignored(Path name) {
        if (name == null) {
            return false;
        }
        String text = name.toString();
        if (text.startsWith(".") || exactNames.contains(text)) {
            return true;
        }
        return globs.stream().anyMatch(glob -> glob.matches(name));
    }
}
