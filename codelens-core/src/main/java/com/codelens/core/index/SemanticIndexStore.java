package com.codelens.core.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads semantic indexes as JSON.
 *
 * <p>A saved index loads back equal to the original, confidence values included.
 */
public class SemanticIndexStore {

    private static final Logger log = LoggerFactory.getLogger(SemanticIndexStore.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Writes the index to {@code output}, creating parent directories.
     *
     * @param index semantic index
     * @param output target file
     * @throws IndexStoreException if the file cannot be written
     */
    public void save(SemanticIndex index, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(output.toFile(), index);
            log.info("Saved semantic index to {}", output);
        } catch (IOException e) {
            throw new IndexStoreException("Failed to save semantic index to " + output, e);
        }
    }

    /**
     * Reads an index written by {@link #save(SemanticIndex, Path)}.
     *
     * @param input index file
     * @return semantic index
     * @throws IndexStoreException if the file cannot be read or parsed
     */
    public SemanticIndex load(Path input) {
        try {
            SemanticIndex index = mapper.readValue(input.toFile(), SemanticIndex.class);
            log.info("Loaded semantic index from {}", input);
            return index;
        } catch (IOException e) {
            throw new IndexStoreException("Failed to load semantic index from " + input, e);
        }
    }

    public String toJson(SemanticIndex index) {
        try {
            return mapper.writeValueAsString(index);
        } catch (IOException e) {
            throw new IndexStoreException("Failed to serialize semantic index", e);
        }
    }
}
