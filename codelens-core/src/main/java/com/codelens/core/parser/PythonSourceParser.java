package com.codelens.core.parser;

import com.codelens.core.config.CodeLensConfig.AnalysisSettings;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.FileAnalysis;
import com.codelens.core.model.Relationship;
import com.codelens.parser.Python3Lexer;
import com.codelens.parser.Python3Parser;
import com.codelens.parser.Python3Parser.File_inputContext;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Parses one Python source file into entities and relationships.
 *
 * <p>Parsing runs in two passes over the same ANTLR parse tree: {@link EntityExtractor}
 * collects functions, classes and imports, then {@link RelationshipExtractor} collects calls
 * and inheritance. Neither pass keeps state between files, so one parser instance can be
 * shared by any number of threads.
 *
 * <p>No exception escapes {@link #parseFile(Path, String)}. Oversized files, unreadable files,
 * invalid UTF-8 and syntax errors are reported as error messages on the returned
 * {@link FileAnalysis}, whose entity and relationship lists are then empty.
 */
public class PythonSourceParser {

    private static final Logger log = LoggerFactory.getLogger(PythonSourceParser.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final long maxFileSizeBytes;
    private final int sourcePreviewLines;

    public PythonSourceParser() {
        this(AnalysisSettings.defaults());
    }

    public PythonSourceParser(AnalysisSettings settings) {
        this.maxFileSizeBytes = settings.maxFileSizeBytes();
        this.sourcePreviewLines = settings.sourcePreviewLines();
    }

    /**
     * Reads and parses a file.
     *
     * @param file file to read
     * @param filePath path recorded in the analysis and in every location
     * @return analysis of the file, possibly holding only an error
     */
    public FileAnalysis parseFile(Path file, String filePath) {
        byte[] bytes;
        try {
            long size = Files.size(file);
            if (size > maxFileSizeBytes) {
                return fail(filePath, "File exceeds maximum size (" + size + " bytes)");
            }
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            return fail(filePath, "File access error: " + describe(e));
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        String source;
        try {
            source = decoder.decode(buffer).toString();
        } catch (CharacterCodingException e) {
            return fail(filePath, "Encoding error: invalid UTF-8 byte sequence at offset " + buffer.position());
        }
        if (!source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
            source = source.substring(1);
        }
        return parseSource(source, filePath);
    }

    /**
     * Parses source text that is already in memory.
     *
     * @param source Python source
     * @param filePath path recorded in the analysis and in every location
     * @return analysis of the source, possibly holding only an error
     */
    public FileAnalysis parseSource(String source, String filePath) {
        try {
            ParsedSource parsed = parse(source, filePath);
            List<CodeEntity> entities = new EntityExtractor(parsed).extract();
            List<Relationship> relationships = new RelationshipExtractor(parsed).extract();
            log.debug("Parsed {}: {} entities, {} relationships", filePath, entities.size(), relationships.size());
            return new FileAnalysis(filePath, entities, relationships, List.of(), Map.of());
        } catch (PythonSyntaxException e) {
            return fail(filePath, "Syntax error at line " + e.line() + ": " + e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            return fail(filePath, "Unexpected error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ParsedSource parse(String source, String filePath) {
        String text = source.replace("\r\n", "\n").replace('\r', '\n');
        if (!text.endsWith("\n")) {
            text = text + "\n";
        }

        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(text, filePath));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Python3Parser parser = new Python3Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        File_inputContext tree = parser.file_input();
        List<String> lines = Arrays.asList(text.split("\n", -1));
        return new ParsedSource(filePath, lines, tokens, tree, sourcePreviewLines);
    }

    private static String describe(IOException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static FileAnalysis fail(String filePath, String error) {
        log.warn("Failed to parse {}: {}", filePath, error);
        return FileAnalysis.failed(filePath, error);
    }
}
