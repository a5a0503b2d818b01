package com.codelens.core.parser;

import com.codelens.core.model.Location;
import com.codelens.parser.Python3Parser;
import com.codelens.parser.Python3Parser.File_inputContext;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.List;

/**
 * A successfully parsed file as seen by both extraction passes.
 *
 * @param filePath path recorded in locations
 * @param lines source lines without line terminators
 * @param tokens the token stream the tree was built from
 * @param tree parse tree root
 * @param previewLines number of definition lines kept as source preview
 */
record ParsedSource(
    String filePath,
    List<String> lines,
    CommonTokenStream tokens,
    File_inputContext tree,
    int previewLines
) {

    /**
     * Builds the location of a definition that starts at {@code start} and spans {@code node}.
     */
    Location locationOf(Token start, ParserRuleContext node) {
        return new Location(filePath, start.getLine(), lastLine(node), start.getCharPositionInLine());
    }

    /**
     * Returns the last source line covered by {@code node}.
     *
     * <p>A block ends with synthetic NEWLINE/DEDENT tokens positioned on the following line,
     * so the end is taken from the last real token, adjusted for multi-line string tokens.
     */
    int lastLine(ParserRuleContext node) {
        int index = node.getStop().getTokenIndex();
        int startIndex = node.getStart().getTokenIndex();
        while (index > startIndex && synthetic(tokens.get(index))) {
            index--;
        }
        Token last = tokens.get(index);
        int line = last.getLine();
        String text = last.getText();
        if (text != null && last.getType() == Python3Parser.STRING) {
            line += (int) text.chars().filter(ch -> ch == '\n').count();
        }
        return Math.max(line, node.getStart().getLine());
    }

    /**
     * Returns the first {@code previewLines} lines of the range, or null when previews are off.
     */
    String preview(int lineStart, int lineEnd) {
        if (previewLines == 0) {
            return null;
        }
        int from = lineStart - 1;
        int to = Math.min(Math.min(lineEnd, lines.size()), from + previewLines);
        if (from >= to) {
            return null;
        }
        return String.join("\n", lines.subList(from, to));
    }

    private static boolean synthetic(Token token) {
        int type = token.getType();
        return type == Python3Parser.NEWLINE
            || type == Python3Parser.INDENT
            || type == Python3Parser.DEDENT
            || type == Token.EOF;
    }
}
