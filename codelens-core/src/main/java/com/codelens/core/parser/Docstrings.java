package com.codelens.core.parser;

import com.codelens.parser.Python3Parser.AtomContext;
import com.codelens.parser.Python3Parser.BlockContext;
import com.codelens.parser.Python3Parser.Expr_stmtContext;
import com.codelens.parser.Python3Parser.Simple_stmtContext;
import com.codelens.parser.Python3Parser.Simple_stmtsContext;
import com.codelens.parser.Python3Parser.StmtContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Docstring detection and cleanup.
 *
 * <p>A docstring is a plain string literal (implicit concatenation allowed, bytes and
 * f-strings excluded) forming the first statement of a body. The literal is decoded and
 * its indentation normalized the way {@code inspect.cleandoc} does.
 */
final class Docstrings {

    private static final int TAB_SIZE = 8;

    private Docstrings() {
    }

    /**
     * Returns the cleaned docstring of a body, or null when it has none or it is blank.
     */
    static String of(BlockContext block) {
        Simple_stmtsContext first = firstSimpleStatements(block);
        if (first == null) {
            return null;
        }
        Simple_stmtContext statement = first.simple_stmt(0);
        Expr_stmtContext expression = statement.expr_stmt();
        if (expression == null || expression.getChildCount() != 1) {
            return null;
        }
        AtomContext atom = ParseTrees.singleDescendant(expression, AtomContext.class);
        if (atom == null || atom.STRING().isEmpty()) {
            return null;
        }

        StringBuilder value = new StringBuilder();
        for (TerminalNode literal : atom.STRING()) {
            String decoded = decodeLiteral(literal.getText());
            if (decoded == null) {
                return null;
            }
            value.append(decoded);
        }
        String cleaned = clean(value.toString());
        return cleaned.isEmpty() ? null : cleaned;
    }

    private static Simple_stmtsContext firstSimpleStatements(BlockContext block) {
        if (block.simple_stmts() != null) {
            return block.simple_stmts();
        }
        List<StmtContext> statements = block.stmt();
        if (statements.isEmpty()) {
            return null;
        }
        return statements.get(0).simple_stmts();
    }

    /**
     * Decodes one Python string literal token, or returns null for bytes and f-strings.
     */
    static String decodeLiteral(String token) {
        int quoteIndex = 0;
        while (quoteIndex < token.length() && token.charAt(quoteIndex) != '\'' && token.charAt(quoteIndex) != '"') {
            quoteIndex++;
        }
        String prefix = token.substring(0, quoteIndex).toLowerCase(Locale.ROOT);
        if (prefix.contains("b") || prefix.contains("f")) {
            return null;
        }
        boolean raw = prefix.contains("r");

        String body = token.substring(quoteIndex);
        int quoteLength = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
        String content = body.substring(quoteLength, body.length() - quoteLength);
        return raw ? content : unescape(content);
    }

    private static String unescape(String content) {
        StringBuilder out = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char ch = content.charAt(i);
            if (ch != '\\' || i + 1 >= content.length()) {
                out.append(ch);
                i++;
                continue;
            }
            char next = content.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < content.length() && content.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = appendCodePoint(content, i, 2, out, "\\x");
                case 'u' -> i = appendCodePoint(content, i, 4, out, "\\u");
                case 'U' -> i = appendCodePoint(content, i, 8, out, "\\U");
                case 'N' -> i = appendNamedCharacter(content, i, out);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i;
                        while (end < content.length() && end < i + 2
                            && content.charAt(end) >= '0' && content.charAt(end) <= '7') {
                            end++;
                        }
                        out.append((char) Integer.parseInt(content.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        // unknown escapes are kept verbatim
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendCodePoint(String content, int from, int digits, StringBuilder out, String escape) {
        int end = from + digits;
        if (end <= content.length() && isHex(content, from, end)) {
            int codePoint = Integer.parseInt(content.substring(from, end), 16);
            if (Character.isValidCodePoint(codePoint)) {
                out.appendCodePoint(codePoint);
                return end;
            }
        }
        // malformed escapes keep their text
        out.append(escape);
        return from;
    }

    /**
     * Decodes a {@code \\N{NAME}} escape by its Unicode character name.
     */
    private static int appendNamedCharacter(String content, int from, StringBuilder out) {
        int close = content.indexOf('}', from);
        if (from < content.length() && content.charAt(from) == '{' && close > from + 1) {
            String name = content.substring(from + 1, close);
            try {
                out.appendCodePoint(Character.codePointOf(name));
                return close + 1;
            } catch (IllegalArgumentException e) {
                // unknown names keep their text like other malformed escapes
                out.append("\\N");
                return from;
            }
        }
        out.append("\\N");
        return from;
    }

    private static boolean isHex(String content, int from, int end) {
        for (int i = from; i < end; i++) {
            if (Character.digit(content.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Normalizes docstring indentation like {@code inspect.cleandoc}.
     */
    static String clean(String docstring) {
        String[] rawLines = expandTabs(docstring).split("\r\n|\r|\n", -1);
        List<String> lines = new ArrayList<>(List.of(rawLines));

        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }

        lines.set(0, lines.get(0).stripLeading());
        if (margin != Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.length() >= margin ? line.substring(margin) : line.stripLeading());
            }
        }

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(String text) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int column = 0;
        for (char ch : text.toCharArray()) {
            if (ch == '\t') {
                int spaces = TAB_SIZE - (column % TAB_SIZE);
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(ch);
                column = ch == '\n' || ch == '\r' ? 0 : column + 1;
            }
        }
        return out.toString();
    }
}
