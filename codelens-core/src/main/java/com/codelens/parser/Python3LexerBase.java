package com.codelens.parser;

import java.util.ArrayDeque;
import java.util.Deque;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class for the Python 3 lexer.
 *
 * <p>Python blocks are delimited by indentation, which a context-free grammar cannot express.
 * This base class tracks the indentation stack and turns every significant line break into a
 * {@code NEWLINE} token followed by the {@code INDENT}/{@code DEDENT} tokens the parser expects.
 * Line breaks inside brackets and on blank or comment-only lines are dropped.
 */
public abstract class Python3LexerBase extends Lexer {

    private static final int TAB_WIDTH = 8;

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
    }

    @Override
    public Token nextToken() {
        if (_input.LA(1) == EOF && !indents.isEmpty()) {
            pending.removeIf(token -> token.getType() == EOF);
            emit(commonToken(Python3Lexer.NEWLINE, "\n"));
            while (!indents.isEmpty()) {
                emit(commonToken(Python3Lexer.DEDENT, ""));
                indents.pop();
            }
            emit(commonToken(EOF, "<EOF>"));
        }

        Token next = super.nextToken();
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        pending.clear();
        indents.clear();
        opened = 0;
        super.reset();
    }

    protected void openBrace() {
        opened++;
    }

    protected void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    /**
     * Called at the end of every {@code NEWLINE} match.
     */
    protected void onNewLine() {
        String text = getText();
        String lineBreak = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");

        int next = _input.LA(1);
        if (opened > 0 || next == '\r' || next == '\n' || next == '\f' || next == '#') {
            skip();
            return;
        }

        emit(commonToken(Python3Lexer.NEWLINE, lineBreak));

        int indent = next == EOF ? 0 : indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(commonToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(commonToken(Python3Lexer.DEDENT, ""));
                indents.pop();
            }
        }
    }

    private CommonToken commonToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }

    static int indentationOf(String whitespace) {
        int count = 0;
        for (char ch : whitespace.toCharArray()) {
            if (ch == '\t') {
                count += TAB_WIDTH - (count % TAB_WIDTH);
            } else {
                count++;
            }
        }
        return count;
    }
}
