package com.codelens.core.parser;

/**
 * Raised by {@link ThrowingErrorListener} on the first syntax error of a file.
 */
class PythonSyntaxException extends RuntimeException {

    private final int line;

    PythonSyntaxException(int line, String message) {
        super(message);
        this.line = line;
    }

    int line() {
        return line;
    }
}
