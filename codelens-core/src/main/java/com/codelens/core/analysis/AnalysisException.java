package com.codelens.core.analysis;

/**
 * Raised when a project scan cannot start at all, for example because the root directory
 * does not exist, or when its result cannot be exported. Problems with individual files
 * never raise this exception.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
