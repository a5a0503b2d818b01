package com.codelens.core.index;

import java.io.IOException;

/**
 * Raised when a semantic index cannot be written or read back.
 */
public class IndexStoreException extends RuntimeException {

    public IndexStoreException(String message, IOException cause) {
        super(message, cause);
    }
}
