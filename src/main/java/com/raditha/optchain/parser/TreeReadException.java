package com.raditha.optchain.parser;

import java.io.IOException;

/**
 * Raised when an ESTree document cannot be turned into an expression tree.
 */
public class TreeReadException extends IOException {

    public TreeReadException(String message) {
        super(message);
    }

    public TreeReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
