package com.structural.topology.export;

/**
 * Raised when the structural model template cannot be loaded or rendered.
 */
public class ExportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
