package com.doctex.core.error;

/**
 * Base class of fatal render errors.
 *
 * <p>A render exception aborts the whole render: the top-level call returns no artifact.
 * Recoverable conditions (quote mismatches, missing templates, unknown directives) are
 * reported as warnings instead and never use this hierarchy.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
