package com.doctex.core.error;

/**
 * Thrown when a code-line reference marker is not found in the block it points into.
 */
public class CodeRefNotFoundException extends RenderException {

    private final String label;

    public CodeRefNotFoundException(String label, String marker) {
        super("Code reference '" + label + "' not found: no line contains " + marker);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
