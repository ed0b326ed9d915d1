package com.doctex.core.error;

/**
 * Thrown when a link, radio target, id or footnote label resolves to nothing.
 */
public class ReferenceNotFoundException extends RenderException {

    private final String reference;

    public ReferenceNotFoundException(String kind, String reference) {
        super("Unable to resolve " + kind + " reference: " + reference);
        this.reference = reference;
    }

    /**
     * Returns the unresolved reference text.
     *
     * @return reference as written in the document
     */
    public String getReference() {
        return reference;
    }
}
