package com.doctex.core.format;

/**
 * Signals that smart-quote processing found an opening/closing imbalance.
 *
 * <p>Callers recover by falling back to the escaped text and recording a warning.
 */
public class QuoteMismatchException extends Exception {

    private final int position;

    public QuoteMismatchException(String message, int position) {
        super(message + " at offset " + position);
        this.position = position;
    }

    /**
     * Returns the offset in the input text where the imbalance was detected.
     *
     * @return character offset; the text length when quotes were left open
     */
    public int getPosition() {
        return position;
    }
}
