package com.doctex.core.table;

/**
 * Part of an {@code xtable} a row is emitted into.
 */
public enum TableSection {
    HEAD("xtablehead"),
    BODY("xtablebody"),
    FOOT("xtablefoot");

    private final String environment;

    TableSection(String environment) {
        this.environment = environment;
    }

    /**
     * Returns the ConTeXt environment name, without {@code start}/{@code stop}.
     *
     * @return environment name
     */
    public String environment() {
        return environment;
    }
}
