package com.doctex.core.renderer;

import java.util.Locale;

/**
 * Built-in ConTeXt definitions of the environments the renderers emit.
 *
 * <p>A definition lands in the preamble only when its environment is used. Configured
 * environments with the same name replace these (see {@link RenderContext#useEnvironment}).
 */
final class Environments {

    static final String VIM_MODULE = "vim";
    static final String BLOCK_QUOTE = "OrgBlockQuote";
    static final String VERSE = "OrgVerse";
    static final String EXAMPLE = "OrgExample";
    static final String FIXED_WIDTH = "OrgFixed";
    static final String DESCRIPTION = "OrgDesc";
    static final String LISTING = "listing";
    static final String TABLE = "OrgTable";

    static final String VIM_MODULE_DEFINITION = "\\usemodule[vim]";
    static final String BLOCK_QUOTE_DEFINITION =
        "\\definestartstop[OrgBlockQuote][before={\\startnarrower[left,right]},after={\\stopnarrower}]";
    static final String VERSE_DEFINITION = "\\definelines[OrgVerse]";
    static final String EXAMPLE_DEFINITION = "\\definetyping[OrgExample]";
    static final String FIXED_WIDTH_DEFINITION = "\\definetyping[OrgFixed]";
    static final String DESCRIPTION_DEFINITION =
        "\\definedescription[OrgDesc][headstyle=bold,alternative=serried,width=fit]";
    static final String LISTING_DEFINITION = "\\definefloat[listing][listings]";
    static final String TABLE_DEFINITION = "\\setupxtable[OrgTable][split=yes,header=repeat,footer=repeat]";

    private Environments() {
        // Utility class
    }

    static String specialBlock(String name) {
        return "\\definestartstop[" + name + "]";
    }

    static String highlightedSource(String name, String syntax) {
        return "\\definevimtyping[" + name + "][syntax=" + syntax + "]";
    }

    static String plainSource(String name) {
        return "\\definetyping[" + name + "]";
    }

    static String tableStyle(String name) {
        return "\\setupxtable[" + name + "][]";
    }

    /**
     * Turns free text into a ConTeXt command name: letters only, each word capitalized.
     *
     * @param text source text, e.g. {@code "emacs-lisp"}
     * @return command-safe name, e.g. {@code "EmacsLisp"}; empty when no letters remain
     */
    static String commandName(String text) {
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c) && c < 128) {
                sb.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
                upper = false;
            } else {
                upper = true;
            }
        }
        return sb.toString();
    }

    static String lowerName(String text) {
        return commandName(text).toLowerCase(Locale.ROOT);
    }
}
