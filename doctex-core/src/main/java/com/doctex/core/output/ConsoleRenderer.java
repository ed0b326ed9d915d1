package com.doctex.core.output;

import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;

import java.io.PrintStream;

/**
 * Renderer that prints the document to standard output.
 *
 * <p>Warnings are listed after the document, highlighted in yellow unless colors are
 * disabled.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors (default: true)</li>
 *   <li>{@code console.showWarnings} - list warnings after the document (default: true)</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(RenderedDocument document, OutputTarget target) {
        boolean colors = Boolean.parseBoolean(target.getSettingOrDefault("console.colors", "true"));
        boolean showWarnings = Boolean.parseBoolean(target.getSettingOrDefault("console.showWarnings", "true"));

        PrintStream out = System.out;
        out.print(document.text());
        if (!document.text().endsWith("\n")) {
            out.println();
        }

        if (showWarnings && document.hasWarnings()) {
            out.println();
            for (RenderWarning warning : document.warnings()) {
                String line = "warning [" + warning.type() + "] " + warning.message();
                out.println(colors ? ANSI_YELLOW + line + ANSI_RESET : line);
            }
        }
    }
}
