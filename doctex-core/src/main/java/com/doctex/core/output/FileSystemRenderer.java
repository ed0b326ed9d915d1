package com.doctex.core.output;

import com.doctex.core.model.RenderedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes the document to {@code <outputDirectory>/<documentName>.tex}.
 *
 * <p>Creates the output directory when missing and overwrites an existing file.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code filesystem.extension} - file extension, default {@code tex}</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    static final String EXTENSION_SETTING = "filesystem.extension";
    static final String DEFAULT_EXTENSION = "tex";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(RenderedDocument document, OutputTarget target) {
        Path outputDir = Paths.get(target.outputDirectory());
        String extension = target.getSettingOrDefault(EXTENSION_SETTING, DEFAULT_EXTENSION);
        Path file = outputDir.resolve(target.documentName() + "." + extension);

        try {
            Files.createDirectories(outputDir);
            logger.debug("Output directory created/verified: {}", outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        try {
            Files.writeString(file, document.text());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file, e);
        }
        logger.info("Wrote {} characters to {}", document.text().length(), file);
    }
}
