package com.doctex.cli;

import com.doctex.core.DocumentRenderer;
import com.doctex.core.config.ConfigLoader;
import com.doctex.core.config.RenderConfig;
import com.doctex.core.error.RenderException;
import com.doctex.core.model.Node;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;
import com.doctex.core.output.OutputRenderer;
import com.doctex.core.output.OutputTarget;
import com.doctex.core.util.NodeTreeLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to render a document tree into a ConTeXt file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Write build/tex/report.tex with the configured default template
 * doctex render -i report.json -o build/tex
 *
 * # Use another template and print the result
 * doctex render -i report.json -t plain --stdout
 * }</pre>
 *
 * <p>Exit code 0 on success (warnings included), 1 when the tree cannot be loaded or
 * the render fails.
 */
@Command(
    name = "render",
    description = "Render a document tree into ConTeXt",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final String FILESYSTEM_RENDERER = "filesystem";
    static final String CONSOLE_RENDERER = "console";

    @Option(
        names = {"-i", "--input"},
        required = true,
        description = "Document tree (JSON or YAML)"
    )
    private Path input;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: doctex.yaml)"
    )
    private Path configPath = Paths.get("doctex.yaml");

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: current directory)"
    )
    private Path outputDir = Paths.get(".");

    @Option(
        names = {"-t", "--template"},
        description = "Template name (overrides document and config)"
    )
    private String template;

    @Option(
        names = {"-n", "--name"},
        description = "Output file base name (default: input file name)"
    )
    private String documentName;

    @Option(
        names = {"--stdout"},
        description = "Print the document instead of writing a file"
    )
    private boolean stdout;

    @Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        try {
            log.info("Rendering document tree: {}", input.toAbsolutePath());
            RenderConfig config = ConfigLoader.load(configPath);
            Node root = NodeTreeLoader.load(input);

            DocumentRenderer renderer = new DocumentRenderer();
            RenderedDocument document = template == null
                ? renderer.renderDocument(root, config)
                : renderer.renderDocument(root, config, template);

            String rendererId = stdout ? CONSOLE_RENDERER : FILESYSTEM_RENDERER;
            OutputTarget target = new OutputTarget(outputDir.toString(), resolveDocumentName(),
                Map.of("console.colors", Boolean.toString(!noColor)));
            findRenderer(rendererId).render(document, target);

            if (!stdout) {
                for (RenderWarning warning : document.warnings()) {
                    System.err.println("⚠ " + warning);
                }
                System.out.println("✓ Rendered " + input + " to: "
                    + outputDir.resolve(target.documentName() + ".tex"));
            }
            return 0;
        } catch (IOException e) {
            log.error("Failed to load document tree: {}", input, e);
            System.err.println("✗ Cannot read " + input + ": " + e.getMessage());
            return 1;
        } catch (RenderException e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            log.error("Output failed", e);
            System.err.println("✗ Output failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Finds an output renderer by id via SPI.
     *
     * @param id renderer id
     * @return renderer
     * @throws IllegalStateException if no renderer has that id
     */
    static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No output renderer with id: " + id);
    }

    private String resolveDocumentName() {
        if (documentName != null && !documentName.isBlank()) {
            return documentName;
        }
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
