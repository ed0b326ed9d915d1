package com.doctex.cli;

import com.doctex.core.DocumentRenderer;
import com.doctex.core.config.ConfigLoader;
import com.doctex.core.config.RenderConfig;
import com.doctex.core.error.RenderException;
import com.doctex.core.model.Node;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;
import com.doctex.core.util.NodeTreeLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to check a document tree without writing anything.
 *
 * <p>Runs a full render and reports its warnings. Exit code 0 when the render succeeds
 * (warnings are printed but do not fail), 1 when the tree cannot be loaded, is not a
 * document, or the render fails; {@code --strict} turns warnings into failures.
 */
@Command(
    name = "validate",
    description = "Render a document tree without writing it and report problems",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Document tree to validate (JSON or YAML)")
    private Path input;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: doctex.yaml)"
    )
    private Path configPath = Paths.get("doctex.yaml");

    @Option(
        names = {"--strict"},
        description = "Fail on warnings"
    )
    private boolean strict;

    @Override
    public Integer call() {
        log.info("Validating document tree: {}", input);
        Node root;
        try {
            root = NodeTreeLoader.load(input);
        } catch (IOException e) {
            log.error("Failed to load document tree: {}", input, e);
            System.err.println("✗ Cannot read " + input + ": " + e.getMessage());
            return 1;
        }
        if (!NodeTreeLoader.isDocument(root)) {
            System.err.println("✗ Root node is " + root.kind().externalName() + ", expected document");
            return 1;
        }

        RenderConfig config = ConfigLoader.load(configPath);
        RenderedDocument document;
        try {
            document = new DocumentRenderer().renderDocument(root, config);
        } catch (RenderException e) {
            log.debug("Validation render failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        for (RenderWarning warning : document.warnings()) {
            System.err.println("⚠ " + warning);
        }
        if (strict && document.hasWarnings()) {
            System.err.println("✗ " + document.warnings().size() + " warning(s)");
            return 1;
        }
        System.out.println("✓ " + input + " is valid (" + document.warnings().size() + " warning(s))");
        return 0;
    }
}
