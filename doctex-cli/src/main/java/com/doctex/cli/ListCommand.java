package com.doctex.cli;

import com.doctex.core.config.ConfigLoader;
import com.doctex.core.config.RenderConfig;
import com.doctex.core.model.NodeKind;
import com.doctex.core.output.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list templates, snippets, environments, node kinds or output renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * doctex list templates -c doctex.yaml
 * doctex list snippets
 * doctex list environments
 * doctex list kinds
 * doctex list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List templates, snippets, environments, node kinds or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: templates, snippets, environments, kinds or renderers"
    )
    private String type;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: doctex.yaml)"
    )
    private Path configPath = Paths.get("doctex.yaml");

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "templates", "template" -> listNames("Available Templates:", config().templates().keySet());
            case "snippets", "snippet" -> listNames("Available Snippets:", config().snippets().keySet());
            case "environments", "environment" ->
                listNames("Configured Environments:", config().environments().keySet());
            case "kinds", "kind" -> listKinds();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: templates, snippets, environments, kinds or renderers", type);
                yield 1;
            }
        };
    }

    private RenderConfig config() {
        return ConfigLoader.load(configPath);
    }

    private static int listNames(String heading, Collection<String> names) {
        System.out.println(heading);
        System.out.println();
        if (names.isEmpty()) {
            System.out.println("  None configured.");
        }
        names.stream().sorted().forEach(name -> System.out.printf("  • %s%n", name));
        return 0;
    }

    private static int listKinds() {
        System.out.println("Node Kinds:");
        System.out.println();
        for (NodeKind kind : NodeKind.values()) {
            System.out.printf("  • %s (%s)%n", kind.externalName(), kind.isInline() ? "inline" : "element");
        }
        return 0;
    }

    private static int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
