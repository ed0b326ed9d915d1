package com.doctex.core;

import com.doctex.core.assembler.DocumentAssembler;
import com.doctex.core.config.RenderConfig;
import com.doctex.core.format.TextEscaper;
import com.doctex.core.model.Node;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;
import com.doctex.core.renderer.DispatchRenderer;
import com.doctex.core.renderer.RenderContext;
import com.doctex.core.rewrite.RewritePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the rendering engine: document tree in, ConTeXt document out.
 *
 * <p>A render runs in two phases that never interleave:
 * <ol>
 *   <li>the rewrite passes transform the tree (see {@link RewritePipeline})</li>
 *   <li>the dispatch traversal renders it into a fresh {@link RenderContext}, and the
 *       {@link DocumentAssembler} places body and zones into the template</li>
 * </ol>
 *
 * <p>Fatal conditions (unresolvable links, missing code references) propagate as
 * {@link com.doctex.core.error.RenderException} subclasses and no document is returned.
 * Everything else is reported through {@link RenderedDocument#warnings()}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Node root = NodeTreeLoader.load(Path.of("report.json"));
 * RenderedDocument result = new DocumentRenderer().renderDocument(root, RenderConfig.defaults());
 * Files.writeString(Path.of("report.tex"), result.text());
 * }</pre>
 */
public class DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderer.class);

    public static final String TEMPLATE_PROPERTY = "template";
    public static final String SNIPPETS_PROPERTY = "snippets";

    static final List<String> FIELDS = List.of("title", "subtitle", "author", "date", "keywords", "description");

    private final RewritePipeline pipeline;
    private final DispatchRenderer dispatcher;

    public DocumentRenderer() {
        this(RewritePipeline.defaults());
    }

    public DocumentRenderer(RewritePipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.dispatcher = new DispatchRenderer();
    }

    /**
     * Renders a document with the template the document or the configuration names.
     *
     * @param root document root
     * @param config render configuration
     * @return rendered document and warnings
     */
    public RenderedDocument renderDocument(Node root, RenderConfig config) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");
        return renderDocument(root, config, root.stringProperty(TEMPLATE_PROPERTY, config.defaultTemplate()));
    }

    /**
     * Renders a document with an explicit template.
     *
     * @param root document root
     * @param config render configuration
     * @param templateName template name, null for the minimal layout
     * @return rendered document and warnings
     */
    public RenderedDocument renderDocument(Node root, RenderConfig config, String templateName) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Node document = pipeline.apply(root);
        RenderContext ctx = new RenderContext(config, document);
        String body = dispatcher.render(document, ctx).orElse("");

        DocumentAssembler assembler = new DocumentAssembler(config);
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("preamble", assembler.buildPreamble(ctx.usedEnvironments(),
            document.listProperty(SNIPPETS_PROPERTY)));
        fields.put("language", ctx.language());
        for (String field : FIELDS) {
            fields.put(field, TextEscaper.escape(String.join(", ", document.listProperty(field))));
        }
        String text = assembler.assembleDocument(body, ctx.zoneBuffers(), templateName, fields);

        List<RenderWarning> warnings = new ArrayList<>(ctx.warnings());
        warnings.addAll(assembler.warnings());
        log.info("Rendered document: {} characters, {} footnotes, {} environments, {} warnings",
            text.length(), ctx.footnoteCount(), ctx.usedEnvironments().size(), warnings.size());
        return new RenderedDocument(text, warnings);
    }
}
