package com.doctex.core.output;

import com.doctex.core.model.RenderedDocument;

/**
 * Delivers a rendered document to a destination.
 *
 * <p>Implementations are discovered through the Java Service Provider Interface, so the
 * command line can pick one by id:
 * <pre>{@code
 * for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
 *     if (renderer.getId().equals("filesystem")) {
 *         renderer.render(document, new OutputTarget("./build/tex", "report", Map.of()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.doctex.core.output.OutputRenderer}
 *
 * @see OutputTarget
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lower-case identifier of this renderer
     * (e.g. {@code "filesystem"}, {@code "console"}).
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Delivers the document.
     *
     * @param document rendered document and its warnings
     * @param target destination settings
     * @throws IllegalStateException if the document cannot be delivered
     */
    void render(RenderedDocument document, OutputTarget target);
}
