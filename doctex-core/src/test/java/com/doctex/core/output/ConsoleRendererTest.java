package com.doctex.core.output;

import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleRenderer();
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withoutWarnings_printsTextOnly() {
        // Given
        RenderedDocument document = new RenderedDocument("\\starttext\nHi\n\\stoptext\n", List.of());

        // When
        renderer.render(document, new OutputTarget(".", "doc", Map.of()));

        // Then
        assertThat(outputStream.toString()).isEqualTo("\\starttext\nHi\n\\stoptext\n");
    }

    @Test
    void render_withWarningsNoColors_listsPlainWarnings() {
        // Given
        RenderedDocument document = new RenderedDocument("Body",
            List.of(new RenderWarning(RenderWarning.Type.UNKNOWN_TOC, "Unknown table of contents: nope")));
        OutputTarget target = new OutputTarget(".", "doc", Map.of("console.colors", "false"));

        // When
        renderer.render(document, target);

        // Then
        String consoleOutput = outputStream.toString();
        assertThat(consoleOutput).startsWith("Body\n\n");
        assertThat(consoleOutput).contains("warning [UNKNOWN_TOC] Unknown table of contents: nope");
        assertThat(consoleOutput).doesNotContain("\u001B[");
    }

    @Test
    void render_withColors_highlightsWarnings() {
        RenderedDocument document = new RenderedDocument("Body\n",
            List.of(new RenderWarning(RenderWarning.Type.MISSING_TEMPLATE, "missing")));

        renderer.render(document, new OutputTarget(".", "doc", Map.of()));

        assertThat(outputStream.toString()).contains("\u001B[33mwarning [MISSING_TEMPLATE] missing\u001B[0m");
    }

    @Test
    void render_warningsHidden_printsTextOnly() {
        RenderedDocument document = new RenderedDocument("Body\n",
            List.of(new RenderWarning(RenderWarning.Type.MISSING_TEMPLATE, "missing")));

        renderer.render(document, new OutputTarget(".", "doc", Map.of("console.showWarnings", "false")));

        assertThat(outputStream.toString()).isEqualTo("Body\n");
    }

    @Test
    void serviceLoader_discoversBothRenderers() {
        List<String> ids = ServiceLoader.load(OutputRenderer.class).stream()
            .map(provider -> provider.get().getId())
            .toList();

        assertThat(ids).containsExactlyInAnyOrder("filesystem", "console");
    }
}
