package com.doctex.core;

import com.doctex.core.config.RenderConfig;
import com.doctex.core.error.CodeRefNotFoundException;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.RenderWarning;
import com.doctex.core.model.RenderedDocument;
import com.doctex.core.util.NodeTreeLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link DocumentRenderer}.
 */
class DocumentRendererTest {

    private DocumentRenderer renderer;
    private RenderConfig config;

    @BeforeEach
    void setUp() {
        renderer = new DocumentRenderer();
        config = RenderConfig.defaults();
    }

    private static Node heading(String title, String zone) {
        Node.Builder builder = Node.builder(NodeKind.HEADING).property("level", 1).title(Node.text(title))
            .child(Node.of(NodeKind.PARAGRAPH, Node.text(title + " text.")));
        if (zone != null) {
            builder.property("zone", zone);
        }
        return builder.build();
    }

    private static Node fragment(String value, int postBlank) {
        return Node.builder(NodeKind.LATEX_FRAGMENT).property(Node.VALUE, value).postBlank(postBlank).build();
    }

    @Test
    void renderDocument_appendixHeadings_placedAtAppendixInOrder() {
        // Given
        Node root = Node.of(NodeKind.DOCUMENT,
            heading("First App", "appendix"),
            heading("Main", null),
            heading("Second App", "appendix"));

        // When
        String text = renderer.renderDocument(root, config).text();

        // Then
        int appendices = text.indexOf("\\startappendices");
        int first = text.indexOf("title={First App}");
        int second = text.indexOf("title={Second App}");
        assertThat(text).containsOnlyOnce("title={First App}").containsOnlyOnce("title={Second App}");
        assertThat(text.indexOf("title={Main}")).isBetween(text.indexOf("\\startbodymatter"), text.indexOf("\\stopbodymatter"));
        assertThat(appendices).isLessThan(first);
        assertThat(first).isLessThan(second);
        assertThat(second).isLessThan(text.indexOf("\\stopappendices"));
    }

    @Test
    void renderDocument_nestedAppendixHeading_staysInsideParent() {
        // Given
        Node child = Node.builder(NodeKind.HEADING).property("level", 2).property("zone", "appendix")
            .title(Node.text("Child"))
            .child(Node.of(NodeKind.PARAGRAPH, Node.text("Child text.")))
            .build();
        Node parent = Node.builder(NodeKind.HEADING).property("level", 1).property("zone", "appendix")
            .title(Node.text("Parent"))
            .children(Node.of(NodeKind.PARAGRAPH, Node.text("Parent text.")), child)
            .build();
        Node root = Node.of(NodeKind.DOCUMENT, heading("Main", null), parent);

        // When
        String text = renderer.renderDocument(root, config).text();

        // Then
        int parentStart = text.indexOf("\\startsection[title={Parent}");
        int childStart = text.indexOf("\\startsubsection[title={Child}");
        int childStop = text.indexOf("\\stopsubsection");
        assertThat(text).containsOnlyOnce("title={Child}").containsOnlyOnce("title={Parent}");
        assertThat(parentStart).isGreaterThan(text.indexOf("\\startappendices"));
        assertThat(childStart).isGreaterThan(parentStart);
        assertThat(text.indexOf("\\stopsection", childStop)).isLessThan(text.indexOf("\\stopappendices"));
        assertThat(text.indexOf("\\stopsection", parentStart)).isGreaterThan(childStop);
    }

    @Test
    void renderDocument_adjacentMath_mergedByRewritePass() {
        // Given
        Node root = Node.of(NodeKind.DOCUMENT,
            Node.of(NodeKind.PARAGRAPH, fragment("$a$", 0), fragment("$b$", 1), fragment("$c$", 0)));

        // When
        RenderedDocument result = renderer.renderDocument(root, config, null);

        // Then
        assertThat(result.text()).isEqualTo("\\m{ab} \\m{c}\n");
    }

    @Test
    void renderDocument_missingCoderef_abortsWithoutDocument() {
        // Given
        Node block = Node.builder(NodeKind.SRC_BLOCK).property("language", "python")
            .property(Node.VALUE, "total = 0  (ref:init)\n").build();
        Node link = Node.builder(NodeKind.LINK).property("type", "coderef").property("path", "loop").build();
        Node root = Node.of(NodeKind.DOCUMENT, block, Node.of(NodeKind.PARAGRAPH, link));

        // When / Then
        assertThatThrownBy(() -> renderer.renderDocument(root, config))
            .isInstanceOf(CodeRefNotFoundException.class);
    }

    @Test
    void renderDocument_coderefPresent_rendersLabel() {
        Node block = Node.builder(NodeKind.SRC_BLOCK).property("language", "python")
            .property(Node.VALUE, "total = 0  (ref:init)\n").build();
        Node link = Node.builder(NodeKind.LINK).property("type", "coderef").property("path", "init").build();
        Node root = Node.of(NodeKind.DOCUMENT, block, Node.of(NodeKind.PARAGRAPH, Node.text("See "), link));

        assertThat(renderer.renderDocument(root, config, null).text()).contains("See init\n");
    }

    @Test
    void renderDocument_sameTreeTwice_producesIdenticalText() {
        // Given
        Node root = Node.builder(NodeKind.DOCUMENT)
            .property("title", "Report")
            .children(heading("One", null), heading("Two", "appendix"),
                Node.builder(NodeKind.TABLE).caption(Node.text("Data"))
                    .child(Node.builder(NodeKind.TABLE_ROW)
                        .child(Node.builder(NodeKind.TABLE_CELL).child(Node.text("1")).build()).build())
                    .build())
            .build();

        // When
        RenderedDocument first = renderer.renderDocument(root, config);
        RenderedDocument second = renderer.renderDocument(root, config);

        // Then
        assertThat(second.text()).isEqualTo(first.text());
    }

    @Test
    void renderDocument_metadataAndPreamble_filledIntoTemplate() {
        // Given
        Node root = Node.builder(NodeKind.DOCUMENT)
            .property("title", "Cats & Dogs")
            .property("author", List.of("Ann", "Bob"))
            .property("language", "nl")
            .child(Node.of(NodeKind.QUOTE_BLOCK, Node.of(NodeKind.PARAGRAPH, Node.text("Meow."))))
            .build();

        // When
        String text = renderer.renderDocument(root, config).text();

        // Then
        assertThat(text).contains("{\\tfd Cats \\& Dogs}");
        assertThat(text).contains("author={Ann, Bob}");
        assertThat(text).contains("\\mainlanguage[nl]");
        assertThat(text).contains("\\definestartstop[OrgBlockQuote]");
        assertThat(text.indexOf("\\definestartstop[OrgBlockQuote]")).isLessThan(text.indexOf("\\starttext"));
    }

    @Test
    void renderDocument_documentTemplateProperty_selectsTemplate() {
        Node root = Node.builder(NodeKind.DOCUMENT).property("template", "plain")
            .child(Node.of(NodeKind.PARAGRAPH, Node.text("Hi"))).build();

        String text = renderer.renderDocument(root, config).text();

        assertThat(text).doesNotContain("\\startstandardmakeup").contains("\\starttext").contains("Hi");
    }

    @Test
    void renderDocument_warnings_collectedInOrder() {
        // Given
        Node root = Node.builder(NodeKind.DOCUMENT)
            .property("snippets", List.of("nope"))
            .child(Node.of(NodeKind.PARAGRAPH, Node.text("It's \"odd")))
            .build();

        // When
        RenderedDocument result = renderer.renderDocument(root, config, "missing");

        // Then
        assertThat(result.warnings()).extracting(RenderWarning::type).containsExactly(
            RenderWarning.Type.QUOTE_MISMATCH, RenderWarning.Type.UNKNOWN_SNIPPET, RenderWarning.Type.MISSING_TEMPLATE);
        assertThat(result.text()).isEqualTo("It's \"odd\n");
    }

    @Test
    void renderDocument_fixtureTree_rendersEveryPart() throws IOException, URISyntaxException {
        // Given
        Node root = NodeTreeLoader.load(Path.of(getClass().getResource("/fixtures/report.json").toURI()));

        // When
        RenderedDocument result = renderer.renderDocument(root, config);

        // Then
        String text = result.text();
        assertThat(text).contains("{\\tfd Quarterly Report}");
        assertThat(text).contains("See \\in[sec:results] for the \\quotation{numbers}.");
        assertThat(text).contains("reference={sec:results}");
        assertThat(text).contains("\\startplacetable[title={Totals}");
        assertThat(text).contains("10\\%");
        assertThat(text.indexOf("title={Raw Data}")).isGreaterThan(text.indexOf("\\startappendices"));
        assertThat(result.warnings()).extracting(RenderWarning::type)
            .containsExactly(RenderWarning.Type.UNKNOWN_SNIPPET);
    }
}
