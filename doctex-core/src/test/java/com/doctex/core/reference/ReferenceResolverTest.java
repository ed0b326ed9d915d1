package com.doctex.core.reference;

import com.doctex.core.error.CodeRefNotFoundException;
import com.doctex.core.error.ReferenceNotFoundException;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReferenceResolver}.
 */
class ReferenceResolverTest {

    private static Node heading(String title) {
        return Node.builder(NodeKind.HEADING).property("level", 1).title(Node.text(title)).build();
    }

    private static Node link(String type, String path) {
        return Node.builder(NodeKind.LINK).property("type", type).property("path", path).build();
    }

    @Test
    void getReference_sameInstance_returnsSameReference() {
        // Given
        Node paragraph = Node.of(NodeKind.PARAGRAPH, Node.text("x"));
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, paragraph));

        // When
        Reference first = resolver.getReference(paragraph);
        Reference second = resolver.getReference(paragraph);

        // Then
        assertThat(second).isSameAs(first);
    }

    @Test
    void getReference_equalNodes_getDistinctReferences() {
        // Given
        Node a = Node.of(NodeKind.PARAGRAPH, Node.text("same"));
        Node b = Node.of(NodeKind.PARAGRAPH, Node.text("same"));
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, a, b));

        // When / Then
        assertThat(a).isEqualTo(b);
        assertThat(resolver.getReference(a)).isNotEqualTo(resolver.getReference(b));
    }

    @Test
    void getLabel_headingWithCustomId_usesPrefixedId() {
        Node heading = Node.builder(NodeKind.HEADING).property(Node.CUSTOM_ID, "intro").title(Node.text("Intro")).build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, heading));

        assertThat(resolver.getLabel(heading, false)).contains("sec:intro");
    }

    @Test
    void getLabel_customIdAlreadyPrefixed_isNotDoubled() {
        Node heading = Node.builder(NodeKind.HEADING).property(Node.CUSTOM_ID, "sec:intro").build();
        ReferenceResolver resolver = new ReferenceResolver(heading);

        assertThat(resolver.getLabel(heading, false)).contains("sec:intro");
    }

    @Test
    void getLabel_plainNodeWithoutForce_isEmpty() {
        Node table = Node.of(NodeKind.TABLE);
        ReferenceResolver resolver = new ReferenceResolver(table);

        assertThat(resolver.getLabel(table, false)).isEmpty();
        assertThat(resolver.getLabel(table, true)).hasValueSatisfying(label -> assertThat(label).startsWith("tab:ref"));
    }

    @Test
    void getLabel_captionedTable_isGeneratedAndStable() {
        // Given
        Node table = Node.builder(NodeKind.TABLE).caption(Node.text("Results")).build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, table));

        // When
        String first = resolver.getLabel(table, false).orElseThrow();
        String second = resolver.getLabel(table, false).orElseThrow();

        // Then
        assertThat(first).isEqualTo("tab:ref1").isEqualTo(second);
    }

    @Test
    void getLabel_generatedLabelTakenByCustomId_getsSuffix() {
        // Given
        Node generated = heading("Generated");
        Node explicit = Node.builder(NodeKind.HEADING).property(Node.CUSTOM_ID, "ref1").title(Node.text("Explicit")).build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, generated, explicit));

        // When
        String generatedLabel = resolver.getLabel(generated, true).orElseThrow();
        String explicitLabel = resolver.getLabel(explicit, true).orElseThrow();

        // Then
        assertThat(explicitLabel).isEqualTo("sec:ref1");
        assertThat(generatedLabel).isEqualTo("sec:ref1-2");
    }

    @Test
    void getLabel_namesSanitizedToSameLabel_stayDistinct() {
        // Given
        Node first = Node.builder(NodeKind.TABLE).name("a b").build();
        Node second = Node.builder(NodeKind.TABLE).name("a-b").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, first, second));

        // When
        String secondLabel = resolver.getLabel(second, false).orElseThrow();
        String firstLabel = resolver.getLabel(first, false).orElseThrow();

        // Then
        assertThat(firstLabel).isEqualTo("tab:a-b");
        assertThat(secondLabel).isEqualTo("tab:a-b-2");
        assertThat(resolver.getLabel(second, false)).contains(secondLabel);
    }

    @Test
    void labelPrefix_dependsOnKindAndContent() {
        Node equation = Node.builder(NodeKind.LATEX_ENVIRONMENT)
            .property(Node.VALUE, "\\begin{equation}x\\end{equation}").build();
        Node tikz = Node.builder(NodeKind.LATEX_ENVIRONMENT)
            .property(Node.VALUE, "\\begin{tikzpicture}\\end{tikzpicture}").build();
        Node figure = Node.builder(NodeKind.PARAGRAPH)
            .caption(Node.text("A cat"))
            .child(Node.builder(NodeKind.IMAGE).property("path", "cat.png").build())
            .build();

        assertThat(ReferenceResolver.labelPrefix(equation)).isEqualTo("eq:");
        assertThat(ReferenceResolver.labelPrefix(tikz)).isEmpty();
        assertThat(ReferenceResolver.labelPrefix(figure)).isEqualTo("fig:");
        assertThat(ReferenceResolver.labelPrefix(Node.of(NodeKind.PARAGRAPH))).isEmpty();
    }

    @Test
    void isFigure_paragraphWithTextAndImage_isNotFigure() {
        Node paragraph = Node.builder(NodeKind.PARAGRAPH)
            .caption(Node.text("c"))
            .children(Node.text("see "), Node.builder(NodeKind.IMAGE).build())
            .build();

        assertThat(ReferenceResolver.isFigure(paragraph)).isFalse();
    }

    @Test
    void resolveLink_customId_findsNode() {
        Node heading = Node.builder(NodeKind.HEADING).property(Node.CUSTOM_ID, "setup").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, heading));

        assertThat(resolver.resolveLink(link("custom-id", "#setup"))).isSameAs(heading);
    }

    @Test
    void resolveLink_fuzzyHeadingTitle_findsHeading() {
        Node heading = heading("Getting   Started");
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, heading));

        assertThat(resolver.resolveLink(link("fuzzy", "*getting started"))).isSameAs(heading);
        assertThat(resolver.resolveLink(link("fuzzy", "Getting Started"))).isSameAs(heading);
    }

    @Test
    void resolveLink_fuzzyTarget_takesPrecedenceOverHeading() {
        // Given
        Node target = Node.builder(NodeKind.TARGET).property(Node.VALUE, "results").build();
        Node heading = heading("Results");
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT,
            heading, Node.of(NodeKind.PARAGRAPH, target)));

        // When
        Node resolved = resolver.resolveLink(link("fuzzy", "results"));

        // Then
        assertThat(resolved).isSameAs(target);
    }

    @Test
    void resolveLink_fuzzyName_findsNamedElement() {
        Node table = Node.builder(NodeKind.TABLE).name("tbl-data").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, table));

        assertThat(resolver.resolveLink(link("fuzzy", "tbl-data"))).isSameAs(table);
    }

    @Test
    void resolveLink_unknownTarget_throwsException() {
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT));

        assertThatThrownBy(() -> resolver.resolveLink(link("custom-id", "missing")))
            .isInstanceOf(ReferenceNotFoundException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void footnoteDefinition_missingLabel_throwsException() {
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT));

        assertThatThrownBy(() -> resolver.footnoteDefinition("1"))
            .isInstanceOf(ReferenceNotFoundException.class);
    }

    @Test
    void codeBlockFor_markerPresent_returnsBlock() {
        // Given
        Node block = Node.builder(NodeKind.SRC_BLOCK)
            .property(Node.VALUE, "for x in y:  (ref:loop)\n    pass\n").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, block));

        // When / Then
        assertThat(resolver.codeBlockFor("loop")).isSameAs(block);
    }

    @Test
    void codeBlockFor_customLabelFormat_isHonoured() {
        Node block = Node.builder(NodeKind.SRC_BLOCK)
            .property("label-format", "<<%s>>")
            .property(Node.VALUE, "call() <<here>>").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, block));

        assertThat(resolver.codeBlockFor("here")).isSameAs(block);
    }

    @Test
    void codeBlockFor_labelFormatWithPercent_matchesLiterally() {
        // Given
        Node block = Node.builder(NodeKind.SRC_BLOCK)
            .property("label-format", "100% (ref:%s)")
            .property(Node.VALUE, "rate = 1  100% (ref:rate)\n").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, block));

        // When
        String marker = ReferenceResolver.codeRefMarker(block, "rate");

        // Then
        assertThat(marker).isEqualTo("100% (ref:rate)");
        assertThat(resolver.codeBlockFor("rate")).isSameAs(block);
    }

    @Test
    void codeBlockFor_missingMarker_throwsException() {
        Node block = Node.builder(NodeKind.SRC_BLOCK).property(Node.VALUE, "x = 1").build();
        ReferenceResolver resolver = new ReferenceResolver(Node.of(NodeKind.DOCUMENT, block));

        assertThatThrownBy(() -> resolver.codeBlockFor("nope"))
            .isInstanceOf(CodeRefNotFoundException.class)
            .hasMessageContaining("(ref:nope)");
    }
}
