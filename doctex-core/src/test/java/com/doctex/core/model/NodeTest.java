package com.doctex.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Node}.
 */
class NodeTest {

    @Test
    void constructor_nullKind_throwsException() {
        assertThatThrownBy(() -> new Node(null, Map.of(), null, null, null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void constructor_nullCollections_becomeEmpty() {
        Node node = new Node(NodeKind.PARAGRAPH, null, null, null, null, null);

        assertThat(node.properties()).isEmpty();
        assertThat(node.children()).isEmpty();
        assertThat(node.caption()).isEmpty();
        assertThat(node.title()).isEmpty();
        assertThat(node.explicitName()).isEmpty();
    }

    @Test
    void intProperty_acceptsNumbersAndNumericStrings() {
        Node node = Node.builder(NodeKind.HEADING)
            .property("level", 2).property("start", " 7 ").property("bad", "x").build();

        assertThat(node.intProperty("level", 0)).isEqualTo(2);
        assertThat(node.intProperty("start", 0)).isEqualTo(7);
        assertThat(node.intProperty("bad", 3)).isEqualTo(3);
        assertThat(node.intProperty("missing", 4)).isEqualTo(4);
    }

    @Test
    void flag_acceptsBooleansAndOrgSpellings() {
        Node node = Node.builder(NodeKind.HEADING)
            .property("a", true).property("b", "t").property("c", "Yes").property("d", "nil").build();

        assertThat(node.flag("a")).isTrue();
        assertThat(node.flag("b")).isTrue();
        assertThat(node.flag("c")).isTrue();
        assertThat(node.flag("d")).isFalse();
        assertThat(node.flag("missing")).isFalse();
    }

    @Test
    void listProperty_singleValue_becomesSingletonList() {
        Node node = Node.builder(NodeKind.DOCUMENT)
            .property("author", "Ann").property("keywords", List.of("a", "b")).build();

        assertThat(node.listProperty("author")).containsExactly("Ann");
        assertThat(node.listProperty("keywords")).containsExactly("a", "b");
        assertThat(node.listProperty("missing")).isEmpty();
    }

    @Test
    void postBlank_negative_isZero() {
        Node node = Node.builder(NodeKind.PLAIN_TEXT).postBlank(-2).build();

        assertThat(node.postBlank()).isZero();
    }

    @Test
    void rawText_includesInlineTrailingBlanks() {
        // Given
        Node bold = Node.builder(NodeKind.BOLD).postBlank(1).child(Node.text("bold")).build();
        Node paragraph = Node.of(NodeKind.PARAGRAPH, Node.text("A "), bold, Node.text("end"));

        // When
        String text = paragraph.rawText();

        // Then
        assertThat(text).isEqualTo("A bold end");
    }

    @Test
    void rawTitle_trimsTitleText() {
        Node heading = Node.builder(NodeKind.HEADING).title(Node.text("  Intro "), Node.text("duction ")).build();

        assertThat(heading.rawTitle()).isEqualTo("Intro duction");
    }

    @Test
    void customId_blank_isEmpty() {
        Node node = Node.builder(NodeKind.HEADING).property(Node.CUSTOM_ID, " ").build();

        assertThat(node.customId()).isEmpty();
    }

    @Test
    void withProperty_returnsCopyAndKeepsOriginal() {
        Node original = Node.builder(NodeKind.PARAGRAPH).property("a", 1).build();

        Node copy = original.withProperty("b", 2);

        assertThat(copy.properties()).containsEntry("a", 1).containsEntry("b", 2);
        assertThat(original.properties()).doesNotContainKey("b");
    }

    @Test
    void equalContent_distinctNodes_areEqualButNotSame() {
        Node first = Node.text("x");
        Node second = Node.text("x");

        assertThat(first).isEqualTo(second).isNotSameAs(second);
    }
}
