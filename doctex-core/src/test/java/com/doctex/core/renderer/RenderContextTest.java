package com.doctex.core.renderer;

import com.doctex.core.config.RenderConfig;
import com.doctex.core.model.Node;
import com.doctex.core.model.NodeKind;
import com.doctex.core.model.Zone;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderContext}.
 */
class RenderContextTest {

    private final Node root = Node.builder(NodeKind.DOCUMENT).property("language", "de").build();

    @Test
    void constructor_documentLanguage_overridesConfig() {
        RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);

        assertThat(ctx.language()).isEqualTo("de");
        assertThat(new RenderContext(RenderConfig.defaults(), Node.of(NodeKind.DOCUMENT)).language()).isEqualTo("en");
    }

    @Test
    void translateLanguage_knownAndUnknownNames() {
        RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);

        assertThat(ctx.translateLanguage("Emacs-Lisp")).isEqualTo("lisp");
        assertThat(ctx.translateLanguage("Rust")).isEqualTo("rust");
    }

    @Test
    void useEnvironment_firstRegistrationWinsAndConfigOverrides() {
        // Given
        RenderConfig config = RenderConfig.builder().environment("OrgVerse", "\\definelines[OrgVerse][indentnext=yes]").build();
        RenderContext ctx = new RenderContext(config, root);

        // When
        ctx.useEnvironment("OrgVerse", "\\definelines[OrgVerse]");
        ctx.useEnvironment("A", "first");
        ctx.useEnvironment("A", "second");

        // Then
        assertThat(ctx.usedEnvironments())
            .containsEntry("OrgVerse", "\\definelines[OrgVerse][indentnext=yes]")
            .containsEntry("A", "first");
        assertThat(ctx.usedEnvironments().keySet()).containsExactly("OrgVerse", "A");
    }

    @Test
    void markFootnoteEmitted_secondCall_returnsFalse() {
        RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);

        assertThat(ctx.markFootnoteEmitted("1")).isTrue();
        assertThat(ctx.markFootnoteEmitted("1")).isFalse();
        assertThat(ctx.footnoteCount()).isEqualTo(1);
    }

    @Test
    void zoneBuffers_areReadOnlyAndOrdered() {
        // Given
        RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);
        ctx.appendToZone(Zone.APPENDIX, "one");
        ctx.appendToZone(Zone.APPENDIX, "two");

        // When / Then
        assertThat(ctx.zoneBuffers().get(Zone.APPENDIX)).containsExactly("one", "two");
        assertThat(ctx.zoneBuffers().get(Zone.BACKMATTER)).isEmpty();
        assertThatThrownBy(() -> ctx.zoneBuffers().get(Zone.APPENDIX).add("three"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void ancestors_enterAndLeave_trackParentAndNearest() {
        // Given
        RenderContext ctx = new RenderContext(RenderConfig.defaults(), root);
        Node table = Node.of(NodeKind.TABLE);
        Node row = Node.of(NodeKind.TABLE_ROW);

        // When
        ctx.enter(table);
        ctx.enter(row);

        // Then
        assertThat(ctx.parent()).containsSame(row);
        assertThat(ctx.nearest(NodeKind.TABLE)).containsSame(table);
        assertThat(ctx.within(NodeKind.MATH_RUN)).isFalse();
        ctx.leave();
        ctx.leave();
        assertThat(ctx.parent()).isEmpty();
    }
}
