package com.doctex.core.format;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.doctex.core.format.ArgumentFormatter.arg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArgumentFormatter}.
 */
class ArgumentFormatterTest {

    @Test
    void formatArgs_oneline_dropsEmptyValues() {
        // Given
        List<ArgumentFormatter.Argument> pairs = List.of(arg("a", "1"), arg("b", ""));

        // When
        String result = ArgumentFormatter.formatArgs(pairs, true);

        // Then
        assertThat(result).isEqualTo("a={1}");
    }

    @Test
    void formatArgs_multiline_joinsWithIndentedNewline() {
        // Given
        List<ArgumentFormatter.Argument> pairs = List.of(arg("a", "1"), arg("c", "2"));

        // When
        String result = ArgumentFormatter.formatArgs(pairs, false);

        // Then
        assertThat(result).isEqualTo("a={1},\n   c={2}");
    }

    @Test
    void formatArgs_nullValue_isDropped() {
        assertThat(ArgumentFormatter.formatArgs(List.of(arg("title", null), arg("reference", "sec:x")), true))
            .isEqualTo("reference={sec:x}");
    }

    @Test
    void formatArgs_allEmpty_returnsEmptyString() {
        assertThat(ArgumentFormatter.formatArgs(List.of(arg("a", ""), arg("b", null)), false)).isEmpty();
        assertThat(ArgumentFormatter.formatArgs(List.of(), true)).isEmpty();
    }

    @Test
    void formatArgs_preservesInputOrder() {
        String result = ArgumentFormatter.formatArgs(List.of(arg("z", "1"), arg("a", "2"), arg("m", "3")), true);

        assertThat(result).isEqualTo("z={1},a={2},m={3}");
    }

    @Test
    void bracketed_withValues_wrapsInBrackets() {
        assertThat(ArgumentFormatter.bracketed(List.of(arg("width", "3em")), true)).isEqualTo("[width={3em}]");
    }

    @Test
    void bracketed_withoutValues_returnsEmptyString() {
        assertThat(ArgumentFormatter.bracketed(List.of(arg("width", "")), true)).isEmpty();
    }

    @Test
    void arg_nullKey_throwsException() {
        assertThatThrownBy(() -> arg(null, "x"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("key");
    }
}
