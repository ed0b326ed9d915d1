package com.doctex.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest extends CommandTestSupport {

    private int execute(String... args) {
        return new CommandLine(new RenderCommand()).execute(args);
    }

    @Test
    void call_validTree_writesTexFile() throws IOException {
        // Given
        Path input = writeTree("report.json", SIMPLE_TREE);
        Path output = tempDir.resolve("out");

        // When
        int exitCode = execute("-i", input.toString(), "-c", missingConfig().toString(), "-o", output.toString());

        // Then
        assertThat(exitCode).isZero();
        Path texFile = output.resolve("report.tex");
        assertThat(texFile).exists();
        assertThat(Files.readString(texFile))
            .contains("\\starttext")
            .contains("Hello \\& welcome")
            .contains("{\\tfd Report}");
        assertThat(stdout()).contains("✓ Rendered");
    }

    @Test
    void call_stdoutWithTemplate_printsDocument() throws IOException {
        Path input = writeTree("report.json", SIMPLE_TREE);

        int exitCode = execute("-i", input.toString(), "-c", missingConfig().toString(), "--stdout", "--no-color",
            "-t", "plain");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Hello \\& welcome").doesNotContain("\\startstandardmakeup");
    }

    @Test
    void call_customName_usesName() throws IOException {
        Path input = writeTree("report.json", SIMPLE_TREE);

        int exitCode = execute("-i", input.toString(), "-c", missingConfig().toString(),
            "-o", tempDir.toString(), "-n", "final");

        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("final.tex")).exists();
    }

    @Test
    void call_missingTemplate_reportsWarning() throws IOException {
        Path input = writeTree("report.json", SIMPLE_TREE);

        int exitCode = execute("-i", input.toString(), "-c", missingConfig().toString(),
            "-o", tempDir.toString(), "-t", "letter");

        assertThat(exitCode).isZero();
        assertThat(stderr()).contains("⚠ MISSING_TEMPLATE");
        assertThat(tempDir.resolve("report.tex")).content().isEqualTo("Hello \\& welcome\n");
    }

    @Test
    void call_unresolvableLink_failsWithoutOutput() throws IOException {
        // Given
        Path input = writeTree("broken.json", """
            {
              "kind": "document",
              "children": [
                { "kind": "paragraph",
                  "children": [ { "kind": "link", "properties": { "type": "custom-id", "path": "nowhere" } } ] }
              ]
            }
            """);

        // When
        int exitCode = execute("-i", input.toString(), "-c", missingConfig().toString(), "-o", tempDir.toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Render failed");
        assertThat(tempDir.resolve("broken.tex")).doesNotExist();
    }

    @Test
    void call_missingInput_returnsError() {
        int exitCode = execute("-i", tempDir.resolve("missing.json").toString(), "-c", missingConfig().toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Cannot read");
    }

    @Test
    void findRenderer_unknownId_throwsException() {
        assertThat(RenderCommand.findRenderer("filesystem").getId()).isEqualTo("filesystem");
        assertThatThrownBy(() -> RenderCommand.findRenderer("pdf"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("pdf");
    }
}
