package com.columnhierarchy.core.renderer.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_nestedPath_createsPackageDirectories() throws IOException {
        EmittedFile file = new EmittedFile("com/example/ColumnSubset1.java", "public class ColumnSubset1 {}\n",
            "text/x-java-source");

        renderer.render(new EmittedOutput(List.of(file)), RenderContext.of(tempDir.toString()));

        Path written = tempDir.resolve("com/example/ColumnSubset1.java");
        assertThat(written).exists();
        assertThat(Files.readString(written)).isEqualTo("public class ColumnSubset1 {}\n");
    }

    @Test
    void render_missingOutputDirectory_isCreated() {
        Path outputDir = tempDir.resolve("generated/types");

        renderer.render(new EmittedOutput(List.of(new EmittedFile("a.txt", "A", "text/plain"))),
            RenderContext.of(outputDir.toString()));

        assertThat(outputDir.resolve("a.txt")).exists();
    }

    @Test
    void render_existingFile_overwrittenByDefault() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "old");

        renderer.render(new EmittedOutput(List.of(new EmittedFile("a.txt", "new", "text/plain"))),
            RenderContext.of(tempDir.toString()));

        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("new");
    }

    @Test
    void render_overwriteDisabled_keepsExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "old");
        RenderContext context = RenderContext.of(tempDir).withOverwrite(false);

        renderer.render(new EmittedOutput(List.of(new EmittedFile("a.txt", "new", "text/plain"))), context);

        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("old");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsIllegalState() {
        Path outputDir = tempDir.resolve("out");
        EmittedFile escaping = new EmittedFile("../escaped.txt", "x", "text/plain");

        assertThatThrownBy(() -> renderer.render(new EmittedOutput(List.of(escaping)), RenderContext.of(outputDir.toString())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("escaped.txt")).doesNotExist();
    }

    @Test
    void render_oneEscapingPath_writesNothing() {
        Path outputDir = tempDir.resolve("out");
        EmittedOutput output = new EmittedOutput(List.of(
            new EmittedFile("ok.txt", "x", "text/plain"),
            new EmittedFile("../escaped.txt", "x", "text/plain")));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.of(outputDir)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(outputDir.resolve("ok.txt")).doesNotExist();
    }

    @Test
    void render_emptyOutput_createsOnlyDirectory() {
        Path outputDir = tempDir.resolve("empty");

        renderer.render(EmittedOutput.empty(), RenderContext.of(outputDir.toString()));

        assertThat(outputDir).isDirectory().isEmptyDirectory();
    }
}
