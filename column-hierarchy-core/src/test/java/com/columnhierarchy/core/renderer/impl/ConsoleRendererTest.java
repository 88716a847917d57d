package com.columnhierarchy.core.renderer.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void render_printsHeaderAndContentPerFile() {
        EmittedOutput output = new EmittedOutput(List.of(
            new EmittedFile("a.txt", "first", "text/plain"),
            new EmittedFile("b.txt", "second\n", "text/plain")));

        renderer.render(output, RenderContext.of("unused"));

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("File 1/2: a.txt", "File 2/2: b.txt", "first\n", "second\n");
        assertThat(printed).doesNotContain("\u001B[");
    }

    @Test
    void render_headersDisabled_printsContentOnly() {
        RenderContext context = RenderContext.of("unused").withShowHeaders(false);

        renderer.render(new EmittedOutput(List.of(new EmittedFile("a.txt", "body", "text/plain"))), context);

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("body" + System.lineSeparator());
    }

    @Test
    void render_colorsEnabled_wrapsHeaderInAnsiCodes() {
        RenderContext context = RenderContext.of("unused").withColors(true);

        renderer.render(new EmittedOutput(List.of(new EmittedFile("a.txt", "body\n", "text/plain"))), context);

        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("\u001B[36mFile 1/1: a.txt\u001B[0m");
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }
}
