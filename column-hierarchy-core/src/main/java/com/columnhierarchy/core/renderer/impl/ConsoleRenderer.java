package com.columnhierarchy.core.renderer.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.renderer.OutputRenderer;
import com.columnhierarchy.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints emitted files to standard output, each preceded by a header line.
 *
 * <p>Headers follow {@link RenderContext#showHeaders()} and are highlighted when
 * {@link RenderContext#colors()} is on.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String SEPARATOR = "=".repeat(72);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(EmittedOutput output, RenderContext context) {
        boolean colors = context.colors();
        boolean headers = context.showHeaders();
        log.debug("Printing {} files to console", output.files().size());

        int index = 0;
        for (EmittedFile file : output.files()) {
            index++;
            if (headers) {
                String header = "File " + index + "/" + output.files().size() + ": " + file.relativePath();
                out.println(SEPARATOR);
                out.println(colors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
                out.println(SEPARATOR);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
