package com.columnhierarchy.cli;

import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Lists the emitters or renderers discovered via SPI.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * column-hierarchy list emitters
 * column-hierarchy list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available emitters or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: emitters or renderers")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "emitters", "emitter" -> listEmitters();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: emitters or renderers", type);
                System.err.println("✗ Unknown type: " + type + " (use: emitters, renderers)");
                yield 1;
            }
        };
    }

    private int listEmitters() {
        System.out.println("Available Emitters:");
        System.out.println();

        boolean found = false;
        for (TypeEmitter emitter : ServiceLoader.load(TypeEmitter.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", emitter.getDisplayName(), emitter.getId());
            System.out.printf("    File Extension: .%s%n", emitter.getFileExtension());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No emitters found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
