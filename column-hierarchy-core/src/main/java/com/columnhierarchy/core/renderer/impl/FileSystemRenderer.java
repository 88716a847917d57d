package com.columnhierarchy.core.renderer.impl;

import com.columnhierarchy.core.emitter.EmittedFile;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.renderer.OutputRenderer;
import com.columnhierarchy.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes emitted files below the output directory, creating directories as needed.
 *
 * <p>Existing files are overwritten unless {@link RenderContext#overwrite()} is off. A
 * relative path that resolves outside the output directory is rejected before anything
 * is written.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(EmittedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        List<Path> targets = new ArrayList<>(output.files().size());
        for (EmittedFile file : output.files()) {
            targets.add(context.resolve(file.relativePath()));
        }
        log.info("Writing {} files to: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (int i = 0; i < targets.size(); i++) {
            if (writeFile(targets.get(i), output.files().get(i), context.overwrite())) {
                written++;
            }
        }
        log.info("Wrote {} of {} files", written, output.files().size());
    }

    private boolean writeFile(Path target, EmittedFile file, boolean overwrite) {
        if (!overwrite && Files.exists(target)) {
            log.warn("Skipping existing file: {}", target);
            return false;
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
