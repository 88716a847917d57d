package com.columnhierarchy.core.emitter;

import com.columnhierarchy.core.renderer.OutputRenderer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies emitters and renderers are registered for SPI discovery.
 */
class TypeEmitterServiceLoaderTest {

    @Test
    void serviceLoader_discoversAllEmitters() {
        List<String> ids = new ArrayList<>();
        ServiceLoader.load(TypeEmitter.class).forEach(e -> ids.add(e.getId()));

        assertThat(ids).containsExactlyInAnyOrder("java", "json-schema", "mermaid", "report");
    }

    @Test
    void serviceLoader_discoversAllRenderers() {
        List<String> ids = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(r -> ids.add(r.getId()));

        assertThat(ids).containsExactlyInAnyOrder("filesystem", "console");
    }

    @Test
    void emitters_haveDisplayNameAndExtension() {
        ServiceLoader.load(TypeEmitter.class).forEach(emitter -> {
            assertThat(emitter.getDisplayName()).isNotBlank();
            assertThat(emitter.getFileExtension()).isNotBlank().doesNotStartWith(".");
        });
    }
}
