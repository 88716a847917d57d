package com.columnhierarchy.core.config;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.ResolutionMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration, loaded from {@code column-hierarchy.yaml}.
 *
 * <p>Every section and every value is optional; anything missing falls back to
 * {@link ResolutionSettings#defaults()} and the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * resolution:
 *   mode: anchored
 *   registry: ./entity-types.yaml
 *   minSubsetSize: 2
 *   includeInputColumnSets: true
 *
 * naming:
 *   typeNamePrefix: ColumnSubset
 *   firstTypeId: 10
 *   capabilityMarker: IColumnSubset
 *
 * emitters:
 *   enabled:
 *     - java
 *     - report
 *   packageName: com.example.generated
 *
 * output:
 *   directory: ./generated
 * }</pre>
 *
 * @param resolution resolution settings
 * @param naming type naming settings
 * @param emitters emitter selection
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("resolution") ResolutionConfig resolution,
    @JsonProperty("naming") NamingConfig naming,
    @JsonProperty("emitters") EmitterSelection emitters,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./generated";
    public static final List<String> DEFAULT_EMITTERS = List.of("java", "report");

    /**
     * Creates the default configuration: unanchored mode, Java sources plus a text report
     * written to {@code ./generated}.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        ResolutionSettings settings = ResolutionSettings.defaults();
        return new ProjectConfig(
            new ResolutionConfig("unanchored", null, settings.minSubsetSize(), settings.maxFieldsPerColumnSet(),
                settings.includeInputColumnSets(), settings.failOnUnresolvedAnchor()),
            new NamingConfig(settings.typeNamePrefix(), settings.firstTypeId(), settings.capabilityMarker()),
            new EmitterSelection(DEFAULT_EMITTERS, null),
            new OutputConfig(DEFAULT_OUTPUT_DIRECTORY)
        );
    }

    /**
     * Builds resolution settings, taking defaults for anything not configured.
     *
     * @return effective resolution settings
     * @throws InvalidInputException if a configured value is out of range
     */
    public ResolutionSettings toResolutionSettings() {
        ResolutionSettings defaults = ResolutionSettings.defaults();
        ResolutionConfig r = resolution != null ? resolution : new ResolutionConfig(null, null, null, null, null, null);
        NamingConfig n = naming != null ? naming : new NamingConfig(null, null, null);

        return new ResolutionSettings(
            r.minSubsetSize() != null ? r.minSubsetSize() : defaults.minSubsetSize(),
            r.maxFieldsPerColumnSet() != null ? r.maxFieldsPerColumnSet() : defaults.maxFieldsPerColumnSet(),
            r.includeInputColumnSets() != null ? r.includeInputColumnSets() : defaults.includeInputColumnSets(),
            r.failOnUnresolvedAnchor() != null ? r.failOnUnresolvedAnchor() : defaults.failOnUnresolvedAnchor(),
            n.typeNamePrefix() != null ? n.typeNamePrefix() : defaults.typeNamePrefix(),
            n.firstTypeId() != null ? n.firstTypeId() : defaults.firstTypeId(),
            n.capabilityMarker() != null ? n.capabilityMarker() : defaults.capabilityMarker()
        );
    }

    /**
     * Returns the configured mode, unanchored when absent.
     *
     * @return effective resolution mode
     */
    public ResolutionMode effectiveMode() {
        return resolution != null ? resolution.effectiveMode() : ResolutionMode.UNANCHORED;
    }

    /**
     * Returns the configured emitter ids, or the defaults.
     *
     * @return emitter ids
     */
    public List<String> effectiveEmitters() {
        if (emitters == null || emitters.enabled() == null || emitters.enabled().isEmpty()) {
            return DEFAULT_EMITTERS;
        }
        return emitters.enabled();
    }

    /**
     * Returns the configured output directory, or the default.
     *
     * @return output directory
     */
    public String effectiveOutputDirectory() {
        return output != null && output.directory() != null ? output.directory() : DEFAULT_OUTPUT_DIRECTORY;
    }

    /**
     * Resolution section.
     *
     * @param mode "unanchored" or "anchored", case-insensitive
     * @param registry registry file for anchored mode
     * @param minSubsetSize smallest recurring subset size
     * @param maxFieldsPerColumnSet widest column set accepted
     * @param includeInputColumnSets whether input column sets become types
     * @param failOnUnresolvedAnchor whether unanchorable column sets fail the run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResolutionConfig(
        @JsonProperty("mode") String mode,
        @JsonProperty("registry") String registry,
        @JsonProperty("minSubsetSize") Integer minSubsetSize,
        @JsonProperty("maxFieldsPerColumnSet") Integer maxFieldsPerColumnSet,
        @JsonProperty("includeInputColumnSets") Boolean includeInputColumnSets,
        @JsonProperty("failOnUnresolvedAnchor") Boolean failOnUnresolvedAnchor
    ) {
        /**
         * Parses the mode.
         *
         * @return resolution mode, unanchored when absent
         * @throws InvalidInputException if the mode is not recognized
         */
        public ResolutionMode effectiveMode() {
            return ResolutionMode.parse(mode);
        }
    }

    /**
     * Naming section.
     *
     * @param typeNamePrefix prefix of synthesized type names
     * @param firstTypeId first id
     * @param capabilityMarker marker implemented by root types; empty string disables it
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamingConfig(
        @JsonProperty("typeNamePrefix") String typeNamePrefix,
        @JsonProperty("firstTypeId") Integer firstTypeId,
        @JsonProperty("capabilityMarker") String capabilityMarker
    ) {}

    /**
     * Emitter section.
     *
     * @param enabled emitter ids to run
     * @param packageName package for generated sources
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmitterSelection(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("packageName") String packageName
    ) {}

    /**
     * Output section.
     *
     * @param directory output directory path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {}
}
