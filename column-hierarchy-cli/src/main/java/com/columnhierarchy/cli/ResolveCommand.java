package com.columnhierarchy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.columnhierarchy.core.HierarchyService;
import com.columnhierarchy.core.config.ConfigLoader;
import com.columnhierarchy.core.config.ProjectConfig;
import com.columnhierarchy.core.config.ResolutionSettings;
import com.columnhierarchy.core.emitter.EmittedOutput;
import com.columnhierarchy.core.emitter.EmitterConfig;
import com.columnhierarchy.core.emitter.TypeEmitter;
import com.columnhierarchy.core.emitter.impl.HierarchyReportEmitter;
import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.input.ColumnSetReader;
import com.columnhierarchy.core.model.ColumnSet;
import com.columnhierarchy.core.model.HierarchyResult;
import com.columnhierarchy.core.model.ResolutionMode;
import com.columnhierarchy.core.model.SubsetInfo;
import com.columnhierarchy.core.registry.RegistryLoader;
import com.columnhierarchy.core.registry.TypeRegistry;
import com.columnhierarchy.core.renderer.OutputRenderer;
import com.columnhierarchy.core.renderer.RenderContext;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Resolves column sets into a type hierarchy and emits it.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration; command-line options override it</li>
 *   <li>Read the column sets from the input file</li>
 *   <li>Load the type registry (anchored mode only)</li>
 *   <li>Resolve the hierarchy</li>
 *   <li>Run the selected emitters, discovered via SPI</li>
 *   <li>Render the emitted files to the output directory or the console</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * column-hierarchy resolve columns.txt
 * column-hierarchy resolve columns.yaml -m anchored -r registry.yaml --marker IEntity
 * column-hierarchy resolve columns.txt -e java -e mermaid -o build/types
 * column-hierarchy resolve columns.txt --dry-run
 * }</pre>
 */
@Command(
    name = "resolve",
    description = "Resolve column sets into a record-type hierarchy",
    mixinStandardHelpOptions = true
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Parameters(index = "0", description = "Column set file (.txt, .csv, .json, .yaml)")
    private Path inputPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: column-hierarchy.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE);

    @Option(names = {"-m", "--mode"}, description = "Resolution mode: unanchored or anchored (overrides config)")
    private String mode;

    @Option(names = {"-r", "--registry"}, description = "Type registry file for anchored mode (overrides config)")
    private Path registryPath;

    @Option(names = {"--marker"}, description = "Capability marker; empty disables it (overrides config)")
    private String marker;

    @Option(names = {"-e", "--emitter"}, description = "Emitter id to run; repeatable (overrides config)")
    private List<String> emitterIds;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"--console"}, description = "Print emitted files instead of writing them")
    private boolean console;

    @Option(names = {"--no-overwrite"}, description = "Keep files that already exist in the output directory")
    private boolean noOverwrite;

    @Option(names = {"--dry-run"}, description = "Resolve and report, but emit nothing")
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            log.info("Resolving column sets from: {}", inputPath.toAbsolutePath());

            ProjectConfig config = ConfigLoader.load(configPath);
            ResolutionSettings settings = effectiveSettings(config);
            ResolutionMode resolutionMode = mode != null ? ResolutionMode.parse(mode) : config.effectiveMode();

            List<ColumnSet> columnSets = ColumnSetReader.read(inputPath);
            System.out.println("✓ Read " + columnSets.size() + " column sets");

            TypeRegistry registry = null;
            if (resolutionMode == ResolutionMode.ANCHORED) {
                registry = RegistryLoader.load(effectiveRegistryPath(config));
                System.out.println("✓ Loaded type registry");
            }

            HierarchyResult result = new HierarchyService(settings).resolve(resolutionMode, columnSets, registry);
            System.out.println("✓ Resolved " + result.types().size() + " types ("
                + resolutionMode.name().toLowerCase(Locale.ROOT) + ")");
            printResult(result);

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping emission and rendering");
                return 0;
            }

            EmittedOutput output = emit(result, config);
            System.out.println("✓ Emitted " + output.files().size() + " files");

            String destination = render(output, config);
            System.out.println("✓ Rendered output to: " + destination);
            return 0;

        } catch (Exception e) {
            log.error("Resolve failed", e);
            System.err.println("✗ Resolve failed: " + e.getMessage());
            return 1;
        }
    }

    private ResolutionSettings effectiveSettings(ProjectConfig config) {
        ResolutionSettings settings = config.toResolutionSettings();
        if (marker != null) {
            settings = settings.withCapabilityMarker(marker);
        }
        log.debug("Effective settings: {}", settings);
        return settings;
    }

    private Path effectiveRegistryPath(ProjectConfig config) {
        if (registryPath != null) {
            return registryPath;
        }
        if (config.resolution() != null && config.resolution().registry() != null) {
            return Paths.get(config.resolution().registry());
        }
        throw new InvalidInputException("Anchored mode requires a type registry (--registry or resolution.registry)");
    }

    private void printResult(HierarchyResult result) {
        System.out.println();
        System.out.println("Input column sets:");
        result.columnSets().forEach(set -> System.out.println("  " + set));

        if (!result.subsets().isEmpty()) {
            System.out.println();
            System.out.println("Discovered subsets:");
            for (SubsetInfo subset : result.subsets()) {
                System.out.println("  " + subset.id() + ": " + String.join(",", subset.fullFields()));
            }
        }

        System.out.println();
        System.out.println("Type hierarchy:");
        HierarchyReportEmitter.format(result.types()).lines()
            .forEach(line -> System.out.println("  " + line));
        System.out.println();
    }

    private EmittedOutput emit(HierarchyResult result, ProjectConfig config) {
        Map<String, TypeEmitter> available = new LinkedHashMap<>();
        ServiceLoader.load(TypeEmitter.class).forEach(e -> available.put(e.getId(), e));
        log.debug("Discovered emitters: {}", available.keySet());

        List<String> selected = emitterIds != null && !emitterIds.isEmpty() ? emitterIds : config.effectiveEmitters();
        List<String> unknown = new ArrayList<>();
        EmitterConfig emitterConfig = EmitterConfig.forPackage(
            config.emitters() != null ? config.emitters().packageName() : null);

        EmittedOutput output = EmittedOutput.empty();
        for (String id : selected) {
            TypeEmitter emitter = available.get(id);
            if (emitter == null) {
                unknown.add(id);
                continue;
            }
            log.debug("Running emitter: {}", id);
            output = output.plus(emitter.emit(result.types(), emitterConfig));
        }

        if (!unknown.isEmpty()) {
            log.warn("Unknown emitter ids ignored: {}. Available: {}", unknown, available.keySet());
        }
        return output;
    }

    private String render(EmittedOutput output, ProjectConfig config) {
        String directory = outputDir != null ? outputDir.toString() : config.effectiveOutputDirectory();
        String rendererId = console ? "console" : "filesystem";

        OutputRenderer renderer = null;
        for (OutputRenderer candidate : ServiceLoader.load(OutputRenderer.class)) {
            if (candidate.getId().equals(rendererId)) {
                renderer = candidate;
                break;
            }
        }
        if (renderer == null) {
            throw new IllegalStateException("No renderer registered with id: " + rendererId);
        }

        RenderContext context = RenderContext.of(directory).withOverwrite(!noOverwrite);
        renderer.render(output, context);
        return console ? "console" : context.outputDirectory().toString();
    }
}
