package com.columnhierarchy.cli;

import com.columnhierarchy.core.config.ConfigLoader;
import com.columnhierarchy.core.config.ProjectConfig;
import com.columnhierarchy.core.input.ColumnSetReader;
import com.columnhierarchy.core.model.ColumnSet;
import com.columnhierarchy.core.registry.InMemoryTypeRegistry;
import com.columnhierarchy.core.registry.RegistryLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Validates the configuration file and, optionally, an input file and a registry file.
 *
 * <p>Unlike {@code resolve}, which falls back to defaults, the configuration is parsed
 * strictly here. Every problem is reported; the exit code is 1 when any check fails.
 */
@Command(
    name = "validate",
    description = "Validate configuration, column set input and type registry files",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_CONFIG_FILE)
    private Path configFile;

    @Option(names = {"--input"}, description = "Column set file to validate")
    private Path inputFile;

    @Option(names = {"--registry"}, description = "Type registry file to validate")
    private Path registryFile;

    @Override
    public Integer call() {
        List<String> problems = new ArrayList<>();

        ProjectConfig config = validateConfig(problems);
        if (inputFile != null) {
            validateInput(config, problems);
        }
        if (registryFile != null) {
            validateRegistry(problems);
        }

        if (problems.isEmpty()) {
            System.out.println("✓ Validation passed");
            return 0;
        }
        System.err.println("✗ Validation failed:");
        problems.forEach(p -> System.err.println("  - " + p));
        return 1;
    }

    private ProjectConfig validateConfig(List<String> problems) {
        log.info("Validating configuration: {}", configFile);
        if (!Files.exists(configFile)) {
            System.out.println("• No configuration file at " + configFile + ", defaults apply");
            return ProjectConfig.defaults();
        }
        try {
            ProjectConfig config = ConfigLoader.parse(configFile);
            System.out.println("✓ Configuration: " + configFile);
            return config;
        } catch (Exception e) {
            log.debug("Configuration invalid", e);
            problems.add("Configuration " + configFile + ": " + e.getMessage());
            return ProjectConfig.defaults();
        }
    }

    private void validateInput(ProjectConfig config, List<String> problems) {
        log.info("Validating input: {}", inputFile);
        try {
            List<ColumnSet> columnSets = ColumnSetReader.read(inputFile);
            int maxFields = config.toResolutionSettings().maxFieldsPerColumnSet();
            for (ColumnSet columnSet : columnSets) {
                if (columnSet.fieldSet().size() > maxFields) {
                    problems.add("Input " + inputFile + ": column set " + columnSet + " has more than "
                        + maxFields + " fields");
                }
            }
            System.out.println("✓ Input: " + columnSets.size() + " column sets");
        } catch (Exception e) {
            log.debug("Input invalid", e);
            problems.add("Input " + inputFile + ": " + e.getMessage());
        }
    }

    private void validateRegistry(List<String> problems) {
        log.info("Validating registry: {}", registryFile);
        try {
            InMemoryTypeRegistry registry = RegistryLoader.load(registryFile);
            System.out.println("✓ Registry: " + registry.size() + " types");
        } catch (Exception e) {
            log.debug("Registry invalid", e);
            problems.add("Registry " + registryFile + ": " + e.getMessage());
        }
    }
}
