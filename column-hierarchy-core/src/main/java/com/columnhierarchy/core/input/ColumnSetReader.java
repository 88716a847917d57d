package com.columnhierarchy.core.input;

import com.columnhierarchy.core.exception.InvalidInputException;
import com.columnhierarchy.core.model.ColumnSet;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads column sets from a file.
 *
 * <p>Supported formats, chosen by file extension:
 * <ul>
 *   <li>{@code .json}, {@code .yaml}, {@code .yml} - a list of string lists</li>
 *   <li>anything else - plain text, one column set per line, names separated by commas;
 *       blank lines and lines starting with {@code #} are skipped</li>
 * </ul>
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * - [Id, DateCreated, DateDeleted]
 * - [Id, DateCreated, Name]
 * - [Id, Name]
 * }</pre>
 */
public final class ColumnSetReader {

    private static final Logger log = LoggerFactory.getLogger(ColumnSetReader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<List<List<String>>> LIST_OF_LISTS = new TypeReference<>() {};

    private static final String COMMENT_PREFIX = "#";
    private static final String SEPARATOR = ",";

    private ColumnSetReader() {
        // Utility class
    }

    /**
     * Reads the column sets in a file.
     *
     * @param inputPath input file
     * @return column sets in file order
     * @throws InvalidInputException if the file is missing, unreadable or malformed
     */
    public static List<ColumnSet> read(Path inputPath) {
        if (!Files.isRegularFile(inputPath) || !Files.isReadable(inputPath)) {
            throw new InvalidInputException("Input file not found or not readable: " + inputPath);
        }

        String fileName = inputPath.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            List<ColumnSet> columnSets = isStructured(fileName)
                ? fromLists(YAML_MAPPER.readValue(inputPath.toFile(), LIST_OF_LISTS))
                : parseText(Files.readAllLines(inputPath));
            log.info("Read {} column sets from: {}", columnSets.size(), inputPath);
            return columnSets;
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read column sets from " + inputPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts nested lists to column sets.
     *
     * @param lists field-name lists
     * @return column sets
     * @throws InvalidInputException if the outer list, an inner list, or a name is null
     */
    public static List<ColumnSet> fromLists(List<List<String>> lists) {
        if (lists == null) {
            throw new InvalidInputException("Column sets must not be null");
        }
        List<ColumnSet> columnSets = new ArrayList<>(lists.size());
        for (int i = 0; i < lists.size(); i++) {
            List<String> columns = lists.get(i);
            if (columns == null || columns.stream().anyMatch(Objects::isNull)) {
                throw new InvalidInputException("Column set at index " + i + " is null or contains a null name");
            }
            columnSets.add(new ColumnSet(columns));
        }
        return columnSets;
    }

    /**
     * Parses plain-text lines, one column set per line.
     *
     * @param lines text lines
     * @return column sets
     */
    public static List<ColumnSet> parseText(List<String> lines) {
        List<ColumnSet> columnSets = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            List<String> columns = Arrays.stream(trimmed.split(SEPARATOR))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
            columnSets.add(new ColumnSet(columns));
        }
        return columnSets;
    }

    private static boolean isStructured(String fileName) {
        return fileName.endsWith(".json") || fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
