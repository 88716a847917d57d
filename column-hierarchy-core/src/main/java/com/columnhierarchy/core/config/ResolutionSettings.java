package com.columnhierarchy.core.config;

import com.columnhierarchy.core.exception.InvalidInputException;

/**
 * Tunables for one resolution run.
 *
 * @param minSubsetSize smallest subset size considered by subset discovery
 * @param maxFieldsPerColumnSet widest column set accepted for subset enumeration
 * @param includeInputColumnSets whether each input column set also becomes a type (unanchored)
 * @param failOnUnresolvedAnchor whether an unmatched column set without a marker fails the run (anchored)
 * @param typeNamePrefix prefix of synthesized type names
 * @param firstTypeId id of the first synthesized type
 * @param capabilityMarker marker implemented by root types and required of registry types, or null
 */
public record ResolutionSettings(
    int minSubsetSize,
    int maxFieldsPerColumnSet,
    boolean includeInputColumnSets,
    boolean failOnUnresolvedAnchor,
    String typeNamePrefix,
    int firstTypeId,
    String capabilityMarker
) {
    public static final int DEFAULT_MIN_SUBSET_SIZE = 2;
    public static final int DEFAULT_MAX_FIELDS_PER_COLUMN_SET = 20;
    public static final String DEFAULT_TYPE_NAME_PREFIX = "ColumnSubset";
    public static final int DEFAULT_FIRST_TYPE_ID = 1;
    public static final String DEFAULT_CAPABILITY_MARKER = "IColumnSubset";

    /** Subset enumeration uses an int bit mask per column set. */
    public static final int ENUMERATION_CEILING = 30;

    /**
     * Compact constructor with validation.
     */
    public ResolutionSettings {
        if (minSubsetSize < 1) {
            throw new InvalidInputException("minSubsetSize must be at least 1: " + minSubsetSize);
        }
        if (maxFieldsPerColumnSet < 1 || maxFieldsPerColumnSet > ENUMERATION_CEILING) {
            throw new InvalidInputException("maxFieldsPerColumnSet must be between 1 and "
                + ENUMERATION_CEILING + ": " + maxFieldsPerColumnSet);
        }
        if (typeNamePrefix == null || typeNamePrefix.isBlank()) {
            typeNamePrefix = DEFAULT_TYPE_NAME_PREFIX;
        }
        if (firstTypeId < 0) {
            throw new InvalidInputException("firstTypeId must not be negative: " + firstTypeId);
        }
        if (capabilityMarker != null && capabilityMarker.isBlank()) {
            capabilityMarker = null;
        }
    }

    /**
     * Creates the default settings: subsets of two or more fields, input column sets
     * included as types, {@code ColumnSubset<n>} names starting at 1, marker {@code IColumnSubset}.
     *
     * @return default settings
     */
    public static ResolutionSettings defaults() {
        return new ResolutionSettings(
            DEFAULT_MIN_SUBSET_SIZE,
            DEFAULT_MAX_FIELDS_PER_COLUMN_SET,
            true,
            false,
            DEFAULT_TYPE_NAME_PREFIX,
            DEFAULT_FIRST_TYPE_ID,
            DEFAULT_CAPABILITY_MARKER
        );
    }

    public ResolutionSettings withCapabilityMarker(String marker) {
        return new ResolutionSettings(minSubsetSize, maxFieldsPerColumnSet, includeInputColumnSets,
            failOnUnresolvedAnchor, typeNamePrefix, firstTypeId, marker);
    }

    public ResolutionSettings withIncludeInputColumnSets(boolean include) {
        return new ResolutionSettings(minSubsetSize, maxFieldsPerColumnSet, include,
            failOnUnresolvedAnchor, typeNamePrefix, firstTypeId, capabilityMarker);
    }

    public ResolutionSettings withFailOnUnresolvedAnchor(boolean fail) {
        return new ResolutionSettings(minSubsetSize, maxFieldsPerColumnSet, includeInputColumnSets,
            fail, typeNamePrefix, firstTypeId, capabilityMarker);
    }

    public ResolutionSettings withFirstTypeId(int firstId) {
        return new ResolutionSettings(minSubsetSize, maxFieldsPerColumnSet, includeInputColumnSets,
            failOnUnresolvedAnchor, typeNamePrefix, firstId, capabilityMarker);
    }
}
