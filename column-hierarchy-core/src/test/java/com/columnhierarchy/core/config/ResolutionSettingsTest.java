package com.columnhierarchy.core.config;

import com.columnhierarchy.core.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResolutionSettings}.
 */
class ResolutionSettingsTest {

    @Test
    void defaults_haveDocumentedValues() {
        ResolutionSettings settings = ResolutionSettings.defaults();

        assertThat(settings.minSubsetSize()).isEqualTo(2);
        assertThat(settings.maxFieldsPerColumnSet()).isEqualTo(20);
        assertThat(settings.includeInputColumnSets()).isTrue();
        assertThat(settings.failOnUnresolvedAnchor()).isFalse();
        assertThat(settings.typeNamePrefix()).isEqualTo("ColumnSubset");
        assertThat(settings.firstTypeId()).isEqualTo(1);
        assertThat(settings.capabilityMarker()).isEqualTo("IColumnSubset");
    }

    @Test
    void blankPrefix_fallsBackToDefault() {
        ResolutionSettings settings = new ResolutionSettings(2, 20, true, false, " ", 1, "M");

        assertThat(settings.typeNamePrefix()).isEqualTo(ResolutionSettings.DEFAULT_TYPE_NAME_PREFIX);
    }

    @Test
    void minSubsetSizeBelowOne_throwsInvalidInput() {
        assertThatThrownBy(() -> new ResolutionSettings(0, 20, true, false, "P", 1, null))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void maxFieldsAboveCeiling_throwsInvalidInput() {
        assertThatThrownBy(() -> new ResolutionSettings(2, ResolutionSettings.ENUMERATION_CEILING + 1, true, false, "P", 1, null))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void negativeFirstId_throwsInvalidInput() {
        assertThatThrownBy(() -> ResolutionSettings.defaults().withFirstTypeId(-5))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void withers_changeOnlyTheirValue() {
        ResolutionSettings settings = ResolutionSettings.defaults()
            .withCapabilityMarker("IRow")
            .withFailOnUnresolvedAnchor(true);

        assertThat(settings.capabilityMarker()).isEqualTo("IRow");
        assertThat(settings.failOnUnresolvedAnchor()).isTrue();
        assertThat(settings.typeNamePrefix()).isEqualTo(ResolutionSettings.DEFAULT_TYPE_NAME_PREFIX);
        assertThat(settings.includeInputColumnSets()).isTrue();
    }
}
