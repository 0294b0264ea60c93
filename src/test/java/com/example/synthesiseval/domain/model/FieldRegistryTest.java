package com.example.synthesiseval.domain.model;

import com.example.synthesiseval.domain.exception.InvalidFieldRegistryException;
import com.example.synthesiseval.domain.exception.UnknownComparatorKindException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for registry validation and declaration resolution.
 */
class FieldRegistryTest {

    @Test
    void keepsDeclarationOrder() {
        FieldRegistry registry = new FieldRegistry("cbu", List.of(
                FieldSpec.of("formula", ComparatorKind.FORMULA),
                FieldSpec.of("names", ComparatorKind.SET_OF_STRINGS)));

        assertThat(registry.fieldNames()).containsExactly("formula", "names");
    }

    /**
     * Ensures a registry cannot declare the same field twice or declare nothing.
     */
    @Test
    void rejectsDuplicateAndEmptyDeclarations() {
        assertThrows(InvalidFieldRegistryException.class, () -> new FieldRegistry("dup", List.of(
                FieldSpec.of("names", ComparatorKind.SET_OF_STRINGS),
                FieldSpec.of(" names ", ComparatorKind.EXACT_TEXT))));
        assertThrows(InvalidFieldRegistryException.class, () -> new FieldRegistry("empty", List.of()));
        assertThrows(InvalidFieldRegistryException.class, () -> new FieldRegistry(" ", List.of(
                FieldSpec.of("names", ComparatorKind.SET_OF_STRINGS))));
    }

    /**
     * Ensures omitted parameters fall back to defaults and given ones override them.
     */
    @Test
    void declarationResolvesKindAndParameters() {
        FieldSpec spec = new FieldDeclaration("ir_bands", "NumericSetWithTolerance", 5, null, null).toSpec();

        assertThat(spec.kind()).isEqualTo(ComparatorKind.NUMERIC_SET_WITH_TOLERANCE);
        assertThat(spec.params().tolerance()).isEqualTo(5);
        assertThat(spec.params().decimalPrecision()).isEqualTo(ComparatorParams.DEFAULT_DECIMAL_PRECISION);
        assertThat(spec.params().delimiterPattern()).isEqualTo(ComparatorParams.DEFAULT_DELIMITER);
    }

    @Test
    void declarationRejectsBadKindAndParameters() {
        assertThrows(UnknownComparatorKindException.class,
                () -> new FieldDeclaration("x", "Levenshtein", null, null, null).toSpec());
        assertThrows(InvalidFieldRegistryException.class,
                () -> new FieldDeclaration("x", "NumericSetWithTolerance", -1, null, null).toSpec());
        assertThrows(InvalidFieldRegistryException.class,
                () -> new FieldDeclaration("x", "SetOfStrings", null, null, "[").toSpec());
        assertThrows(InvalidFieldRegistryException.class, () -> new FieldDeclaration(
                "x", "KeyedNumericSeries", null, ComparatorParams.MAX_DECIMAL_PRECISION + 1, null).toSpec());
    }
}
