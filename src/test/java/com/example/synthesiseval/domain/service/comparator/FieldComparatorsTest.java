package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorKind;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.FieldSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for comparator dispatch by kind.
 */
class FieldComparatorsTest {

    /**
     * Every kind dispatches to a comparator, and identical non-empty values never cost anything.
     *
     * @param kind comparator kind under test
     */
    @ParameterizedTest
    @EnumSource(ComparatorKind.class)
    void identicalValuesNeverProduceErrors(ComparatorKind kind) {
        FieldSpec spec = FieldSpec.of("field", kind);
        String value = "C 45.23; 1600; Benzene";

        assertThat(FieldComparators.forKind(kind)).isNotNull();
        ConfusionCounts counts = FieldComparators.compare(spec, value, value);
        assertThat(counts.hasErrors()).isFalse();
        assertThat(counts.truePositives()).isPositive();
    }

    /**
     * Two not-applicable values score one true positive whatever the kind.
     *
     * @param kind comparator kind under test
     */
    @ParameterizedTest
    @EnumSource(ComparatorKind.class)
    void bothNotApplicableIsAMatch(ComparatorKind kind) {
        assertThat(FieldComparators.compare(FieldSpec.of("field", kind), "N/A", "not stated"))
                .isEqualTo(ConfusionCounts.match());
    }

    @Test
    void dispatchesToTheDeclaredKind() {
        assertThat(FieldComparators.forKind(ComparatorKind.NUMERIC_SET_WITH_TOLERANCE))
                .isInstanceOf(NumericSetComparator.class);
        assertThat(FieldComparators.unmatchedGold(FieldSpec.of("formula", ComparatorKind.FORMULA), "C6H6"))
                .isEqualTo(ConfusionCounts.falseNegatives(1));
        assertThat(FieldComparators.unmatchedPrediction(FieldSpec.of("names", ComparatorKind.SET_OF_STRINGS), "a; b"))
                .isEqualTo(ConfusionCounts.falsePositives(2));
    }
}
