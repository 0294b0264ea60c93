package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the exact-text and formula comparators.
 */
class ScalarComparatorsTest {

    private final ExactTextComparator text = new ExactTextComparator();
    private final FormulaComparator formula = new FormulaComparator();
    private final ComparatorParams params = ComparatorParams.DEFAULTS;

    /**
     * Values equal after normalization score a single true positive.
     */
    @Test
    void equalAfterNormalizationIsAMatch() {
        assertThat(text.compare("  KBr   Disc", "kbr disc", params)).isEqualTo(ConfusionCounts.match());
        assertThat(formula.compare("C6 H6", "C6H6", params)).isEqualTo(ConfusionCounts.match());
    }

    /**
     * A differing pair costs one false positive and one false negative.
     */
    @Test
    void differingValuesCostBothWays() {
        assertThat(text.compare("nujol", "KBr", params)).isEqualTo(new ConfusionCounts(0, 1, 1));
        assertThat(formula.compare("Co", "CO", params)).isEqualTo(new ConfusionCounts(0, 1, 1));
    }

    /**
     * Two not-applicable values agree; one missing side counts against the side that has a value.
     */
    @Test
    void notApplicableHandling() {
        assertThat(text.compare("N/A", "not stated", params)).isEqualTo(ConfusionCounts.match());
        assertThat(formula.compare(null, "—", params)).isEqualTo(ConfusionCounts.match());
        assertThat(text.compare("", "KBr", params)).isEqualTo(ConfusionCounts.falseNegatives(1));
        assertThat(text.compare("KBr", "", params)).isEqualTo(ConfusionCounts.falsePositives(1));
    }

    @Test
    void unmatchedAnchorPenalties() {
        assertThat(text.unmatchedGold("KBr", params)).isEqualTo(ConfusionCounts.falseNegatives(1));
        assertThat(text.unmatchedGold("n/a", params)).isEqualTo(ConfusionCounts.match());
        assertThat(formula.unmatchedPrediction("C6H6", params)).isEqualTo(ConfusionCounts.falsePositives(1));
        assertThat(formula.unmatchedPrediction("", params)).isEqualTo(ConfusionCounts.match());
    }
}
