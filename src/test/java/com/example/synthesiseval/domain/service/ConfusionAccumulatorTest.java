package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.ConfusionCounts;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the per-run count accumulator.
 */
class ConfusionAccumulatorTest {

    /**
     * Ensures the global total always equals the sum of the field totals.
     */
    @Test
    void globalEqualsSumOfFields() {
        ConfusionAccumulator accumulator = new ConfusionAccumulator(List.of("names", "formula"));

        accumulator.add("names", new ConfusionCounts(1, 0, 1));
        accumulator.add("formula", ConfusionCounts.match());
        accumulator.add("names", ConfusionCounts.falsePositives(2));

        assertThat(accumulator.fieldCounts("names")).isEqualTo(new ConfusionCounts(1, 2, 1));
        assertThat(accumulator.globalCounts())
                .isEqualTo(accumulator.fieldCounts("names").plus(accumulator.fieldCounts("formula")));
    }

    /**
     * Ensures finishing derives metrics per field in declaration order, including untouched fields.
     */
    @Test
    void finishDerivesMetricsInDeclarationOrder() {
        ConfusionAccumulator accumulator = new ConfusionAccumulator(List.of("z_field", "a_field"));
        accumulator.add("a_field", new ConfusionCounts(4, 0, 1));

        ConfusionAccumulator.Totals totals = accumulator.finish();

        assertThat(totals.fields()).containsOnlyKeys("z_field", "a_field");
        assertThat(totals.fields().keySet()).containsExactly("z_field", "a_field");
        assertThat(totals.fields().get("z_field").f1()).isZero();
        assertThat(totals.overall().recall()).isEqualTo(0.8);
    }

    @Test
    void rejectsUndeclaredField() {
        ConfusionAccumulator accumulator = new ConfusionAccumulator(List.of("names"));

        assertThrows(IllegalArgumentException.class, () -> accumulator.add("formula", ConfusionCounts.match()));
    }

    @Test
    void rejectsContributionsAfterFinish() {
        ConfusionAccumulator accumulator = new ConfusionAccumulator(List.of("names"));
        accumulator.finish();

        assertThrows(IllegalStateException.class, () -> accumulator.add("names", ConfusionCounts.match()));
    }
}
