package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.SequenceScore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for positional step-sequence scoring.
 */
class SequenceAlignerTest {

    /**
     * A truncated prediction loses only the missing tail.
     */
    @Test
    void truncatedPredictionCountsMissingTailAsFalseNegative() {
        ConfusionCounts counts = SequenceAligner.score(List.of("Add", "Stir"), List.of("Add", "Stir", "Filter"));

        assertThat(counts).isEqualTo(new ConfusionCounts(2, 0, 1));
    }

    /**
     * An inserted step shifts every later position into a mismatch.
     */
    @Test
    void insertedStepIsNotRealigned() {
        ConfusionCounts counts = SequenceAligner.score(List.of("Add", "HeatChill", "Stir"), List.of("Add", "Stir"));

        assertThat(counts).isEqualTo(new ConfusionCounts(1, 2, 1));
    }

    /**
     * Anchors present on one side only are scored against an empty sequence.
     */
    @Test
    void alignScoresUnionOfAnchorsInOrder() {
        SequenceScore score = SequenceAligner.align(
                Map.of("B", List.of("Add", "Filter"), "C", List.of("Dry")),
                Map.of("B", List.of("Add", "Filter"), "A", List.of("Add", "Stir")));

        assertThat(score.perAnchor().keySet()).containsExactly("A", "B", "C");
        assertThat(score.perAnchor().get("A")).isEqualTo(ConfusionCounts.falseNegatives(2));
        assertThat(score.perAnchor().get("C")).isEqualTo(ConfusionCounts.falsePositives(1));
        assertThat(score.total().counts()).isEqualTo(new ConfusionCounts(2, 1, 2));
    }

    @Test
    void emptyInputsGiveEmptyScore() {
        SequenceScore score = SequenceAligner.align(Map.of(), Map.of());

        assertThat(score.isEmpty()).isTrue();
        assertThat(score.total().f1()).isZero();
    }
}
