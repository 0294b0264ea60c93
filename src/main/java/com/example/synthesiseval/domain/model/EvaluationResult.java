package com.example.synthesiseval.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one evaluation run.
 * Returned from {@code EvaluationService} to controllers and exporters, which only format it.
 *
 * @param registryName name of the field registry the run was scored against
 * @param fields       per-field metrics in registry declaration order
 * @param overall      metrics over every field contribution
 * @param anchors      anchor classification
 * @param sequence     positional step score, empty when no step data was supplied
 * @param mismatches   literal explanations for matched anchors, populated only in debug runs
 */
public record EvaluationResult(
        String registryName,
        Map<String, Metrics> fields,
        Metrics overall,
        AnchorPartition anchors,
        SequenceScore sequence,
        List<FieldMismatch> mismatches
) {

    public EvaluationResult {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
        sequence = sequence == null ? SequenceScore.empty() : sequence;
    }
}
