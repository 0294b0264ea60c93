package com.example.synthesiseval.domain.model;

import java.util.List;

/**
 * Everything one evaluation run needs. Collections may be empty; a {@code null} collection reads as empty.
 *
 * @param predicted      records produced by the extraction pipeline
 * @param gold           ground-truth records
 * @param registry       field declarations shared by both collections
 * @param predictedSteps optional predicted step sequences
 * @param goldSteps      optional gold step sequences
 * @param debug          whether to collect literal mismatch explanations
 */
public record EvaluationRequest(
        List<ExtractionRecord> predicted,
        List<ExtractionRecord> gold,
        FieldRegistry registry,
        List<SequenceRecord> predictedSteps,
        List<SequenceRecord> goldSteps,
        boolean debug
) {

    public EvaluationRequest {
        predicted = predicted == null ? List.of() : predicted;
        gold = gold == null ? List.of() : gold;
        predictedSteps = predictedSteps == null ? List.of() : predictedSteps;
        goldSteps = goldSteps == null ? List.of() : goldSteps;
    }

    public static EvaluationRequest of(List<ExtractionRecord> predicted, List<ExtractionRecord> gold, FieldRegistry registry) {
        return new EvaluationRequest(predicted, gold, registry, List.of(), List.of(), false);
    }

    public EvaluationRequest withSteps(List<SequenceRecord> predictedSteps, List<SequenceRecord> goldSteps) {
        return new EvaluationRequest(predicted, gold, registry, predictedSteps, goldSteps, debug);
    }

    public EvaluationRequest withDebug(boolean enabled) {
        return new EvaluationRequest(predicted, gold, registry, predictedSteps, goldSteps, enabled);
    }

    public boolean hasSteps() {
        return !predictedSteps.isEmpty() || !goldSteps.isEmpty();
    }
}
