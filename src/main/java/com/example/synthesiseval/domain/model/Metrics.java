package com.example.synthesiseval.domain.model;

/**
 * Finalized score for one field (or the whole run): the raw counts plus the rates derived from them.
 * Handed to reporters so they never recompute the division rules themselves.
 */
public record Metrics(
        ConfusionCounts counts,
        double precision,
        double recall,
        double f1
) {

    /**
     * Freezes the derived rates of the given counts.
     *
     * @param counts accumulated counts
     * @return metrics snapshot
     */
    public static Metrics of(ConfusionCounts counts) {
        return new Metrics(counts, counts.precision(), counts.recall(), counts.f1());
    }
}
