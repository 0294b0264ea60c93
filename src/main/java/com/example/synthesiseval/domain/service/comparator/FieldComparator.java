package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;

/**
 * Pure comparison strategy for one field kind.
 * Implementations never throw for malformed values; unparsable input simply yields fewer elements.
 */
public interface FieldComparator {

    /**
     * Scores a predicted value against its gold counterpart on a matched anchor.
     *
     * @param predicted raw predicted value, {@code null} treated as empty
     * @param gold      raw gold value, {@code null} treated as empty
     * @param params    comparator parameters declared for the field
     * @return counts contributed by this field
     */
    ConfusionCounts compare(String predicted, String gold, ComparatorParams params);

    /**
     * Penalty for a field whose anchor exists only in gold.
     *
     * @param gold   raw gold value
     * @param params comparator parameters declared for the field
     * @return counts contributed by this field
     */
    ConfusionCounts unmatchedGold(String gold, ComparatorParams params);

    /**
     * Penalty for a field whose anchor exists only in the prediction. Mirror of {@link #unmatchedGold}.
     *
     * @param predicted raw predicted value
     * @param params    comparator parameters declared for the field
     * @return counts contributed by this field
     */
    ConfusionCounts unmatchedPrediction(String predicted, ComparatorParams params);
}
