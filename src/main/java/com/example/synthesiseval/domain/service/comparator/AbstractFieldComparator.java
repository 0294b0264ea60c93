package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.service.ValueNormalizer;

/**
 * Applies the not-applicable override before any kind-specific logic: two values that both say
 * "unknown" are a correct match, whatever the field kind.
 */
public abstract class AbstractFieldComparator implements FieldComparator {

    @Override
    public final ConfusionCounts compare(String predicted, String gold, ComparatorParams params) {
        String safePredicted = predicted == null ? "" : predicted;
        String safeGold = gold == null ? "" : gold;
        if (ValueNormalizer.isNotApplicable(safePredicted) && ValueNormalizer.isNotApplicable(safeGold)) {
            return ConfusionCounts.match();
        }
        return compareValues(safePredicted, safeGold, params);
    }

    /**
     * Kind-specific scoring, reached only when at least one side carries a value.
     *
     * @param predicted raw predicted value, never {@code null}
     * @param gold      raw gold value, never {@code null}
     * @param params    comparator parameters
     * @return counts contributed by this field
     */
    protected abstract ConfusionCounts compareValues(String predicted, String gold, ComparatorParams params);
}
