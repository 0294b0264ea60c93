package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.service.ValueNormalizer;

/**
 * Single-valued field compared after a normalization step.
 * A differing pair emits both a false positive and a false negative, so one field can cost two units.
 */
public abstract class ScalarFieldComparator extends AbstractFieldComparator {

    protected abstract String normalize(String value);

    @Override
    protected ConfusionCounts compareValues(String predicted, String gold, ComparatorParams params) {
        String normalizedPredicted = normalize(predicted);
        String normalizedGold = normalize(gold);
        boolean equal = normalizedPredicted.equals(normalizedGold);
        int tp = !normalizedPredicted.isEmpty() && equal ? 1 : 0;
        int fp = !normalizedPredicted.isEmpty() && !equal ? 1 : 0;
        int fn = !normalizedGold.isEmpty() && !equal ? 1 : 0;
        return new ConfusionCounts(tp, fp, fn);
    }

    @Override
    public ConfusionCounts unmatchedGold(String gold, ComparatorParams params) {
        return ValueNormalizer.isNotApplicable(gold) ? ConfusionCounts.match() : ConfusionCounts.falseNegatives(1);
    }

    @Override
    public ConfusionCounts unmatchedPrediction(String predicted, ComparatorParams params) {
        return ValueNormalizer.isNotApplicable(predicted) ? ConfusionCounts.match() : ConfusionCounts.falsePositives(1);
    }
}
