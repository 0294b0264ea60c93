package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;

/**
 * Field holding several elements (bands, element percentages, names).
 * An unmatched anchor is penalised once per parsed element.
 */
public abstract class CollectionFieldComparator extends AbstractFieldComparator {

    /**
     * @param raw    raw field value
     * @param params comparator parameters
     * @return number of distinct elements the value parses into
     */
    protected abstract int elementCount(String raw, ComparatorParams params);

    @Override
    public ConfusionCounts unmatchedGold(String gold, ComparatorParams params) {
        return ConfusionCounts.falseNegatives(elementCount(gold == null ? "" : gold, params));
    }

    @Override
    public ConfusionCounts unmatchedPrediction(String predicted, ComparatorParams params) {
        return ConfusionCounts.falsePositives(elementCount(predicted == null ? "" : predicted, params));
    }
}
