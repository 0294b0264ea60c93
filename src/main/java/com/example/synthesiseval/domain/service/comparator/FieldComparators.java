package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorKind;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.FieldSpec;

/**
 * Comparator registry: one stateless strategy per {@link ComparatorKind}.
 */
public final class FieldComparators {

    private static final FieldComparator EXACT_TEXT = new ExactTextComparator();
    private static final FieldComparator FORMULA = new FormulaComparator();
    private static final FieldComparator NUMERIC_SET = new NumericSetComparator();
    private static final FieldComparator KEYED_SERIES = new KeyedSeriesComparator();
    private static final FieldComparator STRING_SET = new StringSetComparator();

    private FieldComparators() {
    }

    public static FieldComparator forKind(ComparatorKind kind) {
        return switch (kind) {
            case EXACT_TEXT -> EXACT_TEXT;
            case FORMULA -> FORMULA;
            case NUMERIC_SET_WITH_TOLERANCE -> NUMERIC_SET;
            case KEYED_NUMERIC_SERIES -> KEYED_SERIES;
            case SET_OF_STRINGS -> STRING_SET;
        };
    }

    public static ConfusionCounts compare(FieldSpec spec, String predicted, String gold) {
        return forKind(spec.kind()).compare(predicted, gold, spec.params());
    }

    public static ConfusionCounts unmatchedGold(FieldSpec spec, String gold) {
        return forKind(spec.kind()).unmatchedGold(gold, spec.params());
    }

    public static ConfusionCounts unmatchedPrediction(FieldSpec spec, String predicted) {
        return forKind(spec.kind()).unmatchedPrediction(predicted, spec.params());
    }
}
