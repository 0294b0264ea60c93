package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.service.ValueNormalizer;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Unordered set of free-text values, e.g. alternative product names separated by the field delimiter.
 */
public class StringSetComparator extends CollectionFieldComparator {

    @Override
    protected ConfusionCounts compareValues(String predicted, String gold, ComparatorParams params) {
        Set<String> predictedSet = parseSet(predicted, params);
        Set<String> goldSet = parseSet(gold, params);
        int tp = 0;
        for (String element : predictedSet) {
            if (goldSet.contains(element)) {
                tp++;
            }
        }
        return new ConfusionCounts(tp, predictedSet.size() - tp, goldSet.size() - tp);
    }

    @Override
    protected int elementCount(String raw, ComparatorParams params) {
        return parseSet(raw, params).size();
    }

    /**
     * Splits on the declared delimiter, normalizes each element and drops empty ones.
     *
     * @param value  raw value
     * @param params parameters carrying the delimiter pattern
     * @return sorted set of normalized elements
     */
    public static Set<String> parseSet(String value, ComparatorParams params) {
        Set<String> elements = new TreeSet<>();
        if (value == null || value.isEmpty()) {
            return elements;
        }
        for (String part : Pattern.compile(params.delimiterPattern()).split(value)) {
            String normalized = ValueNormalizer.normalizeText(part);
            if (!normalized.isEmpty()) {
                elements.add(normalized);
            }
        }
        return elements;
    }
}
