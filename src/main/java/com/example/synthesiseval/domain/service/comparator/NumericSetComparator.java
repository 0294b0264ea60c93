package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;

import java.util.HashSet;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric lists matched within a tolerance, e.g. IR bands such as {@code "1600 (s), 1625 (m) cm-1"}.
 * <p>
 * Matching is greedy: gold values are visited in ascending order and each takes the nearest still-unmatched
 * prediction within tolerance (ties go to the smaller prediction). An earlier gold value can take the
 * prediction a later one needed, so the split is not always the optimal assignment.
 */
public class NumericSetComparator extends CollectionFieldComparator {

    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\d{3,4}(?:\\.\\d+)?");

    @Override
    protected ConfusionCounts compareValues(String predicted, String gold, ComparatorParams params) {
        return matchGreedy(parseNumbers(predicted), parseNumbers(gold), params.tolerance());
    }

    @Override
    protected int elementCount(String raw, ComparatorParams params) {
        return parseNumbers(raw).size();
    }

    /**
     * Extracts every 3-4 digit number (optionally with decimals) and rounds it half-even to an integer.
     *
     * @param value raw list
     * @return distinct integers in ascending order
     */
    public static NavigableSet<Integer> parseNumbers(String value) {
        NavigableSet<Integer> numbers = new TreeSet<>();
        if (value == null) {
            return numbers;
        }
        Matcher matcher = NUMBER_TOKEN.matcher(value);
        while (matcher.find()) {
            numbers.add((int) Math.rint(Double.parseDouble(matcher.group())));
        }
        return numbers;
    }

    static ConfusionCounts matchGreedy(NavigableSet<Integer> predicted, NavigableSet<Integer> gold, int tolerance) {
        Set<Integer> matched = new HashSet<>();
        int tp = 0;
        int fn = 0;
        for (int goldValue : gold) {
            Integer pick = null;
            int low = (int) Math.max((long) goldValue - tolerance, Integer.MIN_VALUE);
            int high = (int) Math.min((long) goldValue + tolerance, Integer.MAX_VALUE);
            for (int candidate : predicted.subSet(low, true, high, true)) {
                if (matched.contains(candidate)) {
                    continue;
                }
                // ascending scan, strict comparison: equal distances keep the smaller candidate
                if (pick == null || Math.abs(candidate - goldValue) < Math.abs(pick - goldValue)) {
                    pick = candidate;
                }
            }
            if (pick != null) {
                matched.add(pick);
                tp++;
            } else {
                fn++;
            }
        }
        return new ConfusionCounts(tp, predicted.size() - matched.size(), fn);
    }
}
