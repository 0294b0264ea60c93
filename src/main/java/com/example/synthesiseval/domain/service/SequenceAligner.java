package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.Metrics;
import com.example.synthesiseval.domain.model.SequenceScore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Positional scoring of ordered step sequences keyed by anchor.
 * <p>
 * Steps are compared index by index up to the shorter length; there is no realignment, so one inserted or
 * dropped step shifts every later position into a mismatch. An anchor present on one side only is scored
 * against an empty sequence.
 */
public final class SequenceAligner {

    private SequenceAligner() {
    }

    public static SequenceScore align(Map<String, List<String>> predicted, Map<String, List<String>> gold) {
        Set<String> anchors = new TreeSet<>(predicted.keySet());
        anchors.addAll(gold.keySet());

        Map<String, ConfusionCounts> perAnchor = new LinkedHashMap<>();
        ConfusionCounts total = ConfusionCounts.ZERO;
        for (String anchor : anchors) {
            ConfusionCounts counts = score(predicted.getOrDefault(anchor, List.of()), gold.getOrDefault(anchor, List.of()));
            perAnchor.put(anchor, counts);
            total = total.plus(counts);
        }
        return new SequenceScore(perAnchor, Metrics.of(total));
    }

    /**
     * @param predicted predicted step tokens
     * @param gold      gold step tokens
     * @return {@code (eq, |predicted| - eq, |gold| - eq)} where {@code eq} counts equal positions
     */
    public static ConfusionCounts score(List<String> predicted, List<String> gold) {
        int overlap = Math.min(predicted.size(), gold.size());
        int equal = 0;
        for (int i = 0; i < overlap; i++) {
            if (gold.get(i).equals(predicted.get(i))) {
                equal++;
            }
        }
        return new ConfusionCounts(equal, predicted.size() - equal, gold.size() - equal);
    }
}
