package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.AnchorPartition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Splits two anchor sets into matched, gold-only and prediction-only anchors.
 */
public final class AnchorMatcher {

    private AnchorMatcher() {
    }

    /**
     * @param predicted anchors of the predicted collection
     * @param gold      anchors of the gold collection
     * @return partition with every list in lexical order
     */
    public static AnchorPartition partition(Set<String> predicted, Set<String> gold) {
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> extra = new ArrayList<>();

        Set<String> all = new TreeSet<>(predicted);
        all.addAll(gold);
        for (String anchor : all) {
            boolean inPredicted = predicted.contains(anchor);
            boolean inGold = gold.contains(anchor);
            if (inPredicted && inGold) {
                matched.add(anchor);
            } else if (inGold) {
                missing.add(anchor);
            } else {
                extra.add(anchor);
            }
        }
        return new AnchorPartition(matched, missing, extra);
    }
}
