package com.example.synthesiseval.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Positional step-sequence score: the per-anchor contributions (sorted by anchor) and their total.
 */
public record SequenceScore(
        Map<String, ConfusionCounts> perAnchor,
        Metrics total
) {

    public SequenceScore {
        perAnchor = Collections.unmodifiableMap(new LinkedHashMap<>(perAnchor));
    }

    public static SequenceScore empty() {
        return new SequenceScore(Map.of(), Metrics.of(ConfusionCounts.ZERO));
    }

    public boolean isEmpty() {
        return perAnchor.isEmpty();
    }
}
