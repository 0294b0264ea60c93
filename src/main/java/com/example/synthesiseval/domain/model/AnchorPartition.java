package com.example.synthesiseval.domain.model;

import java.util.List;

/**
 * Classification of anchors across the predicted and gold collections, each list sorted lexically.
 *
 * @param matched anchors present on both sides
 * @param missing anchors present only in gold
 * @param extra   anchors present only in the prediction
 */
public record AnchorPartition(
        List<String> matched,
        List<String> missing,
        List<String> extra
) {

    public AnchorPartition {
        matched = List.copyOf(matched);
        missing = List.copyOf(missing);
        extra = List.copyOf(extra);
    }

    public static AnchorPartition empty() {
        return new AnchorPartition(List.of(), List.of(), List.of());
    }

    /**
     * Anchor-level detection score: a matched anchor is a hit, an extra one a false positive and a
     * missing one a false negative.
     *
     * @return counts over anchors rather than fields
     */
    public ConfusionCounts anchorCounts() {
        return new ConfusionCounts(matched.size(), extra.size(), missing.size());
    }
}
