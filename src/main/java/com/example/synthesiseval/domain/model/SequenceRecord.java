package com.example.synthesiseval.domain.model;

import java.util.List;

/**
 * Ordered step-type tokens (e.g. {@code Add}, {@code HeatChill}, {@code Filter}) reported for one anchor.
 * Order is significant; the list is never treated as a multiset.
 */
public record SequenceRecord(
        String anchor,
        List<String> steps
) {

    public SequenceRecord {
        anchor = anchor == null ? "" : anchor.strip();
        steps = steps == null
                ? List.of()
                : steps.stream().map(step -> step == null ? "" : step).toList();
    }

    public boolean hasBlankAnchor() {
        return anchor.isEmpty();
    }
}
