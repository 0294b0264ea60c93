package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.ConfusionCounts;
import com.example.synthesiseval.domain.model.Metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-run tally of field-level and global counts.
 * <p>
 * {@link #add} is the only way counts enter, and it updates the field and the global total together, so the
 * global total always equals the sum of the field totals. One instance belongs to one evaluation run and is
 * not thread-safe.
 */
public class ConfusionAccumulator {

    private final Map<String, ConfusionCounts> perField = new LinkedHashMap<>();
    private ConfusionCounts global = ConfusionCounts.ZERO;
    private boolean finished;

    /**
     * @param fieldNames declared fields, in report order; each starts at zero
     */
    public ConfusionAccumulator(List<String> fieldNames) {
        for (String fieldName : fieldNames) {
            perField.put(fieldName, ConfusionCounts.ZERO);
        }
    }

    public void add(String fieldName, ConfusionCounts counts) {
        if (finished) {
            throw new IllegalStateException("Accumulator already finished");
        }
        ConfusionCounts current = perField.get(fieldName);
        if (current == null) {
            throw new IllegalArgumentException("Field '" + fieldName + "' is not declared in this run");
        }
        perField.put(fieldName, current.plus(counts));
        global = global.plus(counts);
    }

    public ConfusionCounts fieldCounts(String fieldName) {
        return perField.getOrDefault(fieldName, ConfusionCounts.ZERO);
    }

    public ConfusionCounts globalCounts() {
        return global;
    }

    /**
     * Freezes the tally and derives precision, recall and F1 for each field and for the global total.
     *
     * @return finished metrics; further {@link #add} calls fail
     */
    public Totals finish() {
        finished = true;
        Map<String, Metrics> metrics = new LinkedHashMap<>();
        perField.forEach((field, counts) -> metrics.put(field, Metrics.of(counts)));
        return new Totals(Collections.unmodifiableMap(metrics), Metrics.of(global));
    }

    /**
     * @param fields  per-field metrics in declaration order
     * @param overall metrics over every contribution
     */
    public record Totals(Map<String, Metrics> fields, Metrics overall) {
    }
}
