package com.example.synthesiseval.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds the anchor-keyed view of a record collection.
 * <p>
 * Records with a blank anchor are dropped. When two records share an anchor the later one replaces the
 * earlier one and a warning names the anchor; callers that need a different policy must deduplicate first.
 */
public final class AnchorIndex {

    private static final Logger log = LoggerFactory.getLogger(AnchorIndex.class);

    private AnchorIndex() {
    }

    /**
     * @param side         label used in log lines ("predicted", "gold", ...)
     * @param records      records in caller order, may be {@code null}
     * @param anchorOf     extracts the already-trimmed anchor
     * @param isBlank      tells whether a record has no usable anchor
     * @param <T>          record type
     * @return unmodifiable map sorted by anchor
     */
    public static <T> Map<String, T> byAnchor(String side,
                                              Collection<T> records,
                                              Function<T, String> anchorOf,
                                              Predicate<T> isBlank) {
        Map<String, T> index = new TreeMap<>();
        if (records == null) {
            return Collections.unmodifiableMap(index);
        }
        int blank = 0;
        for (T record : records) {
            if (record == null || isBlank.test(record)) {
                blank++;
                continue;
            }
            String anchor = anchorOf.apply(record);
            if (index.put(anchor, record) != null) {
                log.warn("Duplicate {} anchor '{}'; keeping the last record", side, anchor);
            }
        }
        if (blank > 0) {
            log.warn("Ignored {} {} record(s) without an anchor", blank, side);
        }
        return Collections.unmodifiableMap(index);
    }
}
