package com.example.synthesiseval.domain.service;

import com.example.synthesiseval.domain.model.ExtractionRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the anchor-keyed index built over record collections.
 */
class AnchorIndexTest {

    /**
     * The later of two records sharing an anchor replaces the earlier one.
     */
    @Test
    void duplicateAnchorKeepsLastRecord() {
        List<ExtractionRecord> records = List.of(
                new ExtractionRecord("123", Map.of("formula", "C6H5")),
                new ExtractionRecord(" 123 ", Map.of("formula", "C6H6")));

        Map<String, ExtractionRecord> index = AnchorIndex.byAnchor(
                "predicted", records, ExtractionRecord::anchor, ExtractionRecord::hasBlankAnchor);

        assertThat(index).containsOnlyKeys("123");
        assertThat(index.get("123").value("formula")).isEqualTo("C6H6");
    }

    /**
     * Records without an anchor, and null entries, never reach the index.
     */
    @Test
    void blankAnchorsAreDropped() {
        List<ExtractionRecord> records = Arrays.asList(
                new ExtractionRecord("  ", Map.of("formula", "C6H6")),
                null,
                new ExtractionRecord("B", Map.of()),
                new ExtractionRecord("A", Map.of()));

        Map<String, ExtractionRecord> index = AnchorIndex.byAnchor(
                "gold", records, ExtractionRecord::anchor, ExtractionRecord::hasBlankAnchor);

        assertThat(index.keySet()).containsExactly("A", "B");
    }

    @Test
    void nullCollectionYieldsEmptyIndex() {
        assertThat(AnchorIndex.byAnchor("gold", null, ExtractionRecord::anchor, ExtractionRecord::hasBlankAnchor))
                .isEmpty();
    }
}
