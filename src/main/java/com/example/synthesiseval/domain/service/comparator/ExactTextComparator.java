package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.service.ValueNormalizer;

/**
 * Case- and spacing-insensitive text equality, e.g. the IR sample material.
 */
public class ExactTextComparator extends ScalarFieldComparator {

    @Override
    protected String normalize(String value) {
        return ValueNormalizer.normalizeText(value);
    }
}
