package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.service.ValueNormalizer;

/**
 * Chemical formula equality: spacing is ignored, case is not.
 */
public class FormulaComparator extends ScalarFieldComparator {

    @Override
    protected String normalize(String value) {
        return ValueNormalizer.normalizeFormula(value);
    }
}
