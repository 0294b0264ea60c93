package com.example.synthesiseval.domain.model;

import java.util.regex.Pattern;

/**
 * Parameter payload shared by all comparator kinds. Each kind reads only the parameters it needs:
 * tolerance for numeric sets, decimal precision for keyed series, delimiter for string sets.
 */
public record ComparatorParams(
        int tolerance,
        int decimalPrecision,
        String delimiterPattern
) {

    public static final int DEFAULT_TOLERANCE = 3;
    public static final int DEFAULT_DECIMAL_PRECISION = 2;
    public static final String DEFAULT_DELIMITER = ";";
    /** Upper bound for keyed-series rounding digits. */
    public static final int MAX_DECIMAL_PRECISION = 15;

    public static final ComparatorParams DEFAULTS =
            new ComparatorParams(DEFAULT_TOLERANCE, DEFAULT_DECIMAL_PRECISION, DEFAULT_DELIMITER);

    public ComparatorParams {
        if (tolerance < 0) {
            throw new IllegalArgumentException("Tolerance must be non-negative: " + tolerance);
        }
        if (decimalPrecision < 0 || decimalPrecision > MAX_DECIMAL_PRECISION) {
            throw new IllegalArgumentException("Decimal precision must be between 0 and " + MAX_DECIMAL_PRECISION
                    + ": " + decimalPrecision);
        }
        if (delimiterPattern == null || delimiterPattern.isEmpty()) {
            delimiterPattern = DEFAULT_DELIMITER;
        }
        Pattern.compile(delimiterPattern);
    }

    public ComparatorParams withTolerance(int value) {
        return new ComparatorParams(value, decimalPrecision, delimiterPattern);
    }

    public ComparatorParams withDecimalPrecision(int value) {
        return new ComparatorParams(tolerance, value, delimiterPattern);
    }

    public ComparatorParams withDelimiter(String value) {
        return new ComparatorParams(tolerance, decimalPrecision, value);
    }
}
