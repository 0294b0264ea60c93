package com.example.synthesiseval.domain.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text canonicalization shared by every comparator.
 * Stateless; all methods accept {@code null} and treat it as the empty string.
 */
public final class ValueNormalizer {

    /**
     * Normalized spellings of "explicitly unknown". The empty string is a member.
     */
    public static final Set<String> NOT_APPLICABLE_TOKENS = Set.of("n/a", "na", "not stated", "-", "—", "");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private ValueNormalizer() {
    }

    /**
     * NFKC-normalizes, strips, collapses internal whitespace runs to one space and case-folds.
     *
     * @param value raw value
     * @return canonical text
     */
    public static String normalizeText(String value) {
        String nfkc = nfkc(value).strip();
        String collapsed = WHITESPACE.matcher(nfkc).replaceAll(" ");
        return collapsed.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }

    public static boolean isNotApplicable(String value) {
        return NOT_APPLICABLE_TOKENS.contains(normalizeText(value));
    }

    /**
     * NFKC-normalizes and removes all whitespace. Case is kept: {@code Co} and {@code CO} are different formulas.
     *
     * @param value raw formula
     * @return formula without spacing
     */
    public static String normalizeFormula(String value) {
        return WHITESPACE.matcher(nfkc(value)).replaceAll("");
    }

    private static String nfkc(String value) {
        return value == null ? "" : Normalizer.normalize(value, Normalizer.Form.NFKC);
    }
}
