package com.example.synthesiseval.domain.service.comparator;

import com.example.synthesiseval.domain.model.ComparatorParams;
import com.example.synthesiseval.domain.model.ConfusionCounts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyed numeric series such as elemental analysis weight percentages ({@code "C 45.23; H 3.10; N 5.2"}).
 * <p>
 * A gold key scores a true positive only when the prediction has the key with the same value at the declared
 * precision. A key present on both sides with different values is a false negative only; false positives are
 * reserved for predicted keys that gold does not have.
 */
public class KeyedSeriesComparator extends CollectionFieldComparator {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[;,]\\s*");
    private static final Pattern KEYED_VALUE = Pattern.compile("([A-Za-z]+)\\s+(-?\\d+(?:\\.\\d+)?)");

    @Override
    protected ConfusionCounts compareValues(String predicted, String gold, ComparatorParams params) {
        Map<String, Double> predictedSeries = parsePercentSeries(predicted);
        Map<String, Double> goldSeries = parsePercentSeries(gold);
        int precision = params.decimalPrecision();

        int tp = 0;
        int fn = 0;
        for (Map.Entry<String, Double> entry : goldSeries.entrySet()) {
            Double predictedValue = predictedSeries.get(entry.getKey());
            if (predictedValue != null && sameAtPrecision(predictedValue, entry.getValue(), precision)) {
                tp++;
            } else {
                fn++;
            }
        }
        int fp = 0;
        for (String key : predictedSeries.keySet()) {
            if (!goldSeries.containsKey(key)) {
                fp++;
            }
        }
        return new ConfusionCounts(tp, fp, fn);
    }

    @Override
    protected int elementCount(String raw, ComparatorParams params) {
        return parsePercentSeries(raw).size();
    }

    /**
     * Splits on {@code ;} or {@code ,} and reads a leading "letters, whitespace, signed decimal" pair from each
     * token. Tokens that do not start with such a pair are skipped; a repeated key keeps its last value.
     *
     * @param value raw series
     * @return key to value, in first-seen key order
     */
    public static Map<String, Double> parsePercentSeries(String value) {
        Map<String, Double> series = new LinkedHashMap<>();
        if (value == null || value.isBlank()) {
            return series;
        }
        for (String token : TOKEN_SEPARATOR.split(value.strip())) {
            Matcher matcher = KEYED_VALUE.matcher(token);
            if (matcher.lookingAt()) {
                series.put(matcher.group(1), Double.parseDouble(matcher.group(2)));
            }
        }
        return series;
    }

    /**
     * Rounds both doubles half-even from their exact binary values before comparing.
     * Values too large for a double parse to infinity and are compared as they are.
     */
    static boolean sameAtPrecision(double left, double right, int precision) {
        if (!Double.isFinite(left) || !Double.isFinite(right)) {
            return Double.compare(left, right) == 0;
        }
        BigDecimal roundedLeft = new BigDecimal(left).setScale(precision, RoundingMode.HALF_EVEN);
        BigDecimal roundedRight = new BigDecimal(right).setScale(precision, RoundingMode.HALF_EVEN);
        return roundedLeft.compareTo(roundedRight) == 0;
    }
}
