package com.example.synthesiseval.domain.model;

/**
 * Immutable true-positive / false-positive / false-negative triple.
 * Rates are derived on demand and fall back to {@code 0.0} whenever their denominator is zero.
 */
public record ConfusionCounts(
        int truePositives,
        int falsePositives,
        int falseNegatives
) {

    public static final ConfusionCounts ZERO = new ConfusionCounts(0, 0, 0);

    public ConfusionCounts {
        if (truePositives < 0 || falsePositives < 0 || falseNegatives < 0) {
            throw new IllegalArgumentException("Confusion counts must be non-negative: tp=" + truePositives
                    + " fp=" + falsePositives + " fn=" + falseNegatives);
        }
    }

    /**
     * @return a single correct match
     */
    public static ConfusionCounts match() {
        return new ConfusionCounts(1, 0, 0);
    }

    public static ConfusionCounts falsePositives(int count) {
        return new ConfusionCounts(0, count, 0);
    }

    public static ConfusionCounts falseNegatives(int count) {
        return new ConfusionCounts(0, 0, count);
    }

    /**
     * Element-wise addition.
     *
     * @param other counts to add
     * @return new triple holding the sums
     */
    public ConfusionCounts plus(ConfusionCounts other) {
        return new ConfusionCounts(
                truePositives + other.truePositives,
                falsePositives + other.falsePositives,
                falseNegatives + other.falseNegatives
        );
    }

    public boolean hasErrors() {
        return falsePositives > 0 || falseNegatives > 0;
    }

    public double precision() {
        int denominator = truePositives + falsePositives;
        return denominator > 0 ? (double) truePositives / denominator : 0.0;
    }

    public double recall() {
        int denominator = truePositives + falseNegatives;
        return denominator > 0 ? (double) truePositives / denominator : 0.0;
    }

    public double f1() {
        double precision = precision();
        double recall = recall();
        double sum = precision + recall;
        return sum > 0 ? 2 * precision * recall / sum : 0.0;
    }
}
