package com.hmmtagger.server.ai;

/**
 * Thrown when a matrix cell write is rejected. The cell keeps its previous value.
 */
public class InvalidProbabilityException extends IllegalArgumentException {

    public enum Reason {
        OUT_OF_RANGE,
        NOT_FINITE
    }

    private final Reason reason;
    private final double value;

    public InvalidProbabilityException(Reason reason, double value) {
        super(reason == Reason.NOT_FINITE
                ? "The value must be a finite number: " + value
                : "The probability value must be in range 0..1: " + value);
        this.reason = reason;
        this.value = value;
    }

    public Reason getReason() {
        return reason;
    }

    public double getValue() {
        return value;
    }

    /**
     * Returns the value unchanged if it is a finite number in [0, 1].
     */
    public static double check(double probability) {
        if (Double.isNaN(probability) || Double.isInfinite(probability)) {
            throw new InvalidProbabilityException(Reason.NOT_FINITE, probability);
        }
        if (probability < 0 || probability > 1) {
            throw new InvalidProbabilityException(Reason.OUT_OF_RANGE, probability);
        }
        return probability;
    }
}
