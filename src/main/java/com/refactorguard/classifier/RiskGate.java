package com.refactorguard.classifier;

/**
 * Accepts a rewrite when its estimated risk is at most the threshold.
 */
public class RiskGate {

    public static final double DEFAULT_THRESHOLD = 0.3;

    private final double threshold;

    public RiskGate() {
        this(DEFAULT_THRESHOLD);
    }

    public RiskGate(double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Risk threshold must be within [0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public boolean accepts(double risk) {
        return risk <= threshold;
    }

    public double getThreshold() {
        return threshold;
    }
}
