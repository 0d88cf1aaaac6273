package com.hmmtagger.server.ai.inference;

/**
 * Outcome of the scaled forward pass. The likelihood is carried by the
 * per-step normalization coefficients: log P(O) is the sum of their logs.
 */
public class ForwardResult {
    private final double[] scalingFactors;
    private final double logLikelihood;

    public ForwardResult(double[] scalingFactors) {
        this.scalingFactors = scalingFactors.clone();
        this.logLikelihood = MathUtil.sumOfLogs(scalingFactors);
    }

    public double[] getScalingFactors() {
        return scalingFactors.clone();
    }

    public double getLogLikelihood() {
        return logLikelihood;
    }

    public double getLikelihood() {
        return Math.exp(logLikelihood);
    }

    public double get(boolean logarithmic) {
        return logarithmic ? getLogLikelihood() : getLikelihood();
    }

    @Override
    public String toString() {
        return "ForwardResult{steps=" + scalingFactors.length + ", logLikelihood=" + logLikelihood + '}';
    }
}
