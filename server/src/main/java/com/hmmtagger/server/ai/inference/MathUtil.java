package com.hmmtagger.server.ai.inference;

public class MathUtil {

    /**
     * Returns the index of the maximum value in the array. Ties go to the
     * lowest index, which keeps decoding deterministic for a fixed state order.
     */
    public static int argmax(double[] x) {
        int bestIdx = -1;
        double bestVal = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < x.length; i++) {
            if (x[i] > bestVal) {
                bestVal = x[i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static double sum(double[] x) {
        double total = 0.0;
        for (double v : x) {
            total += v;
        }
        return total;
    }

    /**
     * Divides every entry by the given factor in place. A zero factor leaves
     * the array untouched.
     */
    public static void scale(double[] x, double factor) {
        if (factor <= 0.0) {
            return;
        }
        for (int i = 0; i < x.length; i++) {
            x[i] /= factor;
        }
    }

    /**
     * Sum of natural logarithms. A zero entry yields negative infinity.
     */
    public static double sumOfLogs(double[] x) {
        double total = 0.0;
        for (double v : x) {
            total += Math.log(v);
        }
        return total;
    }
}
