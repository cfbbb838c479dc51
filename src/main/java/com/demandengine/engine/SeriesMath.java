package com.demandengine.engine;

import java.util.List;

/**
 * Small descriptive statistics shared by the engine components.
 */
final class SeriesMath {

    private SeriesMath() {
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double mean(List<Double> values) {
        return mean(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Population standard deviation; zero for fewer than two values. */
    static double std(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    static double std(List<Double> values) {
        return std(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** Ordinary least squares fit of y on x. */
    static Regression regression(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return new Regression(0.0, n == 1 ? y[0] : 0.0, 0.0);
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0) {
            return new Regression(0.0, meanY, 0.0);
        }
        double slope = sxy / sxx;
        double rSquared = syy == 0.0 ? 0.0 : (sxy * sxy) / (sxx * syy);
        return new Regression(slope, meanY - slope * meanX, rSquared);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }

    record Regression(double slope, double intercept, double rSquared) {
        double at(double x) {
            return intercept + slope * x;
        }
    }
}
