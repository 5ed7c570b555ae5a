package com.accesslog.risk.engine.isolationforest;

/**
 * Per-column standardization fitted to a single batch: (x - mean) / stdDev with the
 * population standard deviation. Columns with no spread map to 0.
 */
public final class StandardScaler {

    private static final double EPSILON = Math.ulp(1.0);

    private final double[] means;
    private final double[] stdDevs;

    private StandardScaler(double[] means, double[] stdDevs) {
        this.means = means;
        this.stdDevs = stdDevs;
    }

    public static StandardScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit a scaler on an empty batch");
        }
        int columns = data[0].length;
        int n = data.length;
        double[] means = new double[columns];
        double[] stdDevs = new double[columns];

        for (int j = 0; j < columns; j++) {
            double sum = 0.0;
            for (double[] row : data) sum += row[j];
            double mean = sum / n;

            double squares = 0.0;
            for (double[] row : data) {
                double d = row[j] - mean;
                squares += d * d;
            }
            double stdDev = Math.sqrt(squares / n);

            // Rounding noise on a constant column must not be blown up into unit variance
            if (stdDev < 10 * EPSILON * Math.max(1.0, Math.abs(mean))) {
                stdDev = 0.0;
            }
            means[j] = mean;
            stdDevs[j] = stdDev;
        }
        return new StandardScaler(means, stdDevs);
    }

    public double[] transform(double[] row) {
        double[] scaled = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            scaled[j] = stdDevs[j] > 0 ? (row[j] - means[j]) / stdDevs[j] : 0.0;
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }

    public double[] getMeans() { return means.clone(); }
    public double[] getStdDevs() { return stdDevs.clone(); }
}
