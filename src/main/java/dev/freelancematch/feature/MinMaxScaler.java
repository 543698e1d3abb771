package dev.freelancematch.feature;

/**
 * Min-max scaler for one numeric feature. Values outside the fitted range are clipped to [0,1];
 * a constant feature maps everything to 0.
 */
public class MinMaxScaler {

    private final String feature;
    private double min;
    private double max;
    private boolean fitted;

    public MinMaxScaler(String feature) {
        this.feature = feature;
    }

    public void fit(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot fit " + feature + " scaler on no values");
        }
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        this.min = lo;
        this.max = hi;
        this.fitted = true;
    }

    public double transform(double value) {
        if (!fitted) {
            throw new NotFittedException(feature + " scaler must be fitted before transform");
        }
        double range = max - min;
        if (range == 0.0) {
            return 0.0;
        }
        double scaled = (value - min) / range;
        return Math.max(0.0, Math.min(1.0, scaled));
    }

    public boolean isFitted() {
        return fitted;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }
}
