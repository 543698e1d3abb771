package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hourly budget range. An absent minimum counts as 0 and an absent maximum as unbounded.
 */
public record HourlyBudget(
        @JsonProperty("min_rate") Double minRate,
        @JsonProperty("max_rate") Double maxRate) implements Budget {

    public double effectiveMin() {
        return minRate != null ? minRate : 0.0;
    }

    public double effectiveMax() {
        return maxRate != null ? maxRate : Double.POSITIVE_INFINITY;
    }

    /**
     * Midpoint of the range; infinite when the maximum is absent.
     */
    public double midpoint() {
        return (effectiveMin() + effectiveMax()) / 2;
    }

    @Override
    public void validate() {
        if (minRate == null && maxRate == null) {
            throw new MalformedBudgetException("Hourly budget needs min_rate or max_rate");
        }
        checkBound("min_rate", minRate);
        checkBound("max_rate", maxRate);
        if (effectiveMin() > effectiveMax()) {
            throw new MalformedBudgetException(
                    "Hourly budget min_rate " + minRate + " exceeds max_rate " + maxRate);
        }
    }

    private static void checkBound(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0)) {
            throw new MalformedBudgetException("Hourly budget " + field + " is invalid: " + value);
        }
    }
}
