package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed-price budget. Carries no hourly rate.
 */
public record FixedBudget(@JsonProperty("amount") Double amount) implements Budget {

    @Override
    public void validate() {
        if (amount == null || amount.isNaN() || amount < 0) {
            throw new MalformedBudgetException("Fixed budget amount is invalid: " + amount);
        }
    }
}
