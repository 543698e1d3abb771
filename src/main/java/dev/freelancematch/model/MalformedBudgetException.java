package dev.freelancematch.model;

/**
 * Thrown when a job budget is missing or is neither a well-formed hourly nor fixed variant.
 */
public class MalformedBudgetException extends IllegalArgumentException {

    public MalformedBudgetException(String message) {
        super(message);
    }
}
