package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Job budget: either an hourly range or a fixed amount.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = HourlyBudget.class, name = "hourly"),
        @JsonSubTypes.Type(value = FixedBudget.class, name = "fixed")
})
public interface Budget {

    /**
     * Check that the variant carries usable values.
     *
     * @throws MalformedBudgetException if it does not
     */
    void validate();
}
