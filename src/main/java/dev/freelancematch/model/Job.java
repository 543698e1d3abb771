package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Job posting to match freelancers against. Built per request and discarded after scoring.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {

    String jobId;
    String clientId;
    String title;
    String description; // not used by scoring
    @Singular("skillRequired")
    @JsonProperty("skills_required")
    List<String> skillsRequired;
    Budget budget;
    ExperienceTier experienceLevel;
    int timelineDays; // accepted, not used by scoring

    /**
     * Validate the budget before any scoring happens.
     *
     * @throws MalformedBudgetException if the budget is missing or malformed
     */
    public void validateBudget() {
        if (budget == null) {
            throw new MalformedBudgetException("Job '" + title + "' has no budget");
        }
        budget.validate();
    }

    public ExperienceTier requiredTier() {
        return experienceLevel != null ? experienceLevel : ExperienceTier.INTERMEDIATE;
    }
}
