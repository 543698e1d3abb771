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
 * Freelancer profile as supplied by the corpus source.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Freelancer {

    String freelancerId;
    String name;
    String country;
    @Singular
    @JsonProperty("skills")
    List<String> skills;
    double hourlyRate;
    int experienceYears;
    ExperienceTier experienceLevel;
    int completedProjects;
    double avgRating;
    String availability;
    @Singular
    @JsonProperty("past_projects")
    List<Engagement> pastProjects;

    /**
     * Tier derived from years of experience, independent of the stated level.
     */
    public ExperienceTier derivedTier() {
        return ExperienceTier.fromYears(experienceYears);
    }

    /**
     * Stated tier, or the derived one when none was stated.
     */
    public ExperienceTier effectiveTier() {
        return experienceLevel != null ? experienceLevel : derivedTier();
    }

    public boolean hasSkill(String skill) {
        return skills.stream().anyMatch(s -> s.equalsIgnoreCase(skill));
    }
}
