package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A past project linking one freelancer to one client.
 *
 * @param rating client rating in [0,5]; 0 is the lowest rating, not "no interaction"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Engagement(
        @JsonProperty("project_id") String projectId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("title") String title,
        @JsonProperty("skills") List<String> skills,
        @JsonProperty("duration_days") int durationDays,
        @JsonProperty("budget") double budget,
        @JsonProperty("rating") int rating) {

    public static final int MIN_RATING = 0;
    public static final int MAX_RATING = 5;

    public Engagement {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Engagement " + projectId + " has no client id");
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException(
                    "Engagement " + projectId + " rating " + rating + " outside [0,5]");
        }
        skills = (skills != null) ? List.copyOf(skills) : List.of();
    }

    /**
     * JSON entry point. Ratings must be whole numbers: a fractional rating is rejected instead
     * of being truncated.
     */
    @JsonCreator
    public static Engagement fromJson(
            @JsonProperty("project_id") String projectId,
            @JsonProperty("client_id") String clientId,
            @JsonProperty("title") String title,
            @JsonProperty("skills") List<String> skills,
            @JsonProperty("duration_days") int durationDays,
            @JsonProperty("budget") double budget,
            @JsonProperty("rating") Number rating) {
        if (rating == null) {
            throw new IllegalArgumentException("Engagement " + projectId + " has no rating");
        }
        double value = rating.doubleValue();
        if (Double.isNaN(value) || value != Math.rint(value)) {
            throw new IllegalArgumentException(
                    "Engagement " + projectId + " rating " + rating + " is not a whole number");
        }
        if (value < MIN_RATING || value > MAX_RATING) {
            throw new IllegalArgumentException(
                    "Engagement " + projectId + " rating " + rating + " outside [0,5]");
        }
        return new Engagement(projectId, clientId, title, skills, durationDays, budget, (int) value);
    }

    public static Engagement of(String projectId, String clientId, int rating) {
        return new Engagement(projectId, clientId, null, List.of(), 0, 0.0, rating);
    }
}
