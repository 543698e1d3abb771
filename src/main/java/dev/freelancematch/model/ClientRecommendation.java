package dev.freelancematch.model;

import java.util.List;

/**
 * Collaborative recommendation for a client.
 *
 * @param predictedRating predicted rating on the 0-5 scale
 * @param matchScore      predicted rating as a percentage
 */
public record ClientRecommendation(
        int rank,
        String freelancerId,
        String name,
        double predictedRating,
        double matchScore,
        List<String> skills,
        double hourlyRate,
        ExperienceTier experienceLevel) {

    public static ClientRecommendation of(int rank, Freelancer freelancer,
            double predictedRating, double matchScore) {
        return new ClientRecommendation(
                rank,
                freelancer.getFreelancerId(),
                freelancer.getName(),
                predictedRating,
                matchScore,
                freelancer.getSkills(),
                freelancer.getHourlyRate(),
                freelancer.effectiveTier());
    }
}
