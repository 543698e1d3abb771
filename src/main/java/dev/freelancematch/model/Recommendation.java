package dev.freelancematch.model;

import java.util.List;

/**
 * A ranked candidate as handed to callers.
 *
 * @param matchScore compatibility as a percentage in [0,100]
 */
public record Recommendation(
        int rank,
        String freelancerId,
        String name,
        double matchScore,
        List<String> skills,
        double hourlyRate,
        ExperienceTier experienceLevel,
        int completedProjects,
        double avgRating) {

    public static Recommendation of(int rank, Freelancer freelancer, double matchScore) {
        return new Recommendation(
                rank,
                freelancer.getFreelancerId(),
                freelancer.getName(),
                matchScore,
                freelancer.getSkills(),
                freelancer.getHourlyRate(),
                freelancer.effectiveTier(),
                freelancer.getCompletedProjects(),
                freelancer.getAvgRating());
    }
}
