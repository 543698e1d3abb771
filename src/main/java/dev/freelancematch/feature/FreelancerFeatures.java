package dev.freelancematch.feature;

/**
 * Normalised representation of a freelancer. Scalars lie in [0,1].
 */
public record FreelancerFeatures(
        SkillVector skills,
        double hourlyRate,
        double experienceYears,
        double experienceLevel,
        double avgRating) {
}
