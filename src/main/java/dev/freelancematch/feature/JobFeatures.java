package dev.freelancematch.feature;

/**
 * Normalised representation of a job's requirements.
 */
public record JobFeatures(
        SkillVector skills,
        double hourlyRate,
        double experienceLevel) {
}
