package dev.freelancematch.service;

import dev.freelancematch.config.MatchingConfig;
import dev.freelancematch.config.MatchingConfig.Weights;
import dev.freelancematch.feature.FreelancerFeatures;
import dev.freelancematch.feature.JobFeatures;
import dev.freelancematch.feature.SkillVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Computes the weighted content compatibility between a job and a freelancer.
 */
@Slf4j
@Service
public class ContentScorer {

    static final double WEIGHT_TOLERANCE = 1e-9;

    private final Weights weights;

    public ContentScorer(MatchingConfig matchingConfig) {
        this.weights = matchingConfig.getWeights();
        double total = weights.total();
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException("Content score weights must sum to 1.0 but sum to " + total);
        }
    }

    /**
     * Result of scoring calculation.
     *
     * @param score     weighted total in [0,1]
     * @param breakdown unweighted sub-scores by factor
     */
    public record ScoreResult(double score, Map<String, Double> breakdown) {
    }

    /**
     * Overall compatibility in [0,1].
     */
    public double score(JobFeatures job, FreelancerFeatures freelancer) {
        return evaluate(job, freelancer).score();
    }

    /**
     * Overall compatibility plus the sub-scores it was built from. The total is clamped to [0,1].
     */
    public ScoreResult evaluate(JobFeatures job, FreelancerFeatures freelancer) {
        double skills = skillSimilarity(job.skills(), freelancer.skills());
        double rate = budgetCompatibility(job.hourlyRate(), freelancer.hourlyRate());
        double experience = experienceCompatibility(job.experienceLevel(), freelancer.experienceLevel());
        double rating = freelancer.avgRating();

        double total = weights.getSkills() * skills
                + weights.getExperience() * experience
                + weights.getRate() * rate
                + weights.getRating() * rating;

        return new ScoreResult(Math.min(1.0, Math.max(0.0, total)), Map.of(
                "skills", skills,
                "experience", experience,
                "rate", rate,
                "rating", rating));
    }

    public double skillSimilarity(SkillVector jobSkills, SkillVector freelancerSkills) {
        return jobSkills.cosine(freelancerSkills);
    }

    public double budgetCompatibility(double jobRate, double freelancerRate) {
        return 1.0 - Math.abs(jobRate - freelancerRate);
    }

    public double experienceCompatibility(double jobLevel, double freelancerLevel) {
        if (freelancerLevel >= jobLevel) {
            return 1.0;
        }
        return jobLevel > 0 ? freelancerLevel / jobLevel : 0.0;
    }

    public Weights getWeights() {
        return weights;
    }
}
