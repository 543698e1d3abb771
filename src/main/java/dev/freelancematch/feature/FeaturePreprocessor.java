package dev.freelancematch.feature;

import dev.freelancematch.model.Budget;
import dev.freelancematch.model.FixedBudget;
import dev.freelancematch.model.Freelancer;
import dev.freelancematch.model.HourlyBudget;
import dev.freelancematch.model.Job;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Turns freelancer and job records into comparable feature records.
 * <p>
 * The vocabulary and all three scalers are fitted on the same corpus. Calling {@link #fit}
 * again replaces every piece of state.
 */
@Slf4j
public class FeaturePreprocessor {

    /**
     * Normalised rate used for fixed-price jobs, which carry no hourly rate.
     */
    public static final double FIXED_BUDGET_RATE_PLACEHOLDER = 0.5;

    private final SkillVocabulary vocabulary = new SkillVocabulary();
    private final MinMaxScaler rateScaler = new MinMaxScaler("hourly_rate");
    private final MinMaxScaler experienceScaler = new MinMaxScaler("experience_years");
    private final MinMaxScaler ratingScaler = new MinMaxScaler("avg_rating");

    /**
     * Fit vocabulary and scalers on the freelancer corpus.
     *
     * @param freelancers non-empty corpus
     */
    public void fit(List<Freelancer> freelancers) {
        if (freelancers == null || freelancers.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit preprocessor on an empty corpus");
        }

        vocabulary.fit(freelancers.stream().map(Freelancer::getSkills).toList());
        rateScaler.fit(freelancers.stream().mapToDouble(Freelancer::getHourlyRate).toArray());
        experienceScaler.fit(freelancers.stream().mapToDouble(Freelancer::getExperienceYears).toArray());
        ratingScaler.fit(freelancers.stream().mapToDouble(Freelancer::getAvgRating).toArray());

        log.debug("Fitted preprocessor: {} skill terms, rate [{}, {}], years [{}, {}]",
                vocabulary.size(), rateScaler.getMin(), rateScaler.getMax(),
                experienceScaler.getMin(), experienceScaler.getMax());
    }

    public boolean isFitted() {
        return vocabulary.isFitted();
    }

    public FreelancerFeatures transformFreelancer(Freelancer freelancer) {
        requireFitted();
        return new FreelancerFeatures(
                vocabulary.transform(freelancer.getSkills()),
                rateScaler.transform(freelancer.getHourlyRate()),
                experienceScaler.transform(freelancer.getExperienceYears()),
                freelancer.effectiveTier().normalized(),
                ratingScaler.transform(freelancer.getAvgRating()));
    }

    /**
     * Transform a job. Hourly budgets use the scaled midpoint of the range; fixed budgets use
     * {@link #FIXED_BUDGET_RATE_PLACEHOLDER}.
     */
    public JobFeatures transformJob(Job job) {
        requireFitted();
        return new JobFeatures(
                vocabulary.transform(job.getSkillsRequired()),
                normalizedRate(job.getBudget()),
                job.requiredTier().normalized());
    }

    public List<String> skillTerms() {
        requireFitted();
        return vocabulary.terms();
    }

    public int vocabularySize() {
        requireFitted();
        return vocabulary.size();
    }

    private double normalizedRate(Budget budget) {
        if (budget instanceof HourlyBudget hourly) {
            return rateScaler.transform(hourly.midpoint());
        }
        if (budget instanceof FixedBudget) {
            return FIXED_BUDGET_RATE_PLACEHOLDER;
        }
        // unvalidated job without budget: neutral rate
        return FIXED_BUDGET_RATE_PLACEHOLDER;
    }

    private void requireFitted() {
        if (!isFitted()) {
            throw new NotFittedException("Preprocessor must be fitted before transform");
        }
    }
}
