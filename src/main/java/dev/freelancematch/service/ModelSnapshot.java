package dev.freelancematch.service;

import dev.freelancematch.feature.FeaturePreprocessor;
import dev.freelancematch.feature.FreelancerFeatures;
import dev.freelancematch.feature.JobFeatures;
import dev.freelancematch.model.ExperienceTier;
import dev.freelancematch.model.Freelancer;
import dev.freelancematch.model.Job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one training run derives from the corpus: fitted preprocessor, per-freelancer
 * features and the interaction matrix. Never modified after construction.
 */
public final class ModelSnapshot {

    private final FeaturePreprocessor preprocessor;
    private final List<Freelancer> freelancers;
    private final List<FreelancerFeatures> features;
    private final Map<String, Freelancer> freelancersById;
    private final InteractionMatrix interactions;

    private ModelSnapshot(FeaturePreprocessor preprocessor, List<Freelancer> freelancers,
            List<FreelancerFeatures> features, Map<String, Freelancer> freelancersById,
            InteractionMatrix interactions) {
        this.preprocessor = preprocessor;
        this.freelancers = freelancers;
        this.features = features;
        this.freelancersById = freelancersById;
        this.interactions = interactions;
    }

    /**
     * Fit a fresh preprocessor on the corpus and derive all model state from it.
     */
    public static ModelSnapshot build(List<Freelancer> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            throw new IllegalArgumentException("Cannot train on an empty freelancer corpus");
        }

        Map<String, Freelancer> byId = new LinkedHashMap<>();
        for (Freelancer freelancer : corpus) {
            if (byId.putIfAbsent(freelancer.getFreelancerId(), freelancer) != null) {
                throw new IllegalArgumentException("Duplicate freelancer id: " + freelancer.getFreelancerId());
            }
        }

        FeaturePreprocessor preprocessor = new FeaturePreprocessor();
        preprocessor.fit(corpus);

        List<FreelancerFeatures> features = new ArrayList<>(corpus.size());
        for (Freelancer freelancer : corpus) {
            features.add(preprocessor.transformFreelancer(freelancer));
        }

        return new ModelSnapshot(
                preprocessor,
                List.copyOf(corpus),
                Collections.unmodifiableList(features),
                Collections.unmodifiableMap(byId),
                InteractionMatrix.build(corpus));
    }

    public JobFeatures transformJob(Job job) {
        return preprocessor.transformJob(job);
    }

    public List<Freelancer> freelancers() {
        return freelancers;
    }

    /**
     * Features aligned index-for-index with {@link #freelancers()}.
     */
    public List<FreelancerFeatures> features() {
        return features;
    }

    public InteractionMatrix interactions() {
        return interactions;
    }

    public List<String> skillTerms() {
        return preprocessor.skillTerms();
    }

    public int vocabularySize() {
        return preprocessor.vocabularySize();
    }

    public int size() {
        return freelancers.size();
    }

    public Optional<Freelancer> findFreelancer(String freelancerId) {
        return Optional.ofNullable(freelancersById.get(freelancerId));
    }

    public List<Freelancer> freelancersWithSkill(String skill) {
        return freelancers.stream()
                .filter(f -> f.hasSkill(skill))
                .toList();
    }

    public List<Freelancer> freelancersWithTier(ExperienceTier tier) {
        return freelancers.stream()
                .filter(f -> f.effectiveTier() == tier)
                .toList();
    }

    /**
     * Freelancers whose hourly rate lies in the inclusive range.
     */
    public List<Freelancer> freelancersInRateRange(double minRate, double maxRate) {
        return freelancers.stream()
                .filter(f -> f.getHourlyRate() >= minRate && f.getHourlyRate() <= maxRate)
                .toList();
    }
}
