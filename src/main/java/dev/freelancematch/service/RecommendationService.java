package dev.freelancematch.service;

import dev.freelancematch.config.MatchingConfig;
import dev.freelancematch.feature.JobFeatures;
import dev.freelancematch.metrics.MatchingMetrics;
import dev.freelancematch.model.ClientRecommendation;
import dev.freelancematch.model.Job;
import dev.freelancematch.model.Recommendation;
import dev.freelancematch.service.CollaborativeFilteringService.AffinityPrediction;
import dev.freelancematch.source.CorpusSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for matching: trains the model from the corpus source and serves job and
 * client recommendations from the current snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final MatchingModel matchingModel;
    private final CorpusSource corpusSource;
    private final ContentRanker contentRanker;
    private final HybridBlender hybridBlender;
    private final CollaborativeFilteringService collaborativeFilteringService;
    private final MatchingConfig matchingConfig;
    private final MatchingMetrics metrics;

    /**
     * Reload the corpus and rebuild the model.
     */
    public ModelSnapshot train() {
        log.info("Training matching model from {}", corpusSource.getName());
        return matchingModel.train(corpusSource.loadFreelancers());
    }

    /**
     * Current snapshot, training synchronously first when the model is untrained.
     */
    public ModelSnapshot ensureTrained() {
        return matchingModel.trainIfUntrained(() -> {
            log.info("Matching model is untrained - training from {} before serving", corpusSource.getName());
            return corpusSource.loadFreelancers();
        });
    }

    public List<Recommendation> recommend(Job job) {
        return recommend(job, RecommendationRequest.contentOnly());
    }

    /**
     * Rank freelancers for a job, optionally re-ranked for the requesting client.
     *
     * @throws dev.freelancematch.model.MalformedBudgetException if the job budget is invalid
     */
    public List<Recommendation> recommend(Job job, RecommendationRequest request) {
        job.validateBudget();
        ModelSnapshot snapshot = ensureTrained();

        int topN = request.topN() != null ? request.topN() : matchingConfig.getTopN();
        JobFeatures jobFeatures = snapshot.transformJob(job);
        List<Recommendation> recommendations = contentRanker.rank(jobFeatures, snapshot, topN);
        metrics.recordRecommendation();

        String clientId = request.clientId() != null ? request.clientId() : job.getClientId();
        if (request.useCollaborative() && clientId != null) {
            double weight = request.collaborativeWeight() != null
                    ? request.collaborativeWeight()
                    : matchingConfig.getCollaborativeWeight();
            recommendations = hybridBlender.blend(snapshot, clientId, recommendations, weight);
        }

        log.debug("Job '{}': {} recommendations", job.getTitle(), recommendations.size());
        return recommendations;
    }

    /**
     * Collaborative recommendations for a client, based on its hiring history only.
     *
     * @return empty when the client is unknown or has no history
     */
    public List<ClientRecommendation> recommendForClient(String clientId, int topN) {
        ModelSnapshot snapshot = ensureTrained();
        List<AffinityPrediction> predictions =
                collaborativeFilteringService.predictForClient(snapshot.interactions(), clientId, topN);
        metrics.recordClientRecommendation();

        List<ClientRecommendation> recommendations = new ArrayList<>(predictions.size());
        for (AffinityPrediction prediction : predictions) {
            snapshot.findFreelancer(prediction.freelancerId()).ifPresent(freelancer ->
                    recommendations.add(ClientRecommendation.of(recommendations.size() + 1, freelancer,
                            prediction.predictedRating(), prediction.matchScore())));
        }
        return recommendations;
    }

    /**
     * Skill terms known to the fitted vocabulary.
     */
    public List<String> supportedSkills() {
        return ensureTrained().skillTerms();
    }
}
