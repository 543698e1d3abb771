package dev.freelancematch.service;

import dev.freelancematch.metrics.MatchingMetrics;
import dev.freelancematch.model.Freelancer;
import dev.freelancematch.model.Recommendation;
import dev.freelancematch.service.CollaborativeFilteringService.AffinityPrediction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Re-ranks a content-based list with collaborative affinities for a client.
 * <p>
 * A freelancer missing from one of the two lists scores 0 on that side. The result keeps the
 * length of the content list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridBlender {

    /**
     * Collaborative candidates fetched per blend.
     */
    public static final int COLLABORATIVE_CANDIDATES = 5;

    private final CollaborativeFilteringService collaborativeFilteringService;
    private final MatchingMetrics metrics;

    private record Blended(String freelancerId, double score) {
    }

    /**
     * Blend a content ranking with the client's collaborative predictions.
     *
     * @param collaborativeWeight weight of the collaborative score, in [0,1]
     * @return the content list itself when the client has no collaborative predictions
     */
    public List<Recommendation> blend(ModelSnapshot snapshot, String clientId,
            List<Recommendation> contentRanked, double collaborativeWeight) {
        requireWeight(collaborativeWeight);

        List<AffinityPrediction> predictions = collaborativeFilteringService
                .predictForClient(snapshot.interactions(), clientId, COLLABORATIVE_CANDIDATES);
        if (predictions.isEmpty()) {
            log.debug("No collaborative predictions for client {} - keeping content ranking", clientId);
            metrics.recordFallback();
            return contentRanked;
        }

        List<Recommendation> blended = combine(snapshot, predictions, contentRanked, collaborativeWeight);
        metrics.recordBlend();
        return blended;
    }

    /**
     * Combine already computed predictions with a content ranking.
     */
    public List<Recommendation> combine(ModelSnapshot snapshot, List<AffinityPrediction> predictions,
            List<Recommendation> contentRanked, double collaborativeWeight) {
        requireWeight(collaborativeWeight);
        if (predictions.isEmpty()) {
            return contentRanked;
        }

        Map<String, Double> contentScores = new HashMap<>();
        for (Recommendation recommendation : contentRanked) {
            contentScores.put(recommendation.freelancerId(), recommendation.matchScore());
        }
        Map<String, Double> collaborativeScores = new HashMap<>();
        for (AffinityPrediction prediction : predictions) {
            collaborativeScores.put(prediction.freelancerId(), prediction.matchScore());
        }

        Set<String> candidates = new LinkedHashSet<>(contentScores.keySet());
        candidates.addAll(collaborativeScores.keySet());

        List<Blended> scored = new ArrayList<>(candidates.size());
        for (String freelancerId : candidates) {
            double content = contentScores.getOrDefault(freelancerId, 0.0);
            double collaborative = collaborativeScores.getOrDefault(freelancerId, 0.0);
            scored.add(new Blended(freelancerId,
                    (1 - collaborativeWeight) * content + collaborativeWeight * collaborative));
        }

        List<Blended> top = scored.stream()
                .sorted(Comparator.comparingDouble(Blended::score).reversed()
                        .thenComparing(Blended::freelancerId))
                .limit(contentRanked.size())
                .toList();

        List<Recommendation> result = new ArrayList<>(top.size());
        for (Blended entry : top) {
            Optional<Freelancer> freelancer = snapshot.findFreelancer(entry.freelancerId());
            if (freelancer.isEmpty()) {
                log.warn("Blended candidate {} is not in the trained corpus - skipping", entry.freelancerId());
                continue;
            }
            result.add(Recommendation.of(result.size() + 1, freelancer.get(), entry.score()));
        }
        return result;
    }

    private static void requireWeight(double collaborativeWeight) {
        if (Double.isNaN(collaborativeWeight) || collaborativeWeight < 0 || collaborativeWeight > 1) {
            throw new IllegalArgumentException("Collaborative weight must be within [0,1]: " + collaborativeWeight);
        }
    }
}
