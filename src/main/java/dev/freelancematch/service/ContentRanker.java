package dev.freelancematch.service;

import dev.freelancematch.feature.FreelancerFeatures;
import dev.freelancematch.feature.JobFeatures;
import dev.freelancematch.model.Freelancer;
import dev.freelancematch.model.Recommendation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores every freelancer in a snapshot against a job and keeps the best.
 * Ties are broken by freelancer id, so the ranking does not depend on corpus order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentRanker {

    private final ContentScorer contentScorer;

    record ScoredFreelancer(Freelancer freelancer, double score) {
    }

    static final Comparator<ScoredFreelancer> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(ScoredFreelancer::score).reversed()
                    .thenComparing(s -> s.freelancer().getFreelancerId());

    /**
     * Rank freelancers for a transformed job.
     *
     * @return at most {@code topN} recommendations with 0-100 match scores, ranked from 1
     */
    public List<Recommendation> rank(JobFeatures job, ModelSnapshot snapshot, int topN) {
        List<Freelancer> freelancers = snapshot.freelancers();
        List<FreelancerFeatures> features = snapshot.features();

        List<ScoredFreelancer> scored = new ArrayList<>(freelancers.size());
        for (int i = 0; i < freelancers.size(); i++) {
            scored.add(new ScoredFreelancer(freelancers.get(i), contentScorer.score(job, features.get(i))));
        }

        List<ScoredFreelancer> top = scored.stream()
                .sorted(BY_SCORE_THEN_ID)
                .limit(Math.max(topN, 0))
                .toList();

        List<Recommendation> recommendations = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            ScoredFreelancer match = top.get(i);
            recommendations.add(Recommendation.of(i + 1, match.freelancer(), match.score() * 100));
            log.debug("#{} {} scored {}", i + 1, match.freelancer().getFreelancerId(), match.score());
        }
        return recommendations;
    }
}
