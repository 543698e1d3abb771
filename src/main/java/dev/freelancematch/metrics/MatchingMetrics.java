package dev.freelancematch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for model training and recommendation requests.
 */
@Component
public class MatchingMetrics {

    private final Counter trainingsCounter;
    private final Counter recommendationsCounter;
    private final Counter clientRecommendationsCounter;
    private final Counter blendsCounter;
    private final Counter fallbacksCounter;
    private final Timer trainingTimer;

    private final AtomicInteger corpusSize = new AtomicInteger(0);
    private final AtomicInteger vocabularySize = new AtomicInteger(0);
    private final AtomicInteger clientCount = new AtomicInteger(0);

    public MatchingMetrics(MeterRegistry registry) {
        this.trainingsCounter = Counter.builder("freelance_match_trainings_total")
                .description("Completed model trainings")
                .register(registry);

        this.recommendationsCounter = Counter.builder("freelance_match_recommendations_total")
                .description("Job recommendation requests served")
                .register(registry);

        this.clientRecommendationsCounter = Counter.builder("freelance_match_client_recommendations_total")
                .description("Collaborative recommendation requests served")
                .register(registry);

        this.blendsCounter = Counter.builder("freelance_match_collaborative_blends_total")
                .description("Rankings re-ranked with collaborative scores")
                .register(registry);

        this.fallbacksCounter = Counter.builder("freelance_match_collaborative_fallbacks_total")
                .description("Blend requests that fell back to content-only ranking")
                .register(registry);

        this.trainingTimer = Timer.builder("freelance_match_training_duration")
                .description("Time to rebuild the matching model")
                .register(registry);

        Gauge.builder("freelance_match_corpus_size", corpusSize, AtomicInteger::get)
                .description("Freelancers in the trained corpus")
                .register(registry);

        Gauge.builder("freelance_match_vocabulary_size", vocabularySize, AtomicInteger::get)
                .description("Skill terms in the fitted vocabulary")
                .register(registry);

        Gauge.builder("freelance_match_client_count", clientCount, AtomicInteger::get)
                .description("Clients in the interaction matrix")
                .register(registry);
    }

    /**
     * Record a completed training and the size of what it produced.
     */
    public void recordTraining(Timer.Sample sample, int freelancers, int vocabulary, int clients) {
        sample.stop(trainingTimer);
        trainingsCounter.increment();
        corpusSize.set(freelancers);
        vocabularySize.set(vocabulary);
        clientCount.set(clients);
    }

    public void recordRecommendation() {
        recommendationsCounter.increment();
    }

    public void recordClientRecommendation() {
        clientRecommendationsCounter.increment();
    }

    public void recordBlend() {
        blendsCounter.increment();
    }

    public void recordFallback() {
        fallbacksCounter.increment();
    }
}
