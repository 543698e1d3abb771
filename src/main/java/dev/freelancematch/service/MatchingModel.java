package dev.freelancematch.service;

import dev.freelancematch.feature.NotFittedException;
import dev.freelancematch.metrics.MatchingMetrics;
import dev.freelancematch.model.Freelancer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of the trained model state.
 * <p>
 * Training builds a complete {@link ModelSnapshot} under an exclusive lock and publishes it in
 * one step, so readers see either the previous snapshot or the new one. Reads never train:
 * callers must handle the untrained state themselves.
 */
@Slf4j
@Component
public class MatchingModel {

    private final MatchingMetrics metrics;
    private final ReentrantLock trainLock = new ReentrantLock();

    private volatile ModelSnapshot snapshot;
    private volatile ModelState state = ModelState.UNTRAINED;

    public MatchingModel(MatchingMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Rebuild all model state from the corpus.
     *
     * @return the newly published snapshot
     */
    public ModelSnapshot train(List<Freelancer> corpus) {
        trainLock.lock();
        try {
            state = ModelState.TRAINING;
            Timer.Sample sample = Timer.start();
            ModelSnapshot built;
            try {
                built = ModelSnapshot.build(corpus);
            } catch (RuntimeException e) {
                state = (snapshot != null) ? ModelState.TRAINED : ModelState.UNTRAINED;
                log.error("Model training failed: {}", e.getMessage());
                throw e;
            }
            snapshot = built;
            state = ModelState.TRAINED;
            metrics.recordTraining(sample, built.size(), built.vocabularySize(),
                    built.interactions().clientCount());

            log.info("Trained matching model on {} freelancers ({} skill terms, {} clients)",
                    built.size(), built.vocabularySize(), built.interactions().clientCount());
            return built;
        } finally {
            trainLock.unlock();
        }
    }

    /**
     * Train from the supplied corpus unless a snapshot already exists. Concurrent first callers
     * wait for one training instead of each loading the corpus.
     *
     * @return the existing or newly trained snapshot
     */
    public ModelSnapshot trainIfUntrained(Supplier<List<Freelancer>> corpus) {
        ModelSnapshot current = snapshot;
        if (current != null) {
            return current;
        }
        trainLock.lock();
        try {
            current = snapshot;
            return (current != null) ? current : train(corpus.get());
        } finally {
            trainLock.unlock();
        }
    }

    /**
     * Current snapshot.
     *
     * @throws NotFittedException if the model has never been trained
     */
    public ModelSnapshot snapshot() {
        ModelSnapshot current = snapshot;
        if (current == null) {
            throw new NotFittedException("Matching model has not been trained");
        }
        return current;
    }

    public boolean isTrained() {
        return snapshot != null;
    }

    public ModelState state() {
        return state;
    }
}
