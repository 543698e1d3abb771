package dev.freelancematch.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Predicts a client's affinity for freelancers it has not worked with, from the ratings of the
 * most similar other clients.
 */
@Slf4j
@Service
public class CollaborativeFilteringService {

    /**
     * Number of similar clients consulted per prediction.
     */
    public static final int NEIGHBORHOOD_SIZE = 5;

    /**
     * Predicted rating for one freelancer.
     *
     * @param predictedRating similarity-weighted rating on the 0-5 scale
     */
    public record AffinityPrediction(String freelancerId, double predictedRating) {

        public double matchScore() {
            return predictedRating / 5 * 100;
        }
    }

    private record Neighbor(int row, double similarity) {
    }

    /**
     * Rank freelancers the client has not rated by predicted rating.
     *
     * @return at most {@code topN} predictions; empty for unknown clients or clients without
     *         observed interactions
     */
    public List<AffinityPrediction> predictForClient(InteractionMatrix matrix, String clientId, int topN) {
        OptionalInt clientRow = matrix.clientIndex(clientId);
        if (clientRow.isEmpty()) {
            log.debug("Client {} not found in interaction history", clientId);
            return List.of();
        }
        int row = clientRow.getAsInt();
        if (matrix.observedCount(row) == 0) {
            log.debug("Client {} has no recorded interactions", clientId);
            return List.of();
        }

        List<Neighbor> neighbors = nearestNeighbors(matrix, row);
        List<double[]> neighborRows = neighbors.stream()
                .map(n -> matrix.denseRow(n.row()))
                .toList();

        List<AffinityPrediction> predictions = new ArrayList<>();
        for (int col = 0; col < matrix.freelancerCount(); col++) {
            if (matrix.isObserved(row, col)) {
                continue;
            }
            double weighted = 0.0;
            double totalWeight = 0.0;
            for (int k = 0; k < neighbors.size(); k++) {
                double similarity = neighbors.get(k).similarity();
                weighted += similarity * neighborRows.get(k)[col];
                totalWeight += similarity;
            }
            if (totalWeight == 0.0) {
                continue;
            }
            double predicted = weighted / totalWeight;
            if (predicted > 0) {
                predictions.add(new AffinityPrediction(matrix.freelancerId(col), predicted));
            }
        }

        List<AffinityPrediction> ranked = predictions.stream()
                .sorted(Comparator.comparingDouble(AffinityPrediction::predictedRating).reversed()
                        .thenComparing(AffinityPrediction::freelancerId))
                .limit(Math.max(topN, 0))
                .toList();

        log.debug("Client {}: {} neighbours, {} candidate predictions, returning {}",
                clientId, neighbors.size(), predictions.size(), ranked.size());
        return ranked;
    }

    private List<Neighbor> nearestNeighbors(InteractionMatrix matrix, int row) {
        double[] target = matrix.denseRow(row);
        List<Neighbor> others = new ArrayList<>();
        for (int other = 0; other < matrix.clientCount(); other++) {
            if (other != row) {
                others.add(new Neighbor(other, cosine(target, matrix.denseRow(other))));
            }
        }
        return others.stream()
                .sorted(Comparator.comparingDouble(Neighbor::similarity).reversed()
                        .thenComparingInt(Neighbor::row))
                .limit(NEIGHBORHOOD_SIZE)
                .toList();
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
