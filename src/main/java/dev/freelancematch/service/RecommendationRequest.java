package dev.freelancematch.service;

/**
 * Per-request options for job recommendations.
 *
 * @param clientId            client to personalise for; falls back to the job's client when null
 * @param useCollaborative    whether to blend in collaborative scores
 * @param collaborativeWeight blend weight in [0,1]; configured default when null
 * @param topN                result size; configured default when null
 */
public record RecommendationRequest(
        String clientId,
        boolean useCollaborative,
        Double collaborativeWeight,
        Integer topN) {

    public static RecommendationRequest contentOnly() {
        return new RecommendationRequest(null, false, null, null);
    }

    public static RecommendationRequest forClient(String clientId, double collaborativeWeight) {
        return new RecommendationRequest(clientId, true, collaborativeWeight, null);
    }
}
