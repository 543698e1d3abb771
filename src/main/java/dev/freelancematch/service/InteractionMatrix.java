package dev.freelancematch.service;

import dev.freelancematch.model.Engagement;
import dev.freelancematch.model.Freelancer;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeSet;

/**
 * Client by freelancer table of observed engagement ratings.
 * <p>
 * Rows and columns follow ascending client and freelancer ids. Cells without an engagement
 * hold {@link #MISSING}, so a rating of 0 stays distinguishable from "no interaction".
 * When a pair has several engagements the last one in engagement order wins.
 */
public final class InteractionMatrix {

    public static final double MISSING = Double.NaN;

    private final List<String> clientIds;
    private final List<String> freelancerIds;
    private final Map<String, Integer> clientIndex;
    private final Map<String, Integer> freelancerIndex;
    private final double[][] ratings;

    private InteractionMatrix(List<String> clientIds, List<String> freelancerIds, double[][] ratings) {
        this.clientIds = clientIds;
        this.freelancerIds = freelancerIds;
        this.clientIndex = indexOf(clientIds);
        this.freelancerIndex = indexOf(freelancerIds);
        this.ratings = ratings;
    }

    public static InteractionMatrix build(List<Freelancer> freelancers) {
        TreeSet<String> freelancerIdSet = new TreeSet<>();
        TreeSet<String> clientIdSet = new TreeSet<>();
        for (Freelancer freelancer : freelancers) {
            freelancerIdSet.add(freelancer.getFreelancerId());
            for (Engagement engagement : freelancer.getPastProjects()) {
                clientIdSet.add(engagement.clientId());
            }
        }

        List<String> clients = List.copyOf(clientIdSet);
        List<String> columns = List.copyOf(freelancerIdSet);
        Map<String, Integer> rows = indexOf(clients);
        Map<String, Integer> cols = indexOf(columns);

        double[][] matrix = new double[clients.size()][columns.size()];
        for (double[] row : matrix) {
            Arrays.fill(row, MISSING);
        }
        for (Freelancer freelancer : freelancers) {
            int col = cols.get(freelancer.getFreelancerId());
            for (Engagement engagement : freelancer.getPastProjects()) {
                matrix[rows.get(engagement.clientId())][col] = engagement.rating();
            }
        }
        return new InteractionMatrix(clients, columns, matrix);
    }

    public int clientCount() {
        return clientIds.size();
    }

    public int freelancerCount() {
        return freelancerIds.size();
    }

    public OptionalInt clientIndex(String clientId) {
        Integer idx = clientId != null ? clientIndex.get(clientId) : null;
        return idx != null ? OptionalInt.of(idx) : OptionalInt.empty();
    }

    public OptionalInt freelancerIndex(String freelancerId) {
        Integer idx = freelancerId != null ? freelancerIndex.get(freelancerId) : null;
        return idx != null ? OptionalInt.of(idx) : OptionalInt.empty();
    }

    public String clientId(int row) {
        return clientIds.get(row);
    }

    public String freelancerId(int col) {
        return freelancerIds.get(col);
    }

    public List<String> clientIds() {
        return clientIds;
    }

    public List<String> freelancerIds() {
        return freelancerIds;
    }

    /**
     * Observed rating, or {@link #MISSING}.
     */
    public double rating(int row, int col) {
        return ratings[row][col];
    }

    public boolean isObserved(int row, int col) {
        return !Double.isNaN(ratings[row][col]);
    }

    public int observedCount(int row) {
        int count = 0;
        for (double value : ratings[row]) {
            if (!Double.isNaN(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Copy of a row with missing cells as 0, for similarity arithmetic.
     */
    public double[] denseRow(int row) {
        double[] copy = new double[ratings[row].length];
        for (int i = 0; i < copy.length; i++) {
            double value = ratings[row][i];
            copy[i] = Double.isNaN(value) ? 0.0 : value;
        }
        return copy;
    }

    private static Map<String, Integer> indexOf(List<String> ids) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        return Collections.unmodifiableMap(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InteractionMatrix that)) {
            return false;
        }
        return clientIds.equals(that.clientIds)
                && freelancerIds.equals(that.freelancerIds)
                && Arrays.deepEquals(ratings, that.ratings);
    }

    @Override
    public int hashCode() {
        int result = clientIds.hashCode();
        result = 31 * result + freelancerIds.hashCode();
        return 31 * result + Arrays.deepHashCode(ratings);
    }

    @Override
    public String toString() {
        return "InteractionMatrix{" + clientIds.size() + " clients x " + freelancerIds.size() + " freelancers}";
    }
}
