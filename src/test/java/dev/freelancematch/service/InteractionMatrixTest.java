package dev.freelancematch.service;

import dev.freelancematch.model.Freelancer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.freelancematch.fixtures.TestFixtures.collaborativeCorpus;
import static dev.freelancematch.fixtures.TestFixtures.engagement;
import static dev.freelancematch.fixtures.TestFixtures.freelancer;
import static dev.freelancematch.fixtures.TestFixtures.withEngagements;
import static org.assertj.core.api.Assertions.assertThat;

class InteractionMatrixTest {

    @Test
    void shouldIndexClientsAndFreelancersInSortedOrder() {
        List<Freelancer> corpus = List.of(
                withEngagements(freelancer("F9", 30, 3, 4, "Go"), engagement("Z", 4)),
                withEngagements(freelancer("F1", 30, 3, 4, "Go"), engagement("M", 3), engagement("A", 5)));

        InteractionMatrix matrix = InteractionMatrix.build(corpus);

        assertThat(matrix.clientIds()).containsExactly("A", "M", "Z");
        assertThat(matrix.freelancerIds()).containsExactly("F1", "F9");
        assertThat(matrix.clientIndex("M")).hasValue(1);
        assertThat(matrix.freelancerIndex("F9")).hasValue(1);
        assertThat(matrix.clientIndex("unknown")).isEmpty();
        assertThat(matrix.clientIndex(null)).isEmpty();
    }

    @Test
    @DisplayName("Missing interactions are distinct from a zero rating")
    void missingIsDistinctFromZeroRating() {
        InteractionMatrix matrix = InteractionMatrix.build(collaborativeCorpus());
        int clientD = matrix.clientIndex("D").getAsInt();
        int f1 = matrix.freelancerIndex("F1").getAsInt();
        int f2 = matrix.freelancerIndex("F2").getAsInt();

        assertThat(matrix.isObserved(clientD, f1)).isTrue();
        assertThat(matrix.rating(clientD, f1)).isZero();
        assertThat(matrix.isObserved(clientD, f2)).isFalse();
        assertThat(matrix.rating(clientD, f2)).isNaN();
        assertThat(matrix.observedCount(clientD)).isEqualTo(1);
        assertThat(matrix.denseRow(clientD)).containsOnly(0.0);
    }

    @Test
    @DisplayName("The last engagement for a pair wins")
    void lastEngagementWins() {
        Freelancer freelancer = withEngagements(freelancer("F1", 30, 3, 4, "Go"),
                engagement("A", 2), engagement("A", 5));

        InteractionMatrix matrix = InteractionMatrix.build(List.of(freelancer));

        assertThat(matrix.rating(0, 0)).isEqualTo(5.0);
    }

    @Test
    void freelancersWithoutEngagementsStillGetAColumn() {
        List<Freelancer> corpus = List.of(
                withEngagements(freelancer("F1", 30, 3, 4, "Go"), engagement("A", 4)),
                freelancer("F2", 30, 3, 4, "Go"));

        InteractionMatrix matrix = InteractionMatrix.build(corpus);

        assertThat(matrix.freelancerCount()).isEqualTo(2);
        assertThat(matrix.isObserved(0, 1)).isFalse();
    }

    @Test
    @DisplayName("Rebuilding from the same corpus gives an identical matrix")
    void rebuildIsIdentical() {
        InteractionMatrix first = InteractionMatrix.build(collaborativeCorpus());
        InteractionMatrix second = InteractionMatrix.build(collaborativeCorpus());

        assertThat(second).isEqualTo(first).hasSameHashCodeAs(first);
    }
}
