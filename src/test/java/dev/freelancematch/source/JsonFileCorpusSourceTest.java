package dev.freelancematch.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.freelancematch.config.MatchingConfig;
import dev.freelancematch.model.Engagement;
import dev.freelancematch.model.ExperienceTier;
import dev.freelancematch.model.Freelancer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dev.freelancematch.fixtures.TestFixtures.freelancer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class JsonFileCorpusSourceTest {

    private MatchingConfig config;
    private JsonFileCorpusSource source;

    @BeforeEach
    void setUp() {
        config = new MatchingConfig();
        config.setCorpusFile("classpath:data/test-freelancers.json");
        JsonResourceReader reader = new JsonResourceReader(new ObjectMapper(), new DefaultResourceLoader());
        source = new JsonFileCorpusSource(reader, config);
    }

    @Nested
    @DisplayName("Loading the corpus")
    class LoadingTests {

        @Test
        void shouldLoadAllFreelancers() {
            List<Freelancer> corpus = source.loadFreelancers();

            assertThat(corpus).extracting(Freelancer::getFreelancerId)
                    .containsExactly("F0001", "F0002", "F0003", "F0004", "F0005", "F0006");
            assertThat(source.getName()).isEqualTo("classpath:data/test-freelancers.json");
        }

        @Test
        void shouldMapSnakeCaseFieldsAndEngagements() {
            Freelancer alice = source.loadFreelancers().get(0);

            assertThat(alice.getName()).isEqualTo("Alice Moreau");
            assertThat(alice.getSkills()).containsExactly("Python", "SQL");
            assertThat(alice.getHourlyRate()).isEqualTo(30.0);
            assertThat(alice.getExperienceLevel()).isEqualTo(ExperienceTier.INTERMEDIATE);
            assertThat(alice.getPastProjects())
                    .extracting(Engagement::clientId, Engagement::rating)
                    .containsExactly(
                            tuple("C001", 5),
                            tuple("C002", 4));
        }

        @Test
        @DisplayName("A stated tier that contradicts the years is replaced by the derived tier")
        void shouldCorrectInconsistentTier() {
            Freelancer frank = source.loadFreelancers().get(5);

            assertThat(frank.getExperienceYears()).isEqualTo(3);
            assertThat(frank.getExperienceLevel()).isEqualTo(ExperienceTier.INTERMEDIATE);
        }
    }

    @Nested
    @ExtendWith(OutputCaptureExtension.class)
    @DisplayName("Tier consistency")
    class TierConsistencyTests {

        @Test
        void consistentRecordIsReturnedAsIs() {
            Freelancer consistent = freelancer("F1", 30, 7, 4, "Go");

            assertThat(JsonFileCorpusSource.withConsistentTier(consistent)).isSameAs(consistent);
        }

        @Test
        void missingTierIsDerived(CapturedOutput output) {
            Freelancer untiered = freelancer("F1", 30, 11, 4, "Go").toBuilder()
                    .experienceLevel(null)
                    .build();

            assertThat(JsonFileCorpusSource.withConsistentTier(untiered).getExperienceLevel())
                    .isEqualTo(ExperienceTier.EXPERT);
            assertThat(output).contains("Freelancer F1 has no stated tier - using EXPERT from 11 years")
                    .doesNotContain("states tier null");
        }

        @Test
        void contradictingTierIsReported(CapturedOutput output) {
            Freelancer overstated = freelancer("F1", 30, 3, 4, "Go").toBuilder()
                    .experienceLevel(ExperienceTier.EXPERT)
                    .build();

            assertThat(JsonFileCorpusSource.withConsistentTier(overstated).getExperienceLevel())
                    .isEqualTo(ExperienceTier.INTERMEDIATE);
            assertThat(output).contains("Freelancer F1 states tier EXPERT but has 3 years - using INTERMEDIATE");
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @TempDir
        Path tempDir;

        @Test
        void missingFileFails() {
            config.setCorpusFile("classpath:data/does-not-exist.json");

            assertThatThrownBy(() -> source.loadFreelancers())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Resource not found");
        }

        @Test
        void malformedJsonFails() throws IOException {
            Path file = tempDir.resolve("broken.json");
            Files.writeString(file, "[{\"freelancer_id\": ");
            config.setCorpusFile(file.toUri().toString());

            assertThatThrownBy(() -> source.loadFreelancers())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Could not read");
        }

        @Test
        @DisplayName("An engagement rating outside [0,5] rejects the corpus")
        void outOfRangeRatingFails() throws IOException {
            Path file = tempDir.resolve("bad-rating.json");
            Files.writeString(file, """
                    [{"freelancer_id": "F1", "name": "X", "skills": ["Go"], "hourly_rate": 10,
                      "experience_years": 1, "avg_rating": 4.0,
                      "past_projects": [{"project_id": "P1", "client_id": "C1", "rating": 7}]}]
                    """);
            config.setCorpusFile(file.toUri().toString());

            assertThatThrownBy(() -> source.loadFreelancers())
                    .isInstanceOf(IllegalStateException.class)
                    .hasRootCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("A fractional engagement rating is rejected, not truncated")
        void fractionalRatingFails() throws IOException {
            Path file = tempDir.resolve("fractional-rating.json");
            Files.writeString(file, """
                    [{"freelancer_id": "F1", "name": "X", "skills": ["Go"], "hourly_rate": 10,
                      "experience_years": 1, "avg_rating": 4.0,
                      "past_projects": [{"project_id": "P1", "client_id": "C1", "rating": 4.7}]}]
                    """);
            config.setCorpusFile(file.toUri().toString());

            assertThatThrownBy(() -> source.loadFreelancers())
                    .isInstanceOf(IllegalStateException.class)
                    .hasRootCauseMessage("Engagement P1 rating 4.7 is not a whole number");
        }
    }
}
