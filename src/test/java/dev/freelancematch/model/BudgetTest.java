package dev.freelancematch.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetTest {

    @Nested
    @DisplayName("Hourly budget")
    class HourlyBudgetTests {

        @Test
        void shouldAcceptWellFormedRange() {
            assertThatCode(() -> new HourlyBudget(20.0, 40.0).validate()).doesNotThrowAnyException();
            assertThat(new HourlyBudget(20.0, 40.0).midpoint()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("Absent bounds default to 0 and unbounded")
        void shouldDefaultAbsentBounds() {
            HourlyBudget noMin = new HourlyBudget(null, 40.0);
            HourlyBudget noMax = new HourlyBudget(20.0, null);

            assertThatCode(noMin::validate).doesNotThrowAnyException();
            assertThatCode(noMax::validate).doesNotThrowAnyException();
            assertThat(noMin.midpoint()).isEqualTo(20.0);
            assertThat(noMax.effectiveMax()).isInfinite();
            assertThat(noMax.midpoint()).isInfinite();
        }

        @Test
        void shouldRejectInvertedRange() {
            assertThatThrownBy(() -> new HourlyBudget(50.0, 10.0).validate())
                    .isInstanceOf(MalformedBudgetException.class)
                    .hasMessageContaining("exceeds");
        }

        @Test
        void shouldRejectMissingBothBounds() {
            assertThatThrownBy(() -> new HourlyBudget(null, null).validate())
                    .isInstanceOf(MalformedBudgetException.class);
        }

        @Test
        void shouldRejectNegativeOrNaNBounds() {
            assertThatThrownBy(() -> new HourlyBudget(-1.0, 10.0).validate())
                    .isInstanceOf(MalformedBudgetException.class);
            assertThatThrownBy(() -> new HourlyBudget(5.0, Double.NaN).validate())
                    .isInstanceOf(MalformedBudgetException.class);
        }
    }

    @Nested
    @DisplayName("Fixed budget")
    class FixedBudgetTests {

        @Test
        void shouldAcceptAmount() {
            assertThatCode(() -> new FixedBudget(1500.0).validate()).doesNotThrowAnyException();
        }

        @Test
        void shouldRejectMissingOrNegativeAmount() {
            assertThatThrownBy(() -> new FixedBudget(null).validate())
                    .isInstanceOf(MalformedBudgetException.class);
            assertThatThrownBy(() -> new FixedBudget(-10.0).validate())
                    .isInstanceOf(MalformedBudgetException.class);
        }
    }

    @Nested
    @DisplayName("Job budget validation")
    class JobBudgetTests {

        @Test
        void shouldRejectJobWithoutBudget() {
            Job job = Job.builder().title("No budget").skillRequired("Python").build();

            assertThatThrownBy(job::validateBudget)
                    .isInstanceOf(MalformedBudgetException.class)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no budget");
        }
    }

    @Nested
    @DisplayName("JSON mapping")
    class JsonMappingTests {

        private final ObjectMapper objectMapper = new ObjectMapper();

        @Test
        void shouldReadHourlyJob() throws Exception {
            String json = """
                    {
                      "title": "Dashboard",
                      "skills_required": ["Python", "React"],
                      "budget": {"type": "hourly", "min_rate": 20.0, "max_rate": 40.0},
                      "experience_level": "Advanced",
                      "timeline_days": 30,
                      "unknown_field": true
                    }
                    """;

            Job job = objectMapper.readValue(json, Job.class);

            assertThat(job.getSkillsRequired()).containsExactly("Python", "React");
            assertThat(job.getBudget()).isEqualTo(new HourlyBudget(20.0, 40.0));
            assertThat(job.getExperienceLevel()).isEqualTo(ExperienceTier.ADVANCED);
            assertThat(job.getTimelineDays()).isEqualTo(30);
        }

        @Test
        void shouldReadFixedJobWithUnknownLevel() throws Exception {
            String json = """
                    {
                      "title": "Logo",
                      "skills_required": ["Figma"],
                      "budget": {"type": "fixed", "amount": 800.0},
                      "experience_level": "Wizard"
                    }
                    """;

            Job job = objectMapper.readValue(json, Job.class);

            assertThat(job.getBudget()).isEqualTo(new FixedBudget(800.0));
            assertThat(job.getExperienceLevel()).isEqualTo(ExperienceTier.INTERMEDIATE);
        }
    }
}
