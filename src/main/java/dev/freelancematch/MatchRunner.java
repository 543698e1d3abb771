package dev.freelancematch;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.freelancematch.config.MatchingConfig;
import dev.freelancematch.model.Job;
import dev.freelancematch.model.Recommendation;
import dev.freelancematch.service.ModelSnapshot;
import dev.freelancematch.service.RecommendationRequest;
import dev.freelancematch.service.RecommendationService;
import dev.freelancematch.source.JsonResourceReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Trains the model and scores the configured job postings.
 * Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchRunner {

  private static final String SEPARATOR = "========================================";
  private static final TypeReference<List<Job>> JOB_LIST = new TypeReference<>() {
  };

  private final RecommendationService recommendationService;
  private final JsonResourceReader jsonResourceReader;
  private final MatchingConfig matchingConfig;

  /**
   * Train, then rank freelancers for every job in {@code matching.jobs-file}.
   *
   * @return Number of jobs scored
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Freelance Match Starting");
    log.info(SEPARATOR);

    try {
      ModelSnapshot snapshot = recommendationService.train();
      log.info("Corpus: {} freelancers, {} skill terms, {} clients",
          snapshot.size(), snapshot.vocabularySize(), snapshot.interactions().clientCount());

      String jobsFile = matchingConfig.getJobsFile();
      if (jobsFile == null || jobsFile.isBlank()) {
        log.info("No jobs file configured - model trained, nothing to score");
        return 0;
      }

      List<Job> jobs = jsonResourceReader.readList(jobsFile, JOB_LIST);
      for (Job job : jobs) {
        List<Recommendation> recommendations = recommendationService.recommend(job, requestFor(job));
        logRecommendations(job, recommendations);
      }

      log.info(SEPARATOR);
      log.info("Freelance Match Completed Successfully");
      log.info("Jobs scored: {}", jobs.size());
      log.info(SEPARATOR);
      return jobs.size();
    } catch (Exception e) {
      log.error("Freelance Match failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Matching run failed", e);
    }
  }

  private RecommendationRequest requestFor(Job job) {
    return new RecommendationRequest(
        job.getClientId(),
        matchingConfig.isCollaborativeEnabled(),
        matchingConfig.getCollaborativeWeight(),
        matchingConfig.getTopN());
  }

  private void logRecommendations(Job job, List<Recommendation> recommendations) {
    log.info("Job '{}' ({}): {} matches", job.getTitle(), job.getJobId(), recommendations.size());
    for (Recommendation rec : recommendations) {
      log.info("  #{} {} {} - {}% (rate {}, {}, rating {})",
          rec.rank(), rec.freelancerId(), rec.name(),
          String.format("%.2f", rec.matchScore()),
          rec.hourlyRate(), rec.experienceLevel().getLabel(), rec.avgRating());
    }
  }
}
