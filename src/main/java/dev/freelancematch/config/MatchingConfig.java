package dev.freelancematch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for matching and ranking.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private int topN = 5;
    private boolean collaborativeEnabled = false;
    private double collaborativeWeight = 0.3;
    private String corpusFile = "file:data/freelancers.json";
    private String jobsFile;
    private Weights weights = new Weights();

    /**
     * Content score weights. Must add up to 1.0.
     */
    @Data
    public static class Weights {
        private double skills = 0.5;
        private double experience = 0.2;
        private double rate = 0.15;
        private double rating = 0.15;

        public double total() {
            return skills + experience + rate + rating;
        }
    }
}
