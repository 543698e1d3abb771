package dev.freelancematch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class FreelanceMatchApplication implements CommandLineRunner {

    private final MatchRunner matchRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(FreelanceMatchApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            int scored = matchRunner.execute();
            log.info("Freelance Match exiting after {} jobs", scored);
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Freelance Match failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
