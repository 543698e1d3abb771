package dev.freelancematch.source;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.freelancematch.config.MatchingConfig;
import dev.freelancematch.model.ExperienceTier;
import dev.freelancematch.model.Freelancer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Corpus source backed by a JSON array of freelancer profiles.
 * Stated experience tiers that disagree with years of experience are replaced by the derived tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFileCorpusSource implements CorpusSource {

    private static final TypeReference<List<Freelancer>> FREELANCER_LIST = new TypeReference<>() {
    };

    private final JsonResourceReader reader;
    private final MatchingConfig matchingConfig;

    @Override
    public String getName() {
        return matchingConfig.getCorpusFile();
    }

    @Override
    public List<Freelancer> loadFreelancers() {
        List<Freelancer> freelancers = reader.readList(matchingConfig.getCorpusFile(), FREELANCER_LIST)
                .stream()
                .map(JsonFileCorpusSource::withConsistentTier)
                .toList();
        log.info("Loaded {} freelancers from {}", freelancers.size(), getName());
        return freelancers;
    }

    static Freelancer withConsistentTier(Freelancer freelancer) {
        ExperienceTier derived = freelancer.derivedTier();
        if (freelancer.getExperienceLevel() == derived) {
            return freelancer;
        }
        if (freelancer.getExperienceLevel() == null) {
            log.warn("Freelancer {} has no stated tier - using {} from {} years",
                    freelancer.getFreelancerId(), derived, freelancer.getExperienceYears());
        } else {
            log.warn("Freelancer {} states tier {} but has {} years - using {}",
                    freelancer.getFreelancerId(), freelancer.getExperienceLevel(),
                    freelancer.getExperienceYears(), derived);
        }
        return freelancer.toBuilder().experienceLevel(derived).build();
    }
}
