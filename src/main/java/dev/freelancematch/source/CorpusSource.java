package dev.freelancematch.source;

import dev.freelancematch.model.Freelancer;

import java.util.List;

/**
 * Supplies the freelancer corpus, including each freelancer's engagement history.
 * Implementations never write back.
 */
public interface CorpusSource {

    /**
     * Get the name of this source (e.g., a file location).
     */
    String getName();

    /**
     * Load the full corpus. Each call returns a fresh, complete list.
     */
    List<Freelancer> loadFreelancers();
}
