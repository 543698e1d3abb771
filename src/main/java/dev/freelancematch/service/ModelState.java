package dev.freelancematch.service;

/**
 * Lifecycle of the matching model.
 */
public enum ModelState {
    UNTRAINED,
    TRAINING,
    TRAINED
}
