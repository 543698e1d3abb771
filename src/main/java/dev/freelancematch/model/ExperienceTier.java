package dev.freelancematch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Experience tiers shared by freelancers and job requirements.
 * The ordinal drives experience compatibility scoring.
 */
public enum ExperienceTier {

    ENTRY("Entry", 1),
    INTERMEDIATE("Intermediate", 2),
    ADVANCED("Advanced", 3),
    EXPERT("Expert", 4);

    private static final double MAX_ORDINAL = 4.0;

    private final String label;
    private final int ordinalValue;

    ExperienceTier(String label, int ordinalValue) {
        this.label = label;
        this.ordinalValue = ordinalValue;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getOrdinalValue() {
        return ordinalValue;
    }

    /**
     * Ordinal value scaled into [0,1].
     */
    public double normalized() {
        return ordinalValue / MAX_ORDINAL;
    }

    /**
     * Derive the tier from years of experience.
     */
    public static ExperienceTier fromYears(int years) {
        if (years <= 2) {
            return ENTRY;
        }
        if (years <= 5) {
            return INTERMEDIATE;
        }
        if (years <= 10) {
            return ADVANCED;
        }
        return EXPERT;
    }

    /**
     * Parse a tier label. Unknown or blank labels fall back to {@link #INTERMEDIATE}.
     */
    @JsonCreator
    public static ExperienceTier fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return INTERMEDIATE;
        }
        String trimmed = label.trim();
        for (ExperienceTier tier : values()) {
            if (tier.label.equalsIgnoreCase(trimmed) || tier.name().equalsIgnoreCase(trimmed)) {
                return tier;
            }
        }
        return INTERMEDIATE;
    }
}
