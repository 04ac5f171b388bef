package com.tradesignal.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One bounded vote produced by the factor scorer.
 *
 * <p>Invariant: {@code -maxAbs <= value <= maxAbs}. The compact constructor clamps rather
 * than rejects, so a mis-tuned rule can never push a factor past its declared weight.
 */
public record Factor(
    @JsonProperty("name") String name,
    @JsonProperty("value") double value,
    @JsonProperty("maxAbs") double maxAbs,
    @JsonProperty("label") String label
) {
    public Factor {
        value = Math.max(-maxAbs, Math.min(maxAbs, value));
    }

    public static Factor of(String name, double value, double maxAbs, String label) {
        return new Factor(name, value, maxAbs, label);
    }
}
