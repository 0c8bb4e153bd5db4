package com.starscape.phototriage.features.classify.app;

import java.util.Map;

/**
 * Outcome of one classification pass. {@code byRule} counts only decisions made in this pass.
 */
public record ClassificationSummary(
    int examined,
    int rejected,
    int separated,
    int accepted,
    Map<String, Integer> byRule
) {
    public ClassificationSummary {
        byRule = Map.copyOf(byRule);
    }
}
