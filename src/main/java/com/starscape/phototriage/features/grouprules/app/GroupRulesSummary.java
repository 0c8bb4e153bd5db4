package com.starscape.phototriage.features.grouprules.app;

import java.util.List;
import java.util.Map;

public record GroupRulesSummary(
    int groups,
    int rejections,
    int aggregatedPaths,
    Map<String, Integer> byRule,
    List<GuardTrip> guardTrips
) {
    public GroupRulesSummary {
        byRule = Map.copyOf(byRule);
        guardTrips = List.copyOf(guardTrips);
    }
}
