package com.starscape.phototriage.features.classify.domain;

public record DecisionCount(Decision decision, String ruleName, long count) {}
