package com.starscape.phototriage.features.grouprules.domain;

public record RuleCount(String ruleName, long count) {}
