package com.starscape.phototriage.features.classify.app;

import com.starscape.phototriage.features.classify.domain.Decision;

public record Classification(Decision decision, String ruleName) {}
