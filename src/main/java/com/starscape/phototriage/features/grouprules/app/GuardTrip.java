package com.starscape.phototriage.features.grouprules.app;

/**
 * A rejection the engine refused because it would have emptied the group.
 */
public record GuardTrip(String groupId, String photoId, String ruleName) {}
