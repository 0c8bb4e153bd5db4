package com.starscape.phototriage.features.classify.app;

/**
 * Answers whether a file exists next to a photo's source location.
 */
@FunctionalInterface
public interface SiblingFileProbe {
    boolean exists(String path);
}
