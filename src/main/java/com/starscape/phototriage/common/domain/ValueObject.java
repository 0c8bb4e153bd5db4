package com.starscape.phototriage.common.domain;

/**
 * Marker for immutable value types compared by their fields.
 */
public interface ValueObject {
}
