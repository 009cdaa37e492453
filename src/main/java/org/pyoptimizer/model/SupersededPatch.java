package org.pyoptimizer.model;

/**
 * A candidate patch dropped because it overlaps a patch of higher priority.
 */
public record SupersededPatch(Patch patch, Patch supersededBy) {
}
