package com.hartwig.hpcwe.submission;

import java.util.List;

import com.hartwig.hpcwe.model.Resources;

/**
 * Pending runs of one task pass, laid out as action rows by element columns. A cell holds an index into
 * {@link #resources()} and the ID of the run, or {@link #NO_RUN} in both arrays where nothing is pending.
 */
public final class ResourceMap {
    public static final int NO_RUN = -1;

    private final List<Resources> resources;
    private final int[][] resourceIndices;
    private final int[][] runIds;

    public ResourceMap(final List<Resources> resources, final int[][] resourceIndices, final int[][] runIds) {
        this.resources = List.copyOf(resources);
        this.resourceIndices = resourceIndices;
        this.runIds = runIds;
    }

    public List<Resources> resources() {
        return resources;
    }

    public int[][] resourceIndices() {
        return resourceIndices;
    }

    public int[][] runIds() {
        return runIds;
    }

    public int numActions() {
        return resourceIndices.length;
    }

    public int numElements() {
        return resourceIndices.length == 0 ? 0 : resourceIndices[0].length;
    }
}
