package xyz.acevedosharp.des;

import java.util.Arrays;

/**
 * Nearest DSEL rows of a query, nearest first.
 */
public final class CompetenceRegion {
    private final int[] indices;
    private final double[] distances;

    public CompetenceRegion(int[] indices, double[] distances) {
        if (indices.length != distances.length)
            throw new IllegalArgumentException("Got " + indices.length + " neighbours but " + distances.length + " distances");
        this.indices = indices.clone();
        this.distances = distances.clone();
    }

    public int[] getIndices() {
        return indices.clone();
    }

    public double[] getDistances() {
        return distances.clone();
    }

    public int size() {
        return indices.length;
    }

    @Override
    public String toString() {
        return "CompetenceRegion" + Arrays.toString(indices);
    }
}
