package xyz.acevedosharp.des;

import weka.core.EuclideanDistance;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Linear k-NN search over the DSEL. Attribute ranges are normalised on the DSEL
 * and the class attribute is left out of the distance.
 */
public class NearestNeighbourRegion implements RegionOfCompetence {
    private final Instances dsel;
    private final int k;
    private final EuclideanDistance distanceFunction;

    public NearestNeighbourRegion(Instances dsel, int k) throws Exception {
        if (k < 1)
            throw new IllegalArgumentException("k must be positive, got " + k);
        if (dsel.isEmpty())
            throw new IllegalArgumentException("DSEL " + dsel.relationName() + " is empty");

        this.dsel = new Instances(dsel);
        this.k = k;
        this.distanceFunction = new EuclideanDistance(this.dsel);
        // build the attribute ranges now, distance() would otherwise do it lazily on the first queries
        this.distanceFunction.getRanges();
    }

    @Override
    public CompetenceRegion getRegionOfCompetence(Instance query) {
        if (query.numAttributes() != dsel.numAttributes())
            throw new IllegalArgumentException("Query has " + query.numAttributes() + " attributes, DSEL has " + dsel.numAttributes());

        List<double[]> candidates = new ArrayList<>(dsel.numInstances()); // {distance, row}
        for (int row = 0; row < dsel.numInstances(); row++) {
            candidates.add(new double[]{distanceFunction.distance(query, dsel.instance(row)), row});
        }
        // stable sort keeps lower rows first on equal distance
        candidates.sort(Comparator.comparingDouble(candidate -> candidate[0]));

        int size = Math.min(k, candidates.size());
        int[] indices = new int[size];
        double[] distances = new double[size];
        for (int i = 0; i < size; i++) {
            distances[i] = candidates.get(i)[0];
            indices[i] = (int) candidates.get(i)[1];
        }
        return new CompetenceRegion(indices, distances);
    }

    public int getK() {
        return k;
    }
}
