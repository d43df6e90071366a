package xyz.acevedosharp.des;

import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;

import java.util.List;

/**
 * Which pool member got which DSEL sample right: rows are samples, columns are classifiers,
 * a cell holds 1 for a correct prediction and 0 otherwise.
 */
public final class ProcessedDsel {
    private final int[][] hits;
    private final int numClassifiers;

    private ProcessedDsel(int[][] hits, int numClassifiers) {
        this.hits = hits;
        this.numClassifiers = numClassifiers;
    }

    public static ProcessedDsel of(int[][] table, int numClassifiers) {
        int[][] copy = new int[table.length][];
        for (int row = 0; row < table.length; row++) {
            if (table[row].length != numClassifiers)
                throw new IllegalArgumentException("Row " + row + " has " + table[row].length + " columns, expected " + numClassifiers);
            for (int cell : table[row]) {
                if (cell != 0 && cell != 1)
                    throw new IllegalArgumentException("Row " + row + " holds " + cell + ", only 0 and 1 are allowed");
            }
            copy[row] = table[row].clone();
        }
        return new ProcessedDsel(copy, numClassifiers);
    }

    /**
     * Runs every (already built) pool member over the labelled DSEL once.
     */
    public static ProcessedDsel compute(List<Classifier> pool, Instances dsel) throws Exception {
        if (dsel.classIndex() < 0)
            throw new IllegalArgumentException("DSEL " + dsel.relationName() + " has no class attribute set");

        int[][] table = new int[dsel.numInstances()][pool.size()];
        for (int row = 0; row < dsel.numInstances(); row++) {
            Instance sample = dsel.instance(row);
            for (int clf = 0; clf < pool.size(); clf++) {
                if (pool.get(clf).classifyInstance(sample) == sample.classValue())
                    table[row][clf] = 1;
            }
        }
        return new ProcessedDsel(table, pool.size());
    }

    public int get(int sample, int classifier) {
        return hits[sample][classifier];
    }

    public int numSamples() {
        return hits.length;
    }

    public int numClassifiers() {
        return numClassifiers;
    }
}
