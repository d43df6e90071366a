package xyz.acevedosharp.des;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.core.Instances;
import weka.core.Utils;

import java.util.List;

public class KnoraUFactory {
    private static final Logger LOG = LoggerFactory.getLogger(KnoraUFactory.class);

    public static final int DEFAULT_K = 7;

    private KnoraUFactory() {}

    /**
     * Assembles KNORA-U around an already built pool, using dsel as the dynamic selection set.
     *
     * @param options Weka style options, {@code -K <int>} sets the size of the region of competence
     */
    public static KnoraU getEnsemble(List<Classifier> pool, Instances dsel, String[] options) throws Exception {
        long start = System.currentTimeMillis();

        String[] remaining = options.clone();
        String kOption = Utils.getOption('K', remaining);
        int k = kOption.isEmpty() ? DEFAULT_K : Integer.parseInt(kOption);
        Utils.checkForRemainingOptions(remaining);

        ProcessedDsel processedDsel = ProcessedDsel.compute(pool, dsel);
        NearestNeighbourRegion region = new NearestNeighbourRegion(dsel, k);
        KnoraU knoraU = new KnoraU(pool, processedDsel, region);

        LOG.info("Assembled {} with k={} over {} DSEL samples in {}ms", knoraU, region.getK(), dsel.numInstances(), System.currentTimeMillis() - start);
        return knoraU;
    }
}
