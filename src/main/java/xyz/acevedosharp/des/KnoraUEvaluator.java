package xyz.acevedosharp.des;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;

public class KnoraUEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(KnoraUEvaluator.class);

    private KnoraUEvaluator() {}

    /**
     * @return percentage of misclassified instances of testSet
     */
    public static double measureErrorRate(Classifier classifier, Instances testSet) throws Exception {
        if (testSet.isEmpty())
            throw new IllegalArgumentException("Test set " + testSet.relationName() + " is empty");

        int mistakes = 0;
        for (Instance instance : testSet) {
            // double value of predicted class
            double prediction = classifier.classifyInstance(instance);

            if (prediction != instance.classValue())
                mistakes++;
        }

        double score = mistakes * 100.0 / testSet.numInstances();
        LOG.info("Error rate of {} on {}: {}", classifier, testSet.relationName(), score);
        return score;
    }
}
