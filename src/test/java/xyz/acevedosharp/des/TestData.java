package xyz.acevedosharp.des;

import weka.classifiers.AbstractClassifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * One numeric attribute "x" and a nominal class {A, B, C}.
 */
final class TestData {
    static final double A = 0;
    static final double B = 1;
    static final double C = 2;

    private TestData() {}

    static Instances empty(String name) {
        ArrayList<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute("x"));
        attributes.add(new Attribute("class", Arrays.asList("A", "B", "C")));
        Instances instances = new Instances(name, attributes, 0);
        instances.setClassIndex(1);
        return instances;
    }

    // pairs of {x, class value}
    static Instances dataset(String name, double[]... rows) {
        Instances instances = empty(name);
        for (double[] row : rows) {
            instances.add(new DenseInstance(1.0, row.clone()));
        }
        return instances;
    }

    static Instance query(double x) {
        Instance query = new DenseInstance(1.0, new double[]{x, Utils.missingValue()});
        query.setDataset(empty("query"));
        return query;
    }

    /**
     * Always predicts the same label and counts how often it was asked.
     */
    static class FixedClassifier extends AbstractClassifier {
        private final double label;
        int calls;

        FixedClassifier(double label) {
            this.label = label;
        }

        @Override
        public void buildClassifier(Instances data) {
        }

        @Override
        public double classifyInstance(Instance instance) {
            calls++;
            return label;
        }
    }

    /**
     * Predicts A below the threshold and B from it on.
     */
    static class ThresholdClassifier extends AbstractClassifier {
        private final double threshold;

        ThresholdClassifier(double threshold) {
            this.threshold = threshold;
        }

        @Override
        public void buildClassifier(Instances data) {
        }

        @Override
        public double classifyInstance(Instance instance) {
            return instance.value(0) < threshold ? A : B;
        }
    }

    static class FailingClassifier extends AbstractClassifier {
        @Override
        public void buildClassifier(Instances data) {
        }

        @Override
        public double classifyInstance(Instance instance) throws Exception {
            throw new Exception("prediction failed");
        }
    }
}
