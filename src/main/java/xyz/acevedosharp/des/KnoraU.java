package xyz.acevedosharp.des;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.Classifier;
import weka.core.Capabilities;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.*;

/**
 * k-Nearest Oracles Union (KNORA-U).
 *
 * <p>Every pool member that got at least one sample of the region of competence right takes part in the vote,
 * with as many votes as samples it got right. Members left out by the pruning policy earn no competence.
 * When nobody earns any, the whole pool votes once each.
 *
 * <p>Ko, Sabourin and Britto, "From dynamic classifier selection to dynamic ensemble selection",
 * Pattern Recognition 41.5 (2008).
 */
public class KnoraU implements Classifier, DynamicSelection {
    private static final Logger LOG = LoggerFactory.getLogger(KnoraU.class);

    private final List<Classifier> classifiers;
    private final ProcessedDsel processedDsel;
    private final RegionOfCompetence regionOfCompetence;
    private final PruningPolicy pruningPolicy;

    // Only use already built classifiers
    public KnoraU(List<Classifier> classifiers, ProcessedDsel processedDsel, RegionOfCompetence regionOfCompetence, PruningPolicy pruningPolicy) {
        if (classifiers.isEmpty())
            throw new IllegalArgumentException("The pool of classifiers is empty");
        if (processedDsel.numClassifiers() != classifiers.size())
            throw new IllegalArgumentException("Processed DSEL covers " + processedDsel.numClassifiers() + " classifiers, pool has " + classifiers.size());

        this.classifiers = List.copyOf(classifiers);
        this.processedDsel = processedDsel;
        this.regionOfCompetence = regionOfCompetence;
        this.pruningPolicy = pruningPolicy;
    }

    public KnoraU(List<Classifier> classifiers, ProcessedDsel processedDsel, RegionOfCompetence regionOfCompetence) {
        this(classifiers, processedDsel, regionOfCompetence, PruningPolicy.none(classifiers.size()));
    }

    @Override
    public int[] estimateCompetence(Instance query) throws Exception {
        int[] neighbours = regionOfCompetence.getRegionOfCompetence(query).getIndices();
        boolean[] mask = pruningPolicy.inclusionMask(query);
        if (mask.length != classifiers.size())
            throw new IllegalStateException("Inclusion mask has " + mask.length + " entries, pool has " + classifiers.size());

        int[] competences = new int[classifiers.size()];
        for (int clf = 0; clf < classifiers.size(); clf++) {
            if (!mask[clf])
                continue;
            for (int neighbour : neighbours) {
                competences[clf] += processedDsel.get(neighbour, clf);
            }
        }

        LOG.debug("Competences {} over region {}", competences, neighbours);
        return competences;
    }

    // each member votes its own prediction as many times as its competence
    @Override
    public double[] select(Instance query) throws Exception {
        int[] weights = estimateCompetence(query);

        // no member was selected, hence use all of them
        if (Arrays.stream(weights).allMatch(weight -> weight == 0)) {
            LOG.debug("No competent classifier for the query, falling back to the whole pool");
            Arrays.fill(weights, 1);
        }

        double[] votes = new double[Arrays.stream(weights).sum()];
        int next = 0;
        for (int clf = 0; clf < classifiers.size(); clf++) {
            double prediction = classifiers.get(clf).classifyInstance(query);
            for (int vote = 0; vote < weights[clf]; vote++) {
                votes[next++] = prediction;
            }
        }
        return votes;
    }

    // on equal counts the label voted first, i.e. by the earlier pool member, wins
    @Override
    public double classifyInstance(Instance query) throws Exception {
        Map<Double, Integer> tally = tally(select(query));

        Double ensemblePrediction = null;
        int best = 0;
        for (Map.Entry<Double, Integer> entry : tally.entrySet()) {
            if (entry.getValue() > best) {
                ensemblePrediction = entry.getKey();
                best = entry.getValue();
            }
        }
        LOG.debug("Votes {} -> {}", tally, ensemblePrediction);
        return ensemblePrediction;
    }

    // share of the votes each class value received
    @Override
    public double[] distributionForInstance(Instance query) throws Exception {
        double[] votes = select(query);
        double[] distribution = new double[query.numClasses()];
        for (Map.Entry<Double, Integer> entry : tally(votes).entrySet()) {
            double label = entry.getKey();
            if (Utils.isMissingValue(label) || label != Math.rint(label) || label < 0 || label >= distribution.length)
                throw new IllegalStateException("Vote for class value " + label + " is not one of " + distribution.length + " classes");
            distribution[(int) label] = entry.getValue() / (double) votes.length;
        }
        return distribution;
    }

    // the pool is built beforehand, see KnoraUFactory
    @Override
    public void buildClassifier(Instances data) {
        throw new UnsupportedOperationException("KNORA-U only combines already built classifiers");
    }

    // only what every pool member handles
    @Override
    public Capabilities getCapabilities() {
        Capabilities result = (Capabilities) classifiers.get(0).getCapabilities().clone();
        for (int clf = 1; clf < classifiers.size(); clf++) {
            result.and(classifiers.get(clf).getCapabilities());
        }
        return result;
    }

    public List<Classifier> getClassifiers() {
        return classifiers;
    }

    // insertion order keeps the first voted label ahead on ties
    private static Map<Double, Integer> tally(double[] votes) {
        Map<Double, Integer> tally = new LinkedHashMap<>();
        for (double vote : votes) {
            tally.merge(vote, 1, Integer::sum);
        }
        return tally;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("KNORA-U: ");

        classifiers.forEach(
                classifier -> sb
                        .append(classifier.getClass().getName())
                        .append(", ")
        );

        sb.setLength(sb.length() - 2);
        return sb.toString();
    }
}
