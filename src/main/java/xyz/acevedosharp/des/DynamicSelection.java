package xyz.acevedosharp.des;

import weka.core.Instance;

/**
 * Operations shared by dynamic ensemble selection strategies.
 */
public interface DynamicSelection {

    // one competence level per pool member, in pool order
    int[] estimateCompetence(Instance query) throws Exception;

    double[] select(Instance query) throws Exception;

    double classifyInstance(Instance query) throws Exception;
}
