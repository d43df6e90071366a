package xyz.acevedosharp.des;

import weka.core.Instance;

import java.util.Arrays;

/**
 * Decides per query which pool members may earn competence (dynamic frienemy pruning).
 */
public interface PruningPolicy {

    boolean[] inclusionMask(Instance query) throws Exception;

    // pruning disabled, every member stays eligible
    static PruningPolicy none(int poolSize) {
        return query -> {
            boolean[] mask = new boolean[poolSize];
            Arrays.fill(mask, true);
            return mask;
        };
    }
}
