package xyz.acevedosharp.des;

import org.junit.Test;
import weka.classifiers.Classifier;
import weka.core.Instances;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;
import static xyz.acevedosharp.des.TestData.*;

public class KnoraUFactoryTest {
    // A around 0, B around 10
    private static final Instances DSEL = dataset("dsel",
            new double[]{0, A},
            new double[]{0.5, A},
            new double[]{1, A},
            new double[]{9, B},
            new double[]{9.5, B},
            new double[]{10, B}
    );

    private static List<Classifier> pool() {
        return Arrays.asList(new FixedClassifier(A), new FixedClassifier(B), new FixedClassifier(C));
    }

    @Test
    public void localExpertWinsItsRegion() throws Exception {
        KnoraU knoraU = KnoraUFactory.getEnsemble(pool(), DSEL, new String[]{"-K", "3"});

        assertArrayEquals(new int[]{3, 0, 0}, knoraU.estimateCompetence(query(0.2)));
        assertEquals(A, knoraU.classifyInstance(query(0.2)), 0.0);
        assertArrayEquals(new int[]{0, 3, 0}, knoraU.estimateCompetence(query(9.8)));
        assertEquals(B, knoraU.classifyInstance(query(9.8)), 0.0);
    }

    @Test
    public void defaultRegionSpansSevenNeighbours() throws Exception {
        KnoraU knoraU = KnoraUFactory.getEnsemble(pool(), DSEL, new String[0]);

        // only six DSEL samples, all of them are neighbours
        assertArrayEquals(new int[]{3, 3, 0}, knoraU.estimateCompetence(query(0.2)));
        assertEquals(A, knoraU.classifyInstance(query(0.2)), 0.0);
    }

    @Test
    public void rejectsUnknownOptions() {
        assertThrows(Exception.class, () -> KnoraUFactory.getEnsemble(pool(), DSEL, new String[]{"-Z", "1"}));
    }
}
