package xyz.acevedosharp.des;

import weka.core.Instance;

public interface RegionOfCompetence {

    // returned indices must be valid rows of the ProcessedDsel in use
    CompetenceRegion getRegionOfCompetence(Instance query) throws Exception;
}
