/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.massrecal.recal;

import edu.umich.andykong.massrecal.core.MassTools;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a mass difference error map: pairs of observed peaks separated by one of the known
 * neutral increments, with the ppm deviation of the partner from its expected position.
 */
public class MassDifferenceMatcher {
    private static final Logger log = LoggerFactory.getLogger(MassDifferenceMatcher.class);

    private final MassDifferenceSet differences;
    private final double ppmTol;
    private final int intensityCap;

    public MassDifferenceMatcher(MassDifferenceSet differences, double ppmTol, int intensityCap) {
        this.differences = differences;
        this.ppmTol = ppmTol;
        this.intensityCap = intensityCap;
    }

    /**
     * Anchors are the intensityCap most intense peaks, partners are searched among all peaks.
     */
    public ErrorScatter match(PeakList spec) {
        double[] sorted = spec.getMasses();
        Arrays.sort(sorted);

        List<PeakRow> anchors = new ArrayList<>(spec.rows);
        anchors.sort(Comparator.comparingDouble((PeakRow r) -> r.intensity).reversed());
        if (anchors.size() > intensityCap)
            anchors = anchors.subList(0, intensityCap);
        double[] anchorMasses = new double[anchors.size()];
        for (int i = 0; i < anchorMasses.length; i++)
            anchorMasses[i] = anchors.get(i).mass;
        Arrays.sort(anchorMasses);

        ErrorScatter scatter = match(sorted, anchorMasses);
        log.debug("Mass difference map: {} observations from {} anchors and {} differences",
                scatter.size(), anchorMasses.length, differences.size());
        return scatter;
    }

    /**
     * @param sortedMasses all observed masses, ascending
     * @param anchorMasses masses to start each difference from
     */
    public ErrorScatter match(double[] sortedMasses, double[] anchorMasses) {
        ErrorScatter scatter = new ErrorScatter();
        if (sortedMasses.length == 0)
            return scatter;
        double[] diffs = differences.getDifferences();
        for (double mass : anchorMasses) {
            for (double d : diffs) {
                double mz = mass + d;
                int idx = MassTools.nearestIndex(sortedMasses, mz);
                double err = (sortedMasses[idx] - mz) / mz * 1e6;
                if (Math.abs(err) <= ppmTol)
                    scatter.add(mass, err);
            }
        }
        return scatter;
    }
}
