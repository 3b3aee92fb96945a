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

/**
 * Applies an error curve as a piecewise constant correction. The curve's mass range is cut
 * into size() half-open bins (a[i], a[i+1]]; every peak inside bin i is shifted by ppm[i].
 * Peaks at or below the lowest curve mass, or above the highest, are left as they are.
 */
public class SpectrumCorrector {
    private static final Logger log = LoggerFactory.getLogger(SpectrumCorrector.class);

    private final ErrorCurve curve;
    private final double[] edges;

    public SpectrumCorrector(ErrorCurve curve) {
        this.curve = curve;
        this.edges = MassTools.linspace(curve.getMinMass(), curve.getMaxMass(), curve.size() + 1);
    }

    /**
     * Bin index for a mass, -1 when outside (min, max].
     */
    public int binOf(double mass) {
        if (!(mass > edges[0]) || mass > edges[edges.length - 1])
            return -1;
        int idx = MassTools.searchSortedLeft(edges, mass);
        // edges[idx - 1] < mass <= edges[idx]
        return idx - 1;
    }

    /**
     * Returns a corrected copy; spec is not modified. Bins are chosen from the uncorrected mass
     * so each peak is shifted at most once.
     */
    public PeakList apply(PeakList spec) {
        PeakList out = spec.copy();
        int corrected = 0;
        for (PeakRow r : out.rows) {
            int bin = binOf(r.mass);
            if (bin < 0)
                continue;
            r.mass = r.mass + r.mass * curve.getPpm(bin) / 1000000;
            r.calcError();
            corrected++;
        }
        log.debug("Corrected {} of {} peaks", corrected, out.size());
        return out;
    }

    public double[] getEdges() {
        return edges.clone();
    }
}
