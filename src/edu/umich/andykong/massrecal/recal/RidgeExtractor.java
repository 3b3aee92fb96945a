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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows the high density ridge of a {@link DensityGrid} and turns it into an error curve.
 */
public class RidgeExtractor {
    private static final Logger log = LoggerFactory.getLogger(RidgeExtractor.class);

    private final double quantile;
    private final SavitzkyGolayFilter filter;

    public RidgeExtractor(double quantile, int smoothWindow, int smoothOrder) {
        this.quantile = quantile;
        this.filter = new SavitzkyGolayFilter(smoothWindow, smoothOrder);
    }

    /**
     * Per column mean ppm of the cells strictly above the column's density quantile. A flat
     * column has no such cell, the cells at the column maximum are used instead.
     */
    public double[] ridge(DensityGrid grid) {
        double[] out = new double[grid.columns()];
        for (int c = 0; c < grid.columns(); c++) {
            double[] col = grid.column(c);
            double threshold = MassTools.quantile(col, quantile);
            double sum = 0;
            int n = 0;
            for (int r = 0; r < col.length; r++) {
                if (col[r] > threshold) {
                    sum += grid.ppmAt(r);
                    n++;
                }
            }
            if (n == 0) {
                double max = MassTools.max(col);
                for (int r = 0; r < col.length; r++) {
                    if (col[r] == max) {
                        sum += grid.ppmAt(r);
                        n++;
                    }
                }
            }
            out[c] = sum / n;
        }
        return out;
    }

    /**
     * @param masses masses spanning the physical axis of the curve
     */
    public ErrorCurve extract(DensityGrid grid, double[] masses) {
        double xmin = MassTools.min(masses);
        double xmax = MassTools.max(masses);
        InvalidRangeException.check(xmin, xmax, "curve mass");

        double[] ppm = filter.smooth(ridge(grid));
        double[] axis = MassTools.linspace(xmin, xmax, ppm.length);

        // pin the lowest mass to zero correction
        double first = ppm[0];
        for (int i = 0; i < ppm.length; i++)
            ppm[i] -= first;

        log.debug("Ridge curve over [{}, {}] Da, ppm range [{}, {}]", xmin, xmax, MassTools.min(ppm), MassTools.max(ppm));
        return new ErrorCurve(axis, ppm);
    }
}
