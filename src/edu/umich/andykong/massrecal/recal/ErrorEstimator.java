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

import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;
import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * The three ways of estimating a mass error curve: from assignment residuals, from the mass
 * difference map of the spectrum itself, and from matches against an etalon spectrum.
 */
public class ErrorEstimator {
    private static final Logger log = LoggerFactory.getLogger(ErrorEstimator.class);

    private final RecalParams params;
    private final DensityMapBuilder densityMapBuilder;
    private final RidgeExtractor ridgeExtractor;
    private final DiagnosticWriter diagnostics;

    public ErrorEstimator(RecalParams params) {
        this(params, null, false);
    }

    /**
     * @param executorService parallelises density evaluation, may be null
     * @param draw            write diagnostic tables for every fitted curve
     */
    public ErrorEstimator(RecalParams params, ExecutorService executorService, boolean draw) {
        this.params = params;
        this.densityMapBuilder = new DensityMapBuilder(params.gridSize, executorService);
        this.ridgeExtractor = new RidgeExtractor(params.ridgeQuantile, params.smoothWindow, params.smoothOrder);
        this.diagnostics = draw ? new DiagnosticWriter(params.diagnosticsPath) : null;
    }

    /**
     * Assigned copy of spec.
     */
    public PeakList assignSpectrum(PeakList spec) {
        PeakList assigned = spec.assign(params.ppmTolerance, params.elementBounds, params.ionMode).calcError();
        int n = assigned.countAssigned();
        if (n == 0)
            throw new AssignmentUnavailableException(String.format("No peak could be assigned within %s ppm for %s",
                    params.ppmTolerance, params.elementBounds));
        log.info("Assigned {} of {} peaks", n, assigned.size());
        return assigned;
    }

    /**
     * (mass, -relative error) of every assigned row, so that applying the curve cancels the error.
     */
    public ErrorScatter assignScatter(PeakList assigned) {
        ErrorScatter scatter = new ErrorScatter();
        for (PeakRow r : assigned.rows) {
            if (!r.isAssigned() || Double.isNaN(r.relError))
                continue;
            scatter.add(r.mass, -r.relError);
        }
        if (scatter.isEmpty())
            throw new AssignmentUnavailableException("Spectrum has no assigned peaks");
        return scatter;
    }

    public ErrorScatter massDiffScatter(PeakList spec) {
        MassDifferenceMatcher matcher = new MassDifferenceMatcher(new MassDifferenceSet(params.maxMultiplier),
                params.ppmTolerance, params.intensityCap);
        return matcher.match(spec);
    }

    /**
     * Matches the intense peaks of spec against the etalon by linear scan. When several etalon
     * peaks fall inside the window the last one wins; peaks without a partner are skipped.
     */
    public ErrorScatter etalonScatter(PeakList spec, PeakList etalon) {
        PeakList intense = spec.filterByIntensityQuantile(params.etalonQuantile);
        double[] reference = etalon.getMasses();
        ErrorScatter scatter = new ErrorScatter();
        for (PeakRow r : intense.rows) {
            double lo = r.mass * (1 - params.ppmTolerance / 1000000);
            double hi = r.mass * (1 + params.ppmTolerance / 1000000);
            double match = Double.NaN;
            for (double m : reference) {
                if (m > lo && m < hi)
                    match = m;
            }
            if (Double.isNaN(match))
                continue;
            scatter.add(r.mass, (match - r.mass) / r.mass * 1000000);
        }
        log.info("Matched {} of {} intense peaks to the etalon", scatter.size(), intense.size());
        return scatter;
    }

    /**
     * Density map and ridge of the scatter, placed on the mass range of axisMasses.
     */
    public ErrorCurve fitCurve(ErrorScatter scatter, double[] axisMasses, String label) {
        if (scatter.isEmpty())
            throw new InsufficientDataException("No " + label + " observations to fit an error curve");
        DensityGrid grid = densityMapBuilder.build(scatter, params.ppmWindow);
        ErrorCurve curve = ridgeExtractor.extract(grid, axisMasses);
        if (diagnostics != null) {
            diagnostics.write(label, scatter, grid, curve);
            curve.show();
        }
        return curve;
    }

    /**
     * Curve from assignment residuals, extrapolated to the full range of spec and zero shifted.
     */
    public ErrorCurve assignError(PeakList spec) {
        PeakList assigned = assignSpectrum(spec);
        return assignCurve(assigned).extrapolate(spec.getMinMass(), spec.getMaxMass(), params.gridSize).zeroshift(assigned);
    }

    /**
     * Raw curve over the assigned mass range of an already assigned spectrum.
     */
    public ErrorCurve assignCurve(PeakList assigned) {
        return fitCurve(assignScatter(assigned), assigned.dropUnassigned().getMasses(), "assign");
    }

    /**
     * Self calibration by mass difference map (Smirnov et al., Anal. Chem. 2019, 91, 3350).
     * Not extrapolated or zero shifted.
     */
    public ErrorCurve massdiffError(PeakList spec) {
        return fitCurve(massDiffScatter(spec), spec.getMasses(), "mdm");
    }

    /**
     * Curve from an etalon spectrum. Not extrapolated or zero shifted.
     */
    public ErrorCurve etalonError(PeakList spec, PeakList etalon) {
        return fitCurve(etalonScatter(spec, etalon), spec.getMasses(), "etalon");
    }

    public RecalParams getParams() {
        return params;
    }
}
