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
import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Recalibration entry point. Estimates an error curve when none is given, optionally
 * extrapolates and zero shifts it, and applies it to a copy of the spectrum.
 */
public class Recalibrator {
    private static final Logger log = LoggerFactory.getLogger(Recalibrator.class);

    public static final String HOW_ASSIGN = "assign";
    public static final String HOW_MDM = "mdm";
    public static final String metadataKey = "recalibrate";

    private final RecalParams params;

    public Recalibrator(RecalParams params) {
        this.params = params;
    }

    public Recalibrator() {
        this(RecalParams.defaults());
    }

    public PeakList recalibrate(@NotNull PeakList spec) {
        return recalibrate(spec, null, HOW_ASSIGN, false);
    }

    /**
     * @param errorCurve precomputed curve, applied as is when not null
     * @param how        "assign", "mdm" or the path of an etalon peak list
     * @param draw       write diagnostic tables; does not change the result
     */
    public PeakList recalibrate(@NotNull PeakList spec, @Nullable ErrorCurve errorCurve, @NotNull String how, boolean draw) {
        PeakList work = spec.copy();
        if (errorCurve == null)
            errorCurve = estimate(work, how, draw);

        PeakList out = new SpectrumCorrector(errorCurve).apply(work);
        out.metadata.add(Collections.singletonMap(metadataKey, how));
        log.info("Recalibrated {} peaks ({})", out.size(), how);
        return out;
    }

    /**
     * Runs the selected strategy followed by the extrapolation and zero shift stages.
     */
    public ErrorCurve estimate(@NotNull PeakList spec, @NotNull String how, boolean draw) {
        ExecutorService executorService = params.threads > 1 ? Executors.newFixedThreadPool(params.threads) : null;
        try {
            ErrorEstimator estimator = new ErrorEstimator(params, executorService, draw);
            PeakList assigned = null;
            ErrorCurve curve;
            boolean defaultStages;
            if (how.equals(HOW_ASSIGN)) {
                if (params.extrapolate.resolve(true) && params.zeroshift.resolve(true))
                    return estimator.assignError(spec);
                assigned = estimator.assignSpectrum(spec);
                curve = estimator.assignCurve(assigned);
                defaultStages = true;
            } else if (how.equals(HOW_MDM)) {
                curve = estimator.massdiffError(spec);
                defaultStages = false;
            } else {
                curve = estimator.etalonError(spec, loadEtalon(how, params.csvSep));
                defaultStages = false;
            }

            if (params.extrapolate.resolve(defaultStages))
                curve = curve.extrapolate(spec.getMinMass(), spec.getMaxMass(), params.gridSize);
            if (params.zeroshift.resolve(defaultStages)) {
                if (assigned == null)
                    assigned = spec.countAssigned() > 0 ? spec : estimator.assignSpectrum(spec);
                curve = curve.zeroshift(assigned);
            }
            return curve;
        } finally {
            if (executorService != null)
                executorService.shutdown();
        }
    }

    public static PeakList loadEtalon(String path, String sep) {
        File f = new File(path);
        if (!f.isFile())
            throw new ReferenceLoadException("Etalon spectrum not found: " + path, null);
        try {
            PeakList etalon = PeakList.readCsv(f, sep);
            if (etalon.size() == 0)
                throw new ReferenceLoadException("Etalon spectrum has no peaks: " + path, null);
            return etalon;
        } catch (IOException e) {
            throw new ReferenceLoadException("Could not read etalon spectrum " + path, e);
        }
    }
}
