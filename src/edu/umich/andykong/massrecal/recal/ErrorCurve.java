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

import com.google.common.base.Charsets;
import edu.umich.andykong.massrecal.core.MassTools;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;
import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Locale;

/**
 * Piecewise linear mass to ppm correction table. Masses are strictly increasing.
 * Instances are immutable; every transformation returns a new curve.
 */
public class ErrorCurve {
    private static final Logger log = LoggerFactory.getLogger(ErrorCurve.class);

    private final double[] mass;
    private final double[] ppm;

    public ErrorCurve(double[] mass, double[] ppm) {
        if (mass.length != ppm.length)
            throw new IllegalArgumentException("Mass and ppm arrays differ in length");
        if (mass.length < 2)
            throw new IllegalArgumentException("Error curve needs at least 2 points");
        for (int i = 1; i < mass.length; i++)
            if (!(mass[i] > mass[i - 1]))
                throw new IllegalArgumentException(String.format("Curve masses must be strictly increasing (index %d)", i));
        this.mass = mass.clone();
        this.ppm = ppm.clone();
    }

    public int size() {
        return mass.length;
    }

    public double getMass(int i) {
        return mass[i];
    }

    public double getPpm(int i) {
        return ppm[i];
    }

    public double[] getMasses() {
        return mass.clone();
    }

    public double[] getPpms() {
        return ppm.clone();
    }

    public double getMinMass() {
        return mass[0];
    }

    public double getMaxMass() {
        return mass[mass.length - 1];
    }

    /**
     * Linear interpolation inside the curve, linear extension of the end segments outside.
     */
    public double valueAt(double m) {
        int hi = MassTools.searchSortedLeft(mass, m);
        if (hi <= 0)
            hi = 1;
        else if (hi >= mass.length)
            hi = mass.length - 1;
        int lo = hi - 1;
        double slope = (ppm[hi] - ppm[lo]) / (mass[hi] - mass[lo]);
        return ppm[lo] + slope * (m - mass[lo]);
    }

    public ErrorCurve extrapolate() {
        return extrapolate(getMinMass(), getMaxMass());
    }

    public ErrorCurve extrapolate(double minMass, double maxMass) {
        return extrapolate(minMass, maxMass, RecalParams.DEFAULT_GRID_SIZE);
    }

    public ErrorCurve extrapolate(double minMass, double maxMass, int points) {
        InvalidRangeException.check(minMass, maxMass, "extrapolation");
        double[] axis = MassTools.linspace(minMass, maxMass, points);
        double[] vals = new double[points];
        for (int i = 0; i < points; i++)
            vals[i] = valueAt(axis[i]);
        return new ErrorCurve(axis, vals);
    }

    /**
     * Shifts every point by a constant so that the assigned peaks of spec have zero mean
     * relative error once this curve is applied. The residual of a peak after correction is
     * approximately relError + valueAt(mass), and the mean of that residual is subtracted.
     */
    public ErrorCurve zeroshift(PeakList spec) {
        PeakList assigned = spec.dropUnassigned().calcError();
        if (assigned.size() == 0)
            throw new AssignmentUnavailableException("Zero shift needs assigned peaks, none found");
        double sum = 0;
        for (PeakRow r : assigned.rows)
            sum += r.relError + valueAt(r.mass);
        double shift = sum / assigned.size();
        double[] shifted = new double[ppm.length];
        for (int i = 0; i < ppm.length; i++)
            shifted[i] = ppm[i] - shift;
        log.debug("Zero shift by {} ppm from {} assigned peaks", shift, assigned.size());
        return new ErrorCurve(mass, shifted);
    }

    public void show() {
        log.info("Error curve, {} points over [{}, {}] Da", mass.length, getMinMass(), getMaxMass());
        if (!log.isDebugEnabled())
            return;
        for (int i = 0; i < mass.length; i++)
            log.debug(String.format(Locale.ROOT, "\t%.5f\t%.4f", mass[i], ppm[i]));
    }

    public void writeTSV(File f) throws IOException {
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(f.toPath(), Charsets.UTF_8))) {
            out.println("mass\tppm");
            for (int i = 0; i < mass.length; i++)
                out.printf(Locale.ROOT, "%.8f\t%.8f\n", mass[i], ppm[i]);
        }
    }

    public static ErrorCurve readTSV(File f) throws IOException {
        ArrayList<double[]> pts = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(f.toPath(), Charsets.UTF_8)) {
            String cline = in.readLine();
            if (cline == null || !cline.trim().startsWith("mass"))
                throw new IOException("Missing error table header in " + f);
            while ((cline = in.readLine()) != null) {
                cline = cline.trim();
                if (cline.isEmpty())
                    continue;
                String[] sp = cline.split("\t");
                if (sp.length < 2)
                    throw new IOException("Malformed error table line: " + cline);
                try {
                    pts.add(new double[]{Double.parseDouble(sp[0]), Double.parseDouble(sp[1])});
                } catch (NumberFormatException e) {
                    throw new IOException("Malformed error table line: " + cline, e);
                }
            }
        }
        double[] m = new double[pts.size()];
        double[] p = new double[pts.size()];
        for (int i = 0; i < m.length; i++) {
            m[i] = pts.get(i)[0];
            p[i] = pts.get(i)[1];
        }
        try {
            return new ErrorCurve(m, p);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid error table in " + f + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ErrorCurve[%d points, %.4f-%.4f Da, %s]", mass.length, getMinMass(), getMaxMass(),
                Arrays.toString(Arrays.copyOf(ppm, Math.min(3, ppm.length))));
    }
}
