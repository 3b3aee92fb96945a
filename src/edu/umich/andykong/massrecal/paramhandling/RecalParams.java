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

package edu.umich.andykong.massrecal.paramhandling;

import edu.umich.andykong.massrecal.core.ElementBounds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the recalibration settings. Build one per call with {@link #defaults()}
 * or {@link #fromMap(Map)}.
 */
public final class RecalParams {

    public static final double DEFAULT_PPM = 3.0;
    public static final int DEFAULT_GRID_SIZE = 100;
    public static final double DEFAULT_RIDGE_QUANTILE = 0.95;
    public static final int DEFAULT_SMOOTH_WINDOW = 31;
    public static final int DEFAULT_SMOOTH_ORDER = 5;
    public static final int DEFAULT_MAX_MULTIPLIER = 9;
    public static final int DEFAULT_INTENSITY_CAP = 1000;
    public static final double DEFAULT_ETALON_QUANTILE = 0.9;

    /**
     * Whether an optional post-processing stage runs. AUTO defers to the strategy default.
     */
    public enum StagePolicy {
        AUTO, ALWAYS, NEVER;

        public static StagePolicy parse(String s) {
            switch (s.trim().toLowerCase()) {
                case "auto":
                    return AUTO;
                case "true":
                case "1":
                    return ALWAYS;
                case "false":
                case "0":
                    return NEVER;
                default:
                    throw new IllegalArgumentException("Unknown stage policy: " + s);
            }
        }

        public boolean resolve(boolean strategyDefault) {
            return this == AUTO ? strategyDefault : this == ALWAYS;
        }
    }

    public final double ppmTolerance;
    public final double ppmWindow;
    public final int gridSize;
    public final double ridgeQuantile;
    public final int smoothWindow;
    public final int smoothOrder;
    public final int maxMultiplier;
    public final int intensityCap;
    public final double etalonQuantile;
    public final ElementBounds elementBounds;
    public final char ionMode;
    public final StagePolicy extrapolate;
    public final StagePolicy zeroshift;
    public final int threads;
    public final String diagnosticsPath;
    public final String csvSep;

    private RecalParams(ParameterGroup g) {
        this.ppmTolerance = g.getValue("ppm_tolerance");
        this.ppmWindow = g.getValue("ppm_window");
        this.gridSize = g.getValue("grid_size");
        this.ridgeQuantile = g.getValue("ridge_quantile");
        this.smoothWindow = g.getValue("smooth_window");
        this.smoothOrder = g.getValue("smooth_order");
        this.maxMultiplier = g.getValue("mdm_max_multiplier");
        this.intensityCap = g.getValue("mdm_intensity_cap");
        this.etalonQuantile = g.getValue("etalon_quantile");
        this.elementBounds = ElementBounds.parse(g.getValue("element_bounds"));
        this.ionMode = g.<String>getValue("ion_mode").charAt(0);
        this.extrapolate = StagePolicy.parse(g.getValue("extrapolate"));
        this.zeroshift = StagePolicy.parse(g.getValue("zeroshift"));
        this.threads = g.getValue("threads");
        this.diagnosticsPath = g.getValue("diagnostics_path");
        this.csvSep = unescape(g.getValue("csv_sep"));
        if (csvSep.isEmpty())
            throw new IllegalArgumentException("csv_sep must not be empty");

        if (smoothWindow % 2 == 0)
            throw new IllegalArgumentException("smooth_window must be odd: " + smoothWindow);
        if (smoothOrder >= smoothWindow)
            throw new IllegalArgumentException("smooth_order must be less than smooth_window");
        if (smoothWindow > gridSize)
            throw new IllegalArgumentException("smooth_window must not exceed grid_size");
    }

    public static ParameterGroup newParameterGroup() {
        ParameterGroup g = new ParameterGroup("recalibration");
        g.addParam(new DoubleParameter("ppm_tolerance", 1e-6, 1000, DEFAULT_PPM, "matching/assignment tolerance in ppm"));
        g.addParam(new DoubleParameter("ppm_window", 1e-6, 1000, DEFAULT_PPM, "half width of the density map ppm axis"));
        g.addParam(new IntegerParameter("grid_size", 2, 10000, DEFAULT_GRID_SIZE, "density grid and error curve resolution"));
        g.addParam(new DoubleParameter("ridge_quantile", 0, 1, DEFAULT_RIDGE_QUANTILE, "density quantile defining the ridge"));
        g.addParam(new IntegerParameter("smooth_window", 3, 10001, DEFAULT_SMOOTH_WINDOW, "Savitzky-Golay window length"));
        g.addParam(new IntegerParameter("smooth_order", 0, 20, DEFAULT_SMOOTH_ORDER, "Savitzky-Golay polynomial order"));
        g.addParam(new IntegerParameter("mdm_max_multiplier", 1, 100, DEFAULT_MAX_MULTIPLIER, "largest multiplier of the mass difference building blocks"));
        g.addParam(new IntegerParameter("mdm_intensity_cap", 1, Integer.MAX_VALUE, DEFAULT_INTENSITY_CAP, "number of most intense peaks used as mass difference anchors"));
        g.addParam(new DoubleParameter("etalon_quantile", 0, 1, DEFAULT_ETALON_QUANTILE, "intensity quantile a peak must exceed to be matched against the etalon"));
        g.addParam(new StringParameter("element_bounds", ElementBounds.DEFAULT, "element count ranges for formula assignment"));
        g.addParam(new StringParameter("ion_mode", "-", "ionisation mode for assignment", "-", "+", "0"));
        g.addParam(new StringParameter("extrapolate", "auto", "extrapolate the curve to the spectrum range", "auto", "true", "false", "1", "0"));
        g.addParam(new StringParameter("zeroshift", "auto", "remove the mean assignment error from the curve", "auto", "true", "false", "1", "0"));
        g.addParam(new IntegerParameter("threads", 1, 1024, 1, "threads for density estimation"));
        g.addParam(new StringParameter("diagnostics_path", "", "directory for diagnostic tables, empty for the working directory"));
        g.addParam(new StringParameter("csv_sep", ",", "column separator of peak list files, \\t for tab"));
        return g;
    }

    private static String unescape(String sep) {
        return sep.equals("\\t") ? "\t" : sep;
    }

    private static String escape(String sep) {
        return sep.equals("\t") ? "\\t" : sep;
    }

    public static RecalParams defaults() {
        return fromMap(Collections.emptyMap());
    }

    public static RecalParams fromMap(Map<String, String> values) {
        ParameterGroup g = newParameterGroup();
        g.parseParamValues(values);
        return fromGroup(g);
    }

    /**
     * @param g a group built by {@link #newParameterGroup()}
     */
    public static RecalParams fromGroup(ParameterGroup g) {
        return new RecalParams(g);
    }

    /**
     * Returns a copy with the given keys overridden.
     */
    public RecalParams with(Map<String, String> overrides) {
        Map<String, String> m = toMap();
        m.putAll(overrides);
        return fromMap(m);
    }

    public Map<String, String> toMap() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("ppm_tolerance", Double.toString(ppmTolerance));
        m.put("ppm_window", Double.toString(ppmWindow));
        m.put("grid_size", Integer.toString(gridSize));
        m.put("ridge_quantile", Double.toString(ridgeQuantile));
        m.put("smooth_window", Integer.toString(smoothWindow));
        m.put("smooth_order", Integer.toString(smoothOrder));
        m.put("mdm_max_multiplier", Integer.toString(maxMultiplier));
        m.put("mdm_intensity_cap", Integer.toString(intensityCap));
        m.put("etalon_quantile", Double.toString(etalonQuantile));
        m.put("element_bounds", elementBounds.toString());
        m.put("ion_mode", Character.toString(ionMode));
        m.put("extrapolate", policyString(extrapolate));
        m.put("zeroshift", policyString(zeroshift));
        m.put("threads", Integer.toString(threads));
        m.put("diagnostics_path", diagnosticsPath);
        m.put("csv_sep", escape(csvSep));
        return m;
    }

    private static String policyString(StagePolicy p) {
        switch (p) {
            case ALWAYS:
                return "true";
            case NEVER:
                return "false";
            default:
                return "auto";
        }
    }
}
