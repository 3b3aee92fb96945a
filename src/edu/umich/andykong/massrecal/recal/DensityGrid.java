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

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;

/**
 * Density over (ppm x mass). Row 0 holds the highest ppm value, columns follow ascending mass.
 */
public class DensityGrid {
    private final double[][] values;
    private final double[] massAxis;
    private final double[] ppmAxis;

    public DensityGrid(double[][] values, double[] massAxis, double[] ppmAxis) {
        if (values.length != ppmAxis.length)
            throw new IllegalArgumentException("Row count differs from ppm axis length");
        for (double[] row : values)
            if (row.length != massAxis.length)
                throw new IllegalArgumentException("Column count differs from mass axis length");
        this.values = new double[values.length][];
        for (int r = 0; r < values.length; r++)
            this.values[r] = values[r].clone();
        this.massAxis = massAxis.clone();
        this.ppmAxis = ppmAxis.clone();
    }

    public double value(int r, int c) {
        return values[r][c];
    }

    public double ppmAt(int r) {
        return ppmAxis[r];
    }

    public double massAt(int c) {
        return massAxis[c];
    }

    public double[] row(int r) {
        return values[r].clone();
    }

    public int rows() {
        return ppmAxis.length;
    }

    public int columns() {
        return massAxis.length;
    }

    public double[] column(int c) {
        double[] col = new double[values.length];
        for (int r = 0; r < values.length; r++)
            col[r] = values[r][c];
        return col;
    }

    public void writeTSV(File f) throws IOException {
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8))) {
            out.print("ppm");
            for (double m : massAxis)
                out.printf(Locale.ROOT, "\t%.5f", m);
            out.println();
            for (int r = 0; r < values.length; r++) {
                out.printf(Locale.ROOT, "%.5f", ppmAxis[r]);
                for (double v : values[r])
                    out.printf(Locale.ROOT, "\t%.8g", v);
                out.println();
            }
        }
    }
}
