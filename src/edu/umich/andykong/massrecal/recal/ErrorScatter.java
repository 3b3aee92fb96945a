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

import com.google.common.primitives.Doubles;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Raw (mass, ppm) error observations. Duplicated masses are allowed.
 */
public class ErrorScatter {
    private final ArrayList<Double> masses;
    private final ArrayList<Double> ppms;

    public ErrorScatter() {
        this.masses = new ArrayList<>();
        this.ppms = new ArrayList<>();
    }

    public ErrorScatter(double[] masses, double[] ppms) {
        this();
        if (masses.length != ppms.length)
            throw new IllegalArgumentException("Mass and ppm arrays differ in length");
        for (int i = 0; i < masses.length; i++)
            add(masses[i], ppms[i]);
    }

    public void add(double mass, double ppm) {
        masses.add(mass);
        ppms.add(ppm);
    }

    public int size() {
        return masses.size();
    }

    public boolean isEmpty() {
        return masses.isEmpty();
    }

    public double getMass(int i) {
        return masses.get(i);
    }

    public double getPpm(int i) {
        return ppms.get(i);
    }

    public double[] getMasses() {
        return Doubles.toArray(masses);
    }

    public double[] getPpms() {
        return Doubles.toArray(ppms);
    }

    public void writeTSV(File f) throws IOException {
        try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8))) {
            out.println("mass\tppm");
            for (int i = 0; i < masses.size(); i++)
                out.printf(Locale.ROOT, "%.8f\t%.6f\n", masses.get(i), ppms.get(i));
        }
    }
}
