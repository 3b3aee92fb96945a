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

import edu.umich.andykong.massrecal.core.BruttoGenerator;

import java.util.Arrays;
import java.util.TreeSet;

/**
 * Neutral mass increments of small building blocks times integer multipliers, sorted and
 * deduplicated.
 */
public class MassDifferenceSet {

    /** C, H, O counts of the building blocks: CH2, CO, CH2O, C2HO, H2O, CO2. */
    public static final int[][] buildingBlocks = {
            {1, 2, 0},
            {1, 0, 1},
            {1, 2, 1},
            {2, 1, 1},
            {0, 2, 1},
            {1, 0, 2}
    };

    private final double[] differences;

    public MassDifferenceSet(int maxMultiplier) {
        if (maxMultiplier < 1)
            throw new IllegalArgumentException("maxMultiplier must be at least 1");
        TreeSet<Double> diffs = new TreeSet<>();
        for (int[] block : buildingBlocks) {
            double m = BruttoGenerator.calcMass(block[0], block[1], block[2]);
            for (int i = 1; i <= maxMultiplier; i++)
                diffs.add(m * i);
        }
        this.differences = new double[diffs.size()];
        int i = 0;
        for (double d : diffs)
            differences[i++] = d;
    }

    public MassDifferenceSet(double[] differences) {
        double[] d = Arrays.stream(differences).sorted().distinct().toArray();
        for (double v : d)
            if (!(v >= 0))
                throw new IllegalArgumentException("Mass differences must be non-negative: " + v);
        this.differences = d;
    }

    public double[] getDifferences() {
        return Arrays.copyOf(differences, differences.length);
    }

    public int size() {
        return differences.length;
    }
}
