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

package edu.umich.andykong.massrecal.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;

/**
 * Enumerates brutto formulas inside element bounds and sorts them by monoisotopic neutral mass.
 */
public class BruttoGenerator {

	public double[] masses;
	public int[][] formulas;

	public BruttoGenerator(ElementBounds bounds) {
		int nEl = MassTools.elements.length;
		int[] lo = new int[nEl];
		int[] hi = new int[nEl];
		for (int i = 0; i < nEl; i++) {
			lo[i] = bounds.getMin(MassTools.elements[i]);
			hi[i] = bounds.getMax(MassTools.elements[i]);
		}

		ArrayList<int[]> found = new ArrayList<>();
		int[] cur = Arrays.copyOf(lo, nEl);
		while (true) {
			if (isPlausible(cur))
				found.add(Arrays.copyOf(cur, nEl));
			int p = 0;
			while (p < nEl && cur[p] == hi[p]) {
				cur[p] = lo[p];
				p++;
			}
			if (p == nEl)
				break;
			cur[p]++;
		}

		found.sort(Comparator.comparingDouble(BruttoGenerator::calcMass));
		formulas = found.toArray(new int[0][]);
		masses = new double[formulas.length];
		for (int i = 0; i < formulas.length; i++)
			masses[i] = calcMass(formulas[i]);
	}

	/**
	 * Integer, non-negative double bond equivalent.
	 */
	static boolean isPlausible(int[] f) {
		int c = f[0], h = f[1], n = f[3];
		if (c == 0 && h == 0)
			return false;
		if ((h + n) % 2 != 0)
			return false;
		double dbe = c - h / 2.0 + n / 2.0 + 1;
		return dbe >= 0;
	}

	public static double calcMass(int[] counts) {
		double m = 0;
		for (int i = 0; i < counts.length; i++)
			m += counts[i] * MassTools.elementMasses[i];
		return m;
	}

	public static double calcMass(int c, int h, int o) {
		return calcMass(new int[]{c, h, o, 0, 0});
	}

	public int size() {
		return masses.length;
	}
}
