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

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

public class MassTools {

	public static final double C = 12.0;
	public static final double H = 1.00782503207;
	public static final double O = 15.99491461956;
	public static final double N = 14.0030740048;
	public static final double S = 31.97207100;

	public static final double protonMass = 1.00727646677;

	public static final String[] elements = {"C", "H", "O", "N", "S"};
	public static final double[] elementMasses = {C, H, O, N, S};

	public static int elementIndex(String el) {
		for (int i = 0; i < elements.length; i++)
			if (elements[i].equals(el))
				return i;
		throw new IllegalArgumentException("Unsupported element: " + el);
	}

	/**
	 * Relative deviation of observed from reference, in ppm of the reference.
	 */
	public static double ppm(double observed, double reference) {
		return (observed - reference) / reference * 1e6;
	}

	/**
	 * Index of the value in a sorted array closest to target. The left neighbour wins only
	 * when it is strictly closer. Returns -1 for an empty array.
	 */
	public static int nearestIndex(double[] sorted, double target) {
		if (sorted.length == 0)
			return -1;
		int idx = searchSortedLeft(sorted, target);
		if (idx > 0 && (idx == sorted.length || Math.abs(target - sorted[idx - 1]) < Math.abs(target - sorted[idx])))
			idx--;
		return idx;
	}

	/**
	 * First index i such that sorted[i] >= target.
	 */
	public static int searchSortedLeft(double[] sorted, double target) {
		int lo = 0, hi = sorted.length;
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if (sorted[mid] < target)
				lo = mid + 1;
			else
				hi = mid;
		}
		return lo;
	}

	public static double[] linspace(double start, double stop, int num) {
		double[] vals = new double[num];
		if (num == 1) {
			vals[0] = start;
			return vals;
		}
		double step = (stop - start) / (num - 1);
		for (int i = 0; i < num; i++)
			vals[i] = start + i * step;
		vals[num - 1] = stop;
		return vals;
	}

	/**
	 * Quantile with linear interpolation between closest ranks, q in [0, 1].
	 */
	public static double quantile(double[] vals, double q) {
		if (vals.length == 0)
			return Double.NaN;
		if (q <= 0)
			return min(vals);
		return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(vals, q * 100.0);
	}

	public static double min(double[] vals) {
		double min = Double.POSITIVE_INFINITY;
		for (double v : vals)
			min = Math.min(min, v);
		return min;
	}

	public static double max(double[] vals) {
		double max = Double.NEGATIVE_INFINITY;
		for (double v : vals)
			max = Math.max(max, v);
		return max;
	}
}
