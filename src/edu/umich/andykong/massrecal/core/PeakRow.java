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

import java.util.Arrays;

/**
 * Single peak. Relative error is (mass - calcMass) / mass in ppm. Formula counts are ordered as {@link MassTools#elements}; null when unassigned.
 */
public class PeakRow {
	public double mass;
	public double intensity;
	public int[] formula;
	public double calcMass;
	public double relError;

	public PeakRow(double mass, double intensity) {
		if (!Double.isFinite(mass) || mass <= 0)
			throw new IllegalArgumentException("Peak mass must be finite and positive: " + mass);
		if (!Double.isFinite(intensity) || intensity < 0)
			throw new IllegalArgumentException("Peak intensity must be finite and non-negative: " + intensity);
		this.mass = mass;
		this.intensity = intensity;
		this.formula = null;
		this.calcMass = Double.NaN;
		this.relError = Double.NaN;
	}

	public boolean isAssigned() {
		return formula != null && !Double.isNaN(calcMass);
	}

	public void assign(int[] formula, double calcMass) {
		this.formula = formula;
		this.calcMass = calcMass;
		calcError();
	}

	public void calcError() {
		if (isAssigned())
			relError = (mass - calcMass) / mass * 1e6;
		else
			relError = Double.NaN;
	}

	public String formulaString() {
		if (formula == null)
			return "";
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < formula.length; i++) {
			if (formula[i] == 0)
				continue;
			sb.append(MassTools.elements[i]);
			if (formula[i] > 1)
				sb.append(formula[i]);
		}
		return sb.toString();
	}

	public PeakRow copy() {
		PeakRow r = new PeakRow(mass, intensity);
		r.formula = formula == null ? null : Arrays.copyOf(formula, formula.length);
		r.calcMass = calcMass;
		r.relError = relError;
		return r;
	}

	public String toString() {
		return String.format("[%.6f %.2f %s]", mass, intensity, formulaString());
	}
}
