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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns the closest generated formula to each peak within a relative tolerance.
 */
public class FormulaAssigner {
	private static final Logger log = LoggerFactory.getLogger(FormulaAssigner.class);

	private final BruttoGenerator generator;
	private final double[] ionMasses;
	private final char ionMode;

	public FormulaAssigner(ElementBounds bounds, char ionMode) {
		this.generator = new BruttoGenerator(bounds);
		this.ionMode = ionMode;
		double shift = ionShift(ionMode);
		this.ionMasses = new double[generator.size()];
		for (int i = 0; i < ionMasses.length; i++)
			ionMasses[i] = generator.masses[i] + shift;
		log.debug("Generated {} formulas for bounds {}", ionMasses.length, bounds);
	}

	/**
	 * Offset from neutral formula mass to observed ion mass.
	 */
	public static double ionShift(char ionMode) {
		switch (ionMode) {
			case '-':
				return -MassTools.protonMass;
			case '+':
				return MassTools.protonMass;
			case '0':
				return 0.0;
			default:
				throw new IllegalArgumentException("Unknown ion mode: " + ionMode);
		}
	}

	/**
	 * Assigns rows in place and returns the number of assigned rows.
	 */
	public int assign(PeakList spec, double ppm) {
		int nAssigned = 0;
		for (PeakRow r : spec.rows) {
			r.formula = null;
			r.calcMass = Double.NaN;
			r.relError = Double.NaN;
			int idx = MassTools.nearestIndex(ionMasses, r.mass);
			if (idx < 0)
				continue;
			if (Math.abs(MassTools.ppm(r.mass, ionMasses[idx])) <= ppm) {
				r.assign(generator.formulas[idx].clone(), ionMasses[idx]);
				nAssigned++;
			}
		}
		log.debug("Assigned {} of {} peaks at {} ppm (ion mode {})", nAssigned, spec.size(), ppm, ionMode);
		return nAssigned;
	}
}
