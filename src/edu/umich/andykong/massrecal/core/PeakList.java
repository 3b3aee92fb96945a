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

import com.google.common.base.Charsets;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Peak list with mass, intensity and optional formula assignment per row.
 */
public class PeakList {

	public ArrayList<PeakRow> rows;
	public Metadata metadata;

	public PeakList() {
		this.rows = new ArrayList<>();
		this.metadata = new Metadata();
	}

	public PeakList(double[] masses, double[] intensities) {
		this();
		if (masses.length != intensities.length)
			throw new IllegalArgumentException("Mass and intensity arrays differ in length");
		for (int i = 0; i < masses.length; i++)
			rows.add(new PeakRow(masses[i], intensities[i]));
	}

	public void add(PeakRow r) {
		rows.add(r);
	}

	public int size() {
		return rows.size();
	}

	public double[] getMasses() {
		double[] m = new double[rows.size()];
		for (int i = 0; i < m.length; i++)
			m[i] = rows.get(i).mass;
		return m;
	}

	public double[] getIntensities() {
		double[] m = new double[rows.size()];
		for (int i = 0; i < m.length; i++)
			m[i] = rows.get(i).intensity;
		return m;
	}

	public double getMinMass() {
		return MassTools.min(getMasses());
	}

	public double getMaxMass() {
		return MassTools.max(getMasses());
	}

	public PeakList copy() {
		PeakList pl = new PeakList();
		for (PeakRow r : rows)
			pl.rows.add(r.copy());
		pl.metadata = metadata.copy();
		return pl;
	}

	/**
	 * Returns an assigned copy, the receiver is left untouched.
	 */
	public PeakList assign(double ppm, ElementBounds bounds, char ionMode) {
		PeakList pl = copy();
		new FormulaAssigner(bounds, ionMode).assign(pl, ppm);
		return pl;
	}

	public PeakList dropUnassigned() {
		PeakList pl = new PeakList();
		for (PeakRow r : rows)
			if (r.isAssigned())
				pl.rows.add(r.copy());
		pl.metadata = metadata.copy();
		return pl;
	}

	public PeakList calcError() {
		for (PeakRow r : rows)
			r.calcError();
		return this;
	}

	public int countAssigned() {
		int n = 0;
		for (PeakRow r : rows)
			if (r.isAssigned())
				n++;
		return n;
	}

	public double meanRelativeError() {
		double sum = 0;
		int n = 0;
		for (PeakRow r : rows) {
			if (!r.isAssigned())
				continue;
			sum += (r.mass - r.calcMass) / r.mass * 1e6;
			n++;
		}
		return n == 0 ? Double.NaN : sum / n;
	}

	/**
	 * Keeps rows with intensity strictly above the q quantile of all intensities.
	 */
	public PeakList filterByIntensityQuantile(double q) {
		double threshold = MassTools.quantile(getIntensities(), q);
		PeakList pl = new PeakList();
		for (PeakRow r : rows)
			if (r.intensity > threshold)
				pl.rows.add(r.copy());
		pl.metadata = metadata.copy();
		return pl;
	}

	/**
	 * Reads a delimited peak list. A "mass" column is required; "intensity", "calc_mass" and
	 * element count columns are picked up when present.
	 */
	public static PeakList readCsv(@NotNull File f, String sep) throws IOException {
		PeakList pl = new PeakList();
		try (BufferedReader in = Files.newBufferedReader(f.toPath(), Charsets.UTF_8)) {
			String header = in.readLine();
			if (header == null)
				throw new IOException("Empty peak list file: " + f);
			String[] cols = splitLine(header, sep);
			int massCol = getColumn("mass", cols);
			if (massCol < 0)
				throw new IOException("No mass column in " + f);
			int intCol = getColumn("intensity", cols);
			int calcCol = getColumn("calc_mass", cols);
			int[] elCols = new int[MassTools.elements.length];
			boolean hasFormula = false;
			for (int i = 0; i < elCols.length; i++) {
				elCols[i] = getColumn(MassTools.elements[i], cols);
				hasFormula |= elCols[i] >= 0;
			}

			String cline;
			int lineNum = 1;
			while ((cline = in.readLine()) != null) {
				lineNum++;
				if (StringUtils.isBlank(cline))
					continue;
				String[] sp = splitLine(cline, sep);
				try {
					double mass = Double.parseDouble(sp[massCol]);
					double intensity = intCol >= 0 ? Double.parseDouble(sp[intCol]) : 1.0;
					PeakRow r = new PeakRow(mass, intensity);
					if (hasFormula && calcCol >= 0 && calcCol < sp.length && StringUtils.isNotBlank(sp[calcCol])) {
						int[] formula = new int[elCols.length];
						for (int i = 0; i < elCols.length; i++)
							formula[i] = (elCols[i] >= 0 && StringUtils.isNotBlank(sp[elCols[i]])) ? (int) Double.parseDouble(sp[elCols[i]]) : 0;
						r.assign(formula, Double.parseDouble(sp[calcCol]));
					}
					pl.rows.add(r);
				} catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
					throw new IOException(String.format("Malformed line %d in %s: %s", lineNum, f, e.getMessage()), e);
				}
			}
		}
		return pl;
	}

	public void writeCsv(@NotNull File f, String sep) throws IOException {
		boolean withAssignment = countAssigned() > 0;
		try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(f.toPath(), Charsets.UTF_8))) {
			List<String> headers = new ArrayList<>();
			headers.add("mass");
			headers.add("intensity");
			if (withAssignment) {
				headers.add("calc_mass");
				headers.add("rel_error");
				for (String el : MassTools.elements)
					headers.add(el);
			}
			out.println(String.join(sep, headers));
			for (PeakRow r : rows) {
				StringBuilder sb = new StringBuilder();
				sb.append(String.format(Locale.ROOT, "%.8f", r.mass)).append(sep).append(String.format(Locale.ROOT, "%.4f", r.intensity));
				if (withAssignment) {
					if (r.isAssigned()) {
						sb.append(sep).append(String.format(Locale.ROOT, "%.8f", r.calcMass));
						sb.append(sep).append(String.format(Locale.ROOT, "%.5f", r.relError));
						for (int c : r.formula)
							sb.append(sep).append(c);
					} else {
						for (int i = 0; i < 2 + MassTools.elements.length; i++)
							sb.append(sep);
					}
				}
				out.println(sb);
			}
		}
	}

	private static String[] splitLine(String line, String sep) {
		String[] sp = line.split(Pattern.quote(sep), -1);
		for (int i = 0; i < sp.length; i++)
			sp[i] = StringUtils.strip(sp[i].trim(), "\"");
		return sp;
	}

	private static int getColumn(String name, String[] cols) {
		for (int i = 0; i < cols.length; i++)
			if (cols[i].equals(name))
				return i;
		return -1;
	}
}
