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

package edu.umich.andykong.massrecal;

import static java.lang.System.out;

import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.paramhandling.BooleanParameter;
import edu.umich.andykong.massrecal.paramhandling.Parameter;
import edu.umich.andykong.massrecal.paramhandling.ParameterGroup;
import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import edu.umich.andykong.massrecal.paramhandling.StringParameter;
import edu.umich.andykong.massrecal.recal.ErrorCurve;
import edu.umich.andykong.massrecal.recal.Recalibrator;
import edu.umich.andykong.massrecal.recal.RecalibrationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MassRecal {
	private static final Logger log = LoggerFactory.getLogger(MassRecal.class);

	public static final String name = "MassRecal";
	public static final String version = "1.0.0";

	public static final String defaultParamsResource = "/default_params.txt";
	public static final String defaultParamsName = "massrecal_params.txt";

	public static void die(String s) {
		System.err.println("Fatal error: " + s);
		System.exit(1);
	}

	/**
	 * Run level keys. Recalibration keys live in {@link RecalParams#newParameterGroup()}.
	 */
	public static ParameterGroup newRunParameterGroup() {
		ParameterGroup g = new ParameterGroup("run");
		g.addParam(new StringParameter("spectrum", "", "peak list to recalibrate"));
		g.addParam(new StringParameter("how", Recalibrator.HOW_ASSIGN, "assign, mdm or path to an etalon peak list"));
		g.addParam(new StringParameter("error_table", "", "precomputed mass/ppm table, skips estimation"));
		g.addParam(new StringParameter("output_file", "", "recalibrated peak list, defaults to <spectrum>.recal.csv"));
		g.addParam(new StringParameter("output_error_table", "", "write the applied error table here"));
		g.addParam(new BooleanParameter("draw", false, "write scatter, density and curve tables"));
		return g;
	}

	public static HashMap<String, String> defaultParams() {
		HashMap<String, String> params = new LinkedHashMap<>();
		for (Parameter<?> p : newRunParameterGroup().getParameters().values())
			params.put(p.getKey(), String.valueOf(p.getDefaultValue()));
		return params;
	}

	public static void parseParamFile(Path path, Map<String, String> params) throws IOException {
		if (!Files.exists(path))
			throw new IOException(String.format("Parameter file does not exist: [%s]", path));
		try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String cline;
			while ((cline = in.readLine()) != null) {
				int comments = cline.indexOf("//");
				if (comments >= 0)
					cline = cline.substring(0, comments);
				cline = cline.trim();
				if (cline.length() == 0 || cline.indexOf("=") < 0)
					continue;
				String key = cline.substring(0, cline.indexOf("=")).trim();
				String value = cline.substring(cline.indexOf("=") + 1).trim();
				params.put(key, value);
			}
		}
	}

	/**
	 * Parameter files are read in order, "--key value" pairs override them.
	 */
	public static HashMap<String, String> loadParams(String[] args) throws IOException {
		HashMap<String, String> params = defaultParams();
		HashMap<String, String> overrides = new HashMap<>();
		for (int i = 0; i < args.length; i++) {
			if (args[i].startsWith("--")) {
				if (i + 1 >= args.length)
					throw new IllegalArgumentException("Missing value for " + args[i]);
				overrides.put(args[i].substring(2), args[i + 1]);
				i++;
			} else
				parseParamFile(Paths.get(args[i].trim().replaceAll("['\"]", "")), params);
		}
		params.putAll(overrides);
		return params;
	}

	public static PeakList run(Map<String, String> params) throws IOException {
		ParameterGroup runGroup = newRunParameterGroup();
		ParameterGroup recalGroup = RecalParams.newParameterGroup();
		for (String key : params.keySet())
			if (!runGroup.hasParam(key) && !recalGroup.hasParam(key))
				log.warn("Ignoring unknown parameter {}", key);
		runGroup.parseParamValues(params);
		recalGroup.parseParamValues(params);
		runGroup.printParameters();
		recalGroup.printParameters();
		RecalParams recalParams = RecalParams.fromGroup(recalGroup);

		String specPath = runGroup.getValue("spectrum");
		if (specPath.isEmpty())
			throw new IllegalArgumentException("no spectrum specified!");

		log.info("Reading spectrum {}", specPath);
		PeakList spec = PeakList.readCsv(new File(specPath), recalParams.csvSep);
		log.info("Read {} peaks", spec.size());

		ErrorCurve curve = null;
		String errorTable = runGroup.getValue("error_table");
		if (!errorTable.isEmpty()) {
			curve = ErrorCurve.readTSV(new File(errorTable));
			log.info("Using error table {} ({} points)", errorTable, curve.size());
		}

		String how = runGroup.getValue("how");
		boolean draw = runGroup.getValue("draw");
		Recalibrator recalibrator = new Recalibrator(recalParams);
		if (curve == null)
			curve = recalibrator.estimate(spec, how, draw);

		String curveOut = runGroup.getValue("output_error_table");
		if (!curveOut.isEmpty()) {
			curve.writeTSV(new File(curveOut));
			log.info("Wrote error table to {}", curveOut);
		}

		PeakList recal = recalibrator.recalibrate(spec, curve, how, draw);

		String outFile = runGroup.getValue("output_file");
		if (outFile.isEmpty())
			outFile = specPath.replaceAll("\\.[^.\\\\/]*$", "") + ".recal.csv";
		recal.writeCsv(new File(outFile), recalParams.csvSep);
		log.info("Wrote recalibrated spectrum to {} {}", outFile, recal.metadata.asMap());
		return recal;
	}

	private static void printConfigFile() {
		System.out.printf("Copying internal resource to %s.\n", defaultParamsName);
		InputStream is = MassRecal.class.getResourceAsStream(defaultParamsResource);
		if (is == null) {
			die("Missing internal resource " + defaultParamsResource);
			return;
		}
		try (BufferedReader in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
			 PrintWriter pw = new PrintWriter(new FileWriter(defaultParamsName))) {
			String cline;
			while ((cline = in.readLine()) != null)
				pw.println(cline);
		} catch (IOException ex) {
			die("Could not write " + defaultParamsName + ": " + ex.getMessage());
		}
	}

	private static void printUsage() {
		out.printf("%s %s\n", name, version);
		out.println();
		out.printf("Usage:\n");
		out.printf("\tTo print the parameter file:\n" +
				"\t\tjava -jar massrecal-%s.jar --config\n", version);
		out.printf("\tTo run MassRecal:\n" +
				"\t\tjava -jar massrecal-%s.jar params.txt [--key value ...]\n", version);
		out.println();
		for (ParameterGroup g : new ParameterGroup[]{newRunParameterGroup(), RecalParams.newParameterGroup()}) {
			out.printf("Parameters (%s):\n", g.getName());
			for (Parameter<?> p : g.getParameters().values())
				out.printf("\t%-20s %-24s %s\n", p.getKey(), p.getDefaultValue(), p.getDescription());
			out.println();
		}
	}

	public static void main(String[] args) throws Exception {
		Locale.setDefault(new Locale("en", "US"));
		out.println();
		out.printf("%s version %s\n", name, version);
		out.printf("Using Java %s on %dMB memory\n\n", System.getProperty("java.version"), (int) (Runtime.getRuntime().maxMemory() / Math.pow(2, 20)));

		if (args.length == 0) {
			printUsage();
			System.exit(0);
		}
		if (args.length == 1 && args[0].equals("--config")) {
			printConfigFile();
			System.exit(0);
		}

		try {
			HashMap<String, String> params = loadParams(args);
			run(params);
		} catch (IllegalArgumentException | IOException e) {
			die(e.getMessage());
		} catch (RecalibrationException e) {
			log.error("Recalibration failed", e);
			die(e.getMessage());
		}
	}
}
