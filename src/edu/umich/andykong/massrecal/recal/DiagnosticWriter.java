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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes intermediate tables of a recalibration run (scatter, density map, curve) next to each
 * other, prefixed by the strategy name. Only a side channel, results do not depend on it.
 */
public class DiagnosticWriter {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticWriter.class);

    public static final String scatterName = ".scatter.tsv";
    public static final String densityName = ".density.tsv";
    public static final String curveName = ".curve.tsv";

    private final Path dir;

    public DiagnosticWriter(String dir) {
        this.dir = Paths.get(dir.isEmpty() ? "." : dir);
    }

    public File fileFor(String prefix, String suffix) {
        return dir.resolve(prefix + suffix).toFile();
    }

    public void write(String prefix, ErrorScatter scatter, DensityGrid grid, ErrorCurve curve) {
        try {
            Files.createDirectories(dir);
            if (scatter != null)
                scatter.writeTSV(fileFor(prefix, scatterName));
            if (grid != null)
                grid.writeTSV(fileFor(prefix, densityName));
            if (curve != null)
                curve.writeTSV(fileFor(prefix, curveName));
        } catch (IOException e) {
            log.warn("Could not write diagnostics to {}", dir, e);
            return;
        }
        log.info("Wrote {} diagnostics to {}", prefix, dir.toAbsolutePath().normalize());
    }
}
