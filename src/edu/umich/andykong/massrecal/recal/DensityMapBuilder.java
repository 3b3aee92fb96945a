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

import edu.umich.andykong.massrecal.core.MassTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns an error scatter into a fixed resolution kernel density map over mass x ppm.
 */
public class DensityMapBuilder {
    private static final Logger log = LoggerFactory.getLogger(DensityMapBuilder.class);

    private final int gridSize;
    private final ExecutorService executorService;

    public DensityMapBuilder(int gridSize) {
        this(gridSize, null);
    }

    /**
     * @param executorService evaluates grid columns in parallel when not null
     */
    public DensityMapBuilder(int gridSize, ExecutorService executorService) {
        if (gridSize < 2)
            throw new IllegalArgumentException("Grid size must be at least 2");
        this.gridSize = gridSize;
        this.executorService = executorService;
    }

    public DensityGrid build(ErrorScatter scatter, double ppmWindow) {
        if (scatter.size() < 2)
            throw new InsufficientDataException("Density map needs at least 2 observations, got " + scatter.size());
        double[] masses = scatter.getMasses();
        double[] ppms = scatter.getPpms();
        double xmin = MassTools.min(masses);
        double xmax = MassTools.max(masses);
        InvalidRangeException.check(xmin, xmax, "scatter mass");

        GaussianKde kde = new GaussianKde(masses, ppms);
        double[] massAxis = MassTools.linspace(xmin, xmax, gridSize);
        double[] ppmAxis = MassTools.linspace(ppmWindow, -ppmWindow, gridSize);
        double[][] values = new double[gridSize][gridSize];

        if (executorService == null) {
            for (int c = 0; c < gridSize; c++)
                fillColumn(kde, values, massAxis[c], c, ppmAxis);
        } else {
            List<Future<?>> futures = new ArrayList<>(gridSize);
            for (int c = 0; c < gridSize; c++) {
                final int col = c;
                futures.add(executorService.submit(() -> fillColumn(kde, values, massAxis[col], col, ppmAxis)));
            }
            try {
                for (Future<?> f : futures)
                    f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RecalibrationException("Interrupted while building density map", e);
            } catch (ExecutionException e) {
                throw new RecalibrationException("Density map evaluation failed", e.getCause());
            }
        }

        log.debug("Density map {}x{} over [{}, {}] Da, +-{} ppm from {} observations (bandwidth factor {})",
                gridSize, gridSize, xmin, xmax, ppmWindow, kde.size(), kde.factor);
        return new DensityGrid(values, massAxis, ppmAxis);
    }

    private static void fillColumn(GaussianKde kde, double[][] values, double mass, int c, double[] ppmAxis) {
        for (int r = 0; r < ppmAxis.length; r++)
            values[r][c] = kde.evaluate(mass, ppmAxis[r]);
    }
}
