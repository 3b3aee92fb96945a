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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * Two-dimensional Gaussian kernel density estimate. Bandwidth follows Scott's rule: the
 * unbiased data covariance scaled by n^(-1/6).
 */
public class GaussianKde {
    private final double[] xs;
    private final double[] ys;
    private final double ixx, ixy, iyy;
    private final double norm;
    public final double factor;
    public final RealMatrix kernelCovariance;

    public GaussianKde(double[] xs, double[] ys) {
        if (xs.length != ys.length)
            throw new IllegalArgumentException("Coordinate arrays differ in length");
        int n = xs.length;
        if (n < 2)
            throw new InsufficientDataException("Density estimation needs at least 2 observations, got " + n);
        this.xs = xs.clone();
        this.ys = ys.clone();

        double[][] data = new double[n][2];
        for (int i = 0; i < n; i++) {
            data[i][0] = xs[i];
            data[i][1] = ys[i];
        }
        RealMatrix dataCov = new Covariance(new Array2DRowRealMatrix(data, false), true).getCovarianceMatrix();
        this.factor = Math.pow(n, -1.0 / (2 + 4));
        this.kernelCovariance = dataCov.scalarMultiply(factor * factor);

        LUDecomposition lu = new LUDecomposition(kernelCovariance);
        double det = lu.getDeterminant();
        if (!(det > 0) || !lu.getSolver().isNonSingular())
            throw new InsufficientDataException("Observations are degenerate, kernel covariance is singular");
        RealMatrix inv = lu.getSolver().getInverse();
        this.ixx = inv.getEntry(0, 0);
        this.ixy = inv.getEntry(0, 1);
        this.iyy = inv.getEntry(1, 1);
        this.norm = n * Math.sqrt(4 * Math.PI * Math.PI * det);
    }

    public double evaluate(double x, double y) {
        double sum = 0;
        for (int i = 0; i < xs.length; i++) {
            double dx = x - xs[i];
            double dy = y - ys[i];
            double mahal = dx * dx * ixx + 2 * dx * dy * ixy + dy * dy * iyy;
            sum += Math.exp(-0.5 * mahal);
        }
        return sum / norm;
    }

    public int size() {
        return xs.length;
    }
}
