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

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Savitzky-Golay smoothing of arbitrary odd window length and polynomial order. Points closer
 * than half a window to either end are taken from the polynomial fitted to the first or last
 * full window.
 */
public class SavitzkyGolayFilter {
    private final int window;
    private final RealMatrix hat;

    public SavitzkyGolayFilter(int window, int order) {
        if (window % 2 == 0 || window < 1)
            throw new IllegalArgumentException("Window length must be a positive odd number: " + window);
        if (order >= window)
            throw new IllegalArgumentException("Polynomial order must be less than window length");
        this.window = window;

        int half = window / 2;
        double[][] v = new double[window][order + 1];
        for (int i = 0; i < window; i++) {
            double x = i - half;
            double p = 1;
            for (int k = 0; k <= order; k++) {
                v[i][k] = p;
                p *= x;
            }
        }
        RealMatrix vm = MatrixUtils.createRealMatrix(v);
        // least squares projection V (V^T V)^-1 V^T, row i evaluates the window fit at position i
        RealMatrix pinv = new QRDecomposition(vm).getSolver().solve(MatrixUtils.createRealIdentityMatrix(window));
        this.hat = vm.multiply(pinv);
    }

    public double[] smooth(double[] y) {
        int n = y.length;
        if (n < window)
            throw new IllegalArgumentException(String.format("Smoothing window %d is longer than the signal (%d points)", window, n));
        int half = window / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int start = Math.min(Math.max(i - half, 0), n - window);
            double[] weights = hat.getRow(i - start);
            double s = 0;
            for (int j = 0; j < window; j++)
                s += weights[j] * y[start + j];
            out[i] = s;
        }
        return out;
    }
}
