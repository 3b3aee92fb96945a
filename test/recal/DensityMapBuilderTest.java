package recal;

import edu.umich.andykong.massrecal.recal.DensityGrid;
import edu.umich.andykong.massrecal.recal.DensityMapBuilder;
import edu.umich.andykong.massrecal.recal.ErrorScatter;
import edu.umich.andykong.massrecal.recal.GaussianKde;
import edu.umich.andykong.massrecal.recal.InsufficientDataException;
import edu.umich.andykong.massrecal.recal.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class DensityMapBuilderTest {

    static ErrorScatter noisyScatter(int n, double ppm, long seed) {
        Random rnd = new Random(seed);
        ErrorScatter s = new ErrorScatter();
        for (int i = 0; i < n; i++)
            s.add(200 + 300 * rnd.nextDouble(), ppm + 0.3 * rnd.nextGaussian());
        return s;
    }

    @Test
    void tooFewObservations() {
        DensityMapBuilder b = new DensityMapBuilder(20);
        assertThrows(InsufficientDataException.class, () -> b.build(new ErrorScatter(), 3.0));
        assertThrows(InsufficientDataException.class, () -> b.build(new ErrorScatter(new double[]{100}, new double[]{1}), 3.0));
    }

    @Test
    void equalMasses() {
        DensityMapBuilder b = new DensityMapBuilder(20);
        ErrorScatter s = new ErrorScatter(new double[]{100, 100}, new double[]{1, 2});
        assertThrows(InvalidRangeException.class, () -> b.build(s, 3.0));
    }

    @Test
    void degenerateObservations() {
        // collinear points have a singular covariance
        assertThrows(InsufficientDataException.class,
                () -> new GaussianKde(new double[]{100, 200, 300}, new double[]{0, 1, 2}));
    }

    @Test
    void gridOrientation() {
        DensityGrid g = new DensityMapBuilder(31).build(noisyScatter(200, 1.0, 7), 3.0);
        assertEquals(31, g.rows());
        assertEquals(31, g.columns());
        assertEquals(3.0, g.ppmAt(0));
        assertEquals(-3.0, g.ppmAt(30));
        assertTrue(g.massAt(0) < g.massAt(30));
        for (int c = 0; c < g.columns(); c++) {
            double[] col = g.column(c);
            int best = 0;
            for (int r = 1; r < col.length; r++)
                if (col[r] > col[best])
                    best = r;
            assertEquals(1.0, g.ppmAt(best), 0.4, "column " + c);
            assertTrue(best < 15, "peak should sit in the upper half");
        }
    }

    @Test
    void kdeIntegratesToOne() {
        Random rnd = new Random(3);
        int n = 50;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = 10 * rnd.nextDouble();
            ys[i] = rnd.nextDouble();
        }
        GaussianKde kde = new GaussianKde(xs, ys);
        assertEquals(Math.pow(n, -1.0 / 6), kde.factor, 1e-12);
        int steps = 300;
        double x0 = -10, x1 = 20, y0 = -3, y1 = 4;
        double dx = (x1 - x0) / steps, dy = (y1 - y0) / steps;
        double sum = 0;
        for (int i = 0; i < steps; i++)
            for (int j = 0; j < steps; j++)
                sum += kde.evaluate(x0 + (i + 0.5) * dx, y0 + (j + 0.5) * dy);
        assertEquals(1.0, sum * dx * dy, 0.02);
    }

    @Test
    void parallelMatchesSerial() {
        ErrorScatter s = noisyScatter(100, -0.5, 11);
        DensityGrid serial = new DensityMapBuilder(40).build(s, 2.0);
        ExecutorService ex = Executors.newFixedThreadPool(4);
        try {
            DensityGrid parallel = new DensityMapBuilder(40, ex).build(s, 2.0);
            for (int r = 0; r < serial.rows(); r++)
                assertArrayEquals(serial.row(r), parallel.row(r));
        } finally {
            ex.shutdown();
        }
    }

    @Test
    void gridIsIsolatedFromCallerArrays() {
        double[][] values = {{1, 2}, {3, 4}};
        double[] massAxis = {100, 200};
        double[] ppmAxis = {1, -1};
        DensityGrid g = new DensityGrid(values, massAxis, ppmAxis);
        values[0][0] = 99;
        massAxis[1] = 99;
        ppmAxis[0] = 99;
        g.column(0)[1] = 99;
        g.row(1)[1] = 99;
        assertEquals(1.0, g.value(0, 0));
        assertEquals(3.0, g.value(1, 0));
        assertEquals(4.0, g.value(1, 1));
        assertEquals(200.0, g.massAt(1));
        assertEquals(1.0, g.ppmAt(0));
    }

    @Test
    void invalidGridSize() {
        assertThrows(IllegalArgumentException.class, () -> new DensityMapBuilder(1));
    }
}
