package recal;

import edu.umich.andykong.massrecal.core.BruttoGenerator;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.recal.ErrorScatter;
import edu.umich.andykong.massrecal.recal.MassDifferenceMatcher;
import edu.umich.andykong.massrecal.recal.MassDifferenceSet;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class MassDifferenceMatcherTest {

    static final double CH2 = BruttoGenerator.calcMass(1, 2, 0);
    static final double CO = BruttoGenerator.calcMass(1, 0, 1);

    @Test
    void differenceSet() {
        MassDifferenceSet one = new MassDifferenceSet(1);
        assertEquals(6, one.size());
        assertEquals(CH2, one.getDifferences()[0], 1e-12);
        double[] d = new MassDifferenceSet(9).getDifferences();
        assertEquals(54, d.length);
        for (int i = 1; i < d.length; i++)
            assertTrue(d[i] > d[i - 1]);
        assertEquals(9 * BruttoGenerator.calcMass(1, 0, 2), d[d.length - 1], 1e-9);

        assertArrayEquals(new double[]{1.0, 2.0}, new MassDifferenceSet(new double[]{2.0, 1.0, 2.0}).getDifferences());
        assertThrows(IllegalArgumentException.class, () -> new MassDifferenceSet(0));
        assertThrows(IllegalArgumentException.class, () -> new MassDifferenceSet(new double[]{-1.0}));
    }

    @Test
    void exactAndShiftedPartners() {
        MassDifferenceMatcher matcher = new MassDifferenceMatcher(new MassDifferenceSet(new double[]{CH2, CO}), 3.0, 1000);
        double coPartner = (200.0 + CO) * (1 + 1e-6);
        double[] sorted = {200.0, 200.0 + CH2, coPartner};
        ErrorScatter s = matcher.match(sorted, new double[]{200.0});
        assertEquals(2, s.size());
        assertEquals(200.0, s.getMass(0));
        assertEquals(0.0, s.getPpm(0), 1e-6);
        assertEquals(200.0, s.getMass(1));
        assertEquals(1.0, s.getPpm(1), 1e-6);
    }

    @Test
    void outsideTolerance() {
        MassDifferenceMatcher matcher = new MassDifferenceMatcher(new MassDifferenceSet(new double[]{CH2}), 3.0, 1000);
        double[] sorted = {200.0, (200.0 + CH2) * (1 + 5e-6)};
        assertTrue(matcher.match(sorted, new double[]{200.0}).isEmpty());
        assertTrue(matcher.match(new double[0], new double[]{200.0}).isEmpty());
    }

    @Test
    void intensityCapLimitsAnchors() {
        MassDifferenceMatcher matcher = new MassDifferenceMatcher(new MassDifferenceSet(new double[]{CH2}), 3.0, 1);
        PeakList pl = new PeakList(new double[]{200.0, 200.0 + CH2, 200.0 + 2 * CH2}, new double[]{1, 100, 1});
        ErrorScatter s = matcher.match(pl);
        // only the most intense peak starts a difference
        assertEquals(1, s.size());
        assertEquals(200.0 + CH2, s.getMass(0), 1e-12);

        ErrorScatter all = new MassDifferenceMatcher(new MassDifferenceSet(new double[]{CH2}), 3.0, 1000).match(pl);
        assertEquals(2, all.size());
    }

    @Test
    void equalShiftCancels() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 2.0, 0.0, 1);
        ErrorScatter s = new MassDifferenceMatcher(new MassDifferenceSet(9), 3.0, 1000).match(spec);
        assertFalse(s.isEmpty());
        // a common ppm offset barely moves the differences between peaks
        for (double p : s.getPpms())
            assertTrue(Math.abs(p) < 2.0, "ppm " + p);
    }
}
