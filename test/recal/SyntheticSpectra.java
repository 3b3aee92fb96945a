package recal;

import edu.umich.andykong.massrecal.core.BruttoGenerator;
import edu.umich.andykong.massrecal.core.ElementBounds;
import edu.umich.andykong.massrecal.core.FormulaAssigner;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;

import java.util.Random;

/**
 * Peak lists built from exact formula masses with a known ppm error.
 */
public class SyntheticSpectra {

    public static final String bounds = "C:10-20,H:10-30,O:2-10";

    /**
     * Every step-th generated formula as a deprotonated ion, shifted by offsetPpm plus uniform
     * noise in [-noisePpm, noisePpm].
     */
    public static PeakList formulaSpectrum(int step, double offsetPpm, double noisePpm, long seed) {
        return formulaSpectrum(step, offsetPpm, 0.0, noisePpm, seed);
    }

    /**
     * As above with a linear drift of slopePpmPerDa, measured from the lightest generated ion.
     */
    public static PeakList formulaSpectrum(int step, double offsetPpm, double slopePpmPerDa, double noisePpm, long seed) {
        BruttoGenerator gen = new BruttoGenerator(ElementBounds.parse(bounds));
        Random rnd = new Random(seed);
        PeakList pl = new PeakList();
        double shift = FormulaAssigner.ionShift('-');
        double first = gen.masses[0] + shift;
        for (int i = 0; i < gen.size(); i += step) {
            double ion = gen.masses[i] + shift;
            double err = offsetPpm + slopePpmPerDa * (ion - first) + (rnd.nextDouble() * 2 - 1) * noisePpm;
            pl.add(new PeakRow(ion * (1 + err / 1e6), 10 + rnd.nextInt(1000)));
        }
        return pl;
    }
}
