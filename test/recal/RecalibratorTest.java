package recal;

import edu.umich.andykong.massrecal.core.ElementBounds;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;
import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import edu.umich.andykong.massrecal.recal.ErrorCurve;
import edu.umich.andykong.massrecal.recal.ErrorEstimator;
import edu.umich.andykong.massrecal.recal.Recalibrator;
import edu.umich.andykong.massrecal.recal.ReferenceLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecalibratorTest {

    @TempDir
    Path tmp;

    @Test
    void givenCurveIsApplied() {
        ErrorCurve curve = new ErrorCurve(new double[]{100, 200}, new double[]{5, -5});
        PeakList spec = new PeakList(new double[]{100.0, 100.01, 200.005}, new double[]{1, 1, 1});
        PeakList out = new Recalibrator().recalibrate(spec, curve, Recalibrator.HOW_ASSIGN, false);
        assertArrayEquals(new double[]{100.0, 100.01050005, 200.005}, out.getMasses(), 1e-9);
        assertEquals(Recalibrator.HOW_ASSIGN, out.metadata.get(Recalibrator.metadataKey));
        assertFalse(spec.metadata.containsKey(Recalibrator.metadataKey));
    }

    @Test
    void assignRecalibration() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 1.0, 0.3, 42);
        spec.metadata.put("name", "synthetic");
        PeakList out = new Recalibrator().recalibrate(spec);

        assertEquals(spec.size(), out.size());
        assertEquals("assign", out.metadata.get("recalibrate"));
        assertEquals("synthetic", out.metadata.get("name"));
        // the input keeps its masses
        assertArrayEquals(SyntheticSpectra.formulaSpectrum(5, 1.0, 0.3, 42).getMasses(), spec.getMasses());

        double after = out.assign(3.0, ElementBounds.defaults(), '-').meanRelativeError();
        assertEquals(0.0, after, 0.2);
    }

    @Test
    void stagesCanBeDisabled() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 1.0, 0.3, 42);
        // 1500.5 cannot be assigned, so the fitted range ends below it
        spec.add(new PeakRow(1500.5, 1));

        ErrorCurve full = new Recalibrator().estimate(spec, Recalibrator.HOW_ASSIGN, false);
        assertEquals(1500.5, full.getMaxMass(), 1e-9);

        Map<String, String> off = new HashMap<>();
        off.put("extrapolate", "false");
        off.put("zeroshift", "false");
        RecalParams noStages = RecalParams.defaults().with(off);
        ErrorCurve raw = new Recalibrator(noStages).estimate(spec, Recalibrator.HOW_ASSIGN, false);
        assertTrue(raw.getMaxMass() < 1000);
        assertEquals(0.0, raw.getPpm(0));
    }

    @Test
    void defaultAssignEstimateIsAssignError() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 1.0, 0.3, 42);
        ErrorCurve viaRecalibrator = new Recalibrator().estimate(spec, Recalibrator.HOW_ASSIGN, false);
        ErrorCurve direct = new ErrorEstimator(RecalParams.defaults()).assignError(spec);
        assertArrayEquals(direct.getMasses(), viaRecalibrator.getMasses());
        assertArrayEquals(direct.getPpms(), viaRecalibrator.getPpms());

        RecalParams noShift = RecalParams.defaults().with(Collections.singletonMap("zeroshift", "false"));
        ErrorCurve unshifted = new Recalibrator(noShift).estimate(spec, Recalibrator.HOW_ASSIGN, false);
        assertArrayEquals(direct.getMasses(), unshifted.getMasses());
        double shift = unshifted.getPpm(0) - direct.getPpm(0);
        for (int i = 0; i < direct.size(); i++)
            assertEquals(shift, unshifted.getPpm(i) - direct.getPpm(i), 1e-9);
    }

    @Test
    void parallelEstimateMatchesSerial() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 1.0, 0.3, 42);
        ErrorCurve serial = new Recalibrator().estimate(spec, Recalibrator.HOW_ASSIGN, false);
        RecalParams threaded = RecalParams.defaults().with(Collections.singletonMap("threads", "3"));
        ErrorCurve parallel = new Recalibrator(threaded).estimate(spec, Recalibrator.HOW_ASSIGN, false);
        assertArrayEquals(serial.getPpms(), parallel.getPpms());
    }

    @Test
    void etalonRecalibration() throws IOException {
        PeakList etalon = SyntheticSpectra.formulaSpectrum(5, 0.0, 0.0, 1);
        File f = tmp.resolve("etalon.csv").toFile();
        etalon.writeCsv(f, ",");

        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 2.0, 0.3, 1);
        PeakList out = new Recalibrator().recalibrate(spec, null, f.getPath(), false);
        assertEquals(spec.size(), out.size());
        assertEquals(f.getPath(), out.metadata.get(Recalibrator.metadataKey));
    }

    static double meanAbsPpm(double[] observed, double[] exact) {
        double sum = 0;
        for (int i = 0; i < observed.length; i++)
            sum += Math.abs((observed[i] - exact[i]) / observed[i] * 1e6);
        return sum / observed.length;
    }

    @Test
    void etalonRemovesLinearDrift() throws IOException {
        PeakList etalon = SyntheticSpectra.formulaSpectrum(5, 0.0, 0.0, 1);
        File f = tmp.resolve("etalon.csv").toFile();
        etalon.writeCsv(f, ",");

        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 0.0, 0.008, 0.1, 1);
        double before = meanAbsPpm(spec.getMasses(), etalon.getMasses());
        assertTrue(before > 0.8, "drift before " + before);

        PeakList out = new Recalibrator().recalibrate(spec, null, f.getPath(), false);
        double after = meanAbsPpm(out.getMasses(), etalon.getMasses());
        assertTrue(after < 0.45, "drift after " + after);
        assertTrue(after < before / 2);
    }

    @Test
    void assignRemovesLinearDrift() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 0.0, 0.008, 0.1, 42);
        PeakList exact = SyntheticSpectra.formulaSpectrum(5, 0.0, 0.0, 42);
        double before = meanAbsPpm(spec.getMasses(), exact.getMasses());
        assertTrue(before > 0.8, "drift before " + before);

        PeakList out = new Recalibrator().recalibrate(spec);
        double after = meanAbsPpm(out.getMasses(), exact.getMasses());
        assertTrue(after < 0.2, "drift after " + after);
        assertEquals(0.0, out.assign(3.0, ElementBounds.defaults(), '-').meanRelativeError(), 0.1);
    }

    @Test
    void missingEtalon() {
        PeakList spec = SyntheticSpectra.formulaSpectrum(5, 2.0, 0.3, 1);
        String path = tmp.resolve("missing.csv").toString();
        assertThrows(ReferenceLoadException.class, () -> new Recalibrator().recalibrate(spec, null, path, false));
    }

    @Test
    void unreadableEtalon() throws IOException {
        File f = tmp.resolve("bad.csv").toFile();
        Files.write(f.toPath(), Collections.singletonList("mz,intensity"));
        assertThrows(ReferenceLoadException.class, () -> Recalibrator.loadEtalon(f.getPath(), ","));
    }
}
