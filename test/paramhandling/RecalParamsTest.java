package paramhandling;

import edu.umich.andykong.massrecal.paramhandling.RecalParams;
import edu.umich.andykong.massrecal.paramhandling.RecalParams.StagePolicy;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecalParamsTest {

    @Test
    void defaults() {
        RecalParams p = RecalParams.defaults();
        assertEquals(3.0, p.ppmTolerance);
        assertEquals(3.0, p.ppmWindow);
        assertEquals(100, p.gridSize);
        assertEquals(0.95, p.ridgeQuantile);
        assertEquals(31, p.smoothWindow);
        assertEquals(5, p.smoothOrder);
        assertEquals(9, p.maxMultiplier);
        assertEquals(1000, p.intensityCap);
        assertEquals(0.9, p.etalonQuantile);
        assertEquals('-', p.ionMode);
        assertEquals(StagePolicy.AUTO, p.extrapolate);
        assertEquals(StagePolicy.AUTO, p.zeroshift);
        assertEquals(1, p.threads);
        assertEquals(",", p.csvSep);
        assertEquals(30, p.elementBounds.getMax("C"));
    }

    @Test
    void overrides() {
        Map<String, String> m = new HashMap<>();
        m.put("ppm_tolerance", "5");
        m.put("ion_mode", "+");
        m.put("csv_sep", "\\t");
        m.put("zeroshift", "false");
        m.put("element_bounds", "C:1-10,H:2-20,N:0-2");
        m.put("spectrum", "ignored.csv");
        RecalParams p = RecalParams.fromMap(m);
        assertEquals(5.0, p.ppmTolerance);
        assertEquals('+', p.ionMode);
        assertEquals("\t", p.csvSep);
        assertEquals(StagePolicy.NEVER, p.zeroshift);
        assertEquals(2, p.elementBounds.getMax("N"));

        Map<String, String> back = p.toMap();
        assertEquals("\\t", back.get("csv_sep"));
        assertEquals("false", back.get("zeroshift"));

        RecalParams q = p.with(Collections.singletonMap("grid_size", "50"));
        assertEquals(50, q.gridSize);
        assertEquals(5.0, q.ppmTolerance);
        assertEquals(100, p.gridSize);
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("smooth_window", "30")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("smooth_order", "31")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("grid_size", "20")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("ppm_tolerance", "-1")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("ppm_tolerance", "abc")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("ridge_quantile", "1.5")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("ion_mode", "x")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("extrapolate", "maybe")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("element_bounds", "C:5")));
        assertThrows(IllegalArgumentException.class, () -> RecalParams.fromMap(Collections.singletonMap("csv_sep", "")));
    }

    @Test
    void stagePolicy() {
        assertEquals(StagePolicy.AUTO, StagePolicy.parse(" Auto "));
        assertEquals(StagePolicy.ALWAYS, StagePolicy.parse("1"));
        assertEquals(StagePolicy.NEVER, StagePolicy.parse("FALSE"));
        assertTrue(StagePolicy.AUTO.resolve(true));
        assertFalse(StagePolicy.AUTO.resolve(false));
        assertTrue(StagePolicy.ALWAYS.resolve(false));
        assertFalse(StagePolicy.NEVER.resolve(true));
    }
}
