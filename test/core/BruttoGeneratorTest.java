package core;

import edu.umich.andykong.massrecal.core.BruttoGenerator;
import edu.umich.andykong.massrecal.core.ElementBounds;
import edu.umich.andykong.massrecal.core.FormulaAssigner;
import edu.umich.andykong.massrecal.core.MassTools;
import edu.umich.andykong.massrecal.core.PeakList;
import edu.umich.andykong.massrecal.core.PeakRow;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class BruttoGeneratorTest {

    @Test
    void calcMass() {
        assertEquals(14.01565006, BruttoGenerator.calcMass(1, 2, 0), 1e-7);
        assertEquals(43.98982924, BruttoGenerator.calcMass(1, 0, 2), 1e-7);
        assertEquals(212.06847349, BruttoGenerator.calcMass(10, 12, 5), 1e-7);
    }

    @Test
    void formulasSortedAndPlausible() {
        BruttoGenerator gen = new BruttoGenerator(ElementBounds.parse("C:1-6,H:0-14,O:0-3"));
        assertTrue(gen.size() > 0);
        for (int i = 1; i < gen.size(); i++)
            assertTrue(gen.masses[i] >= gen.masses[i - 1]);
        for (int[] f : gen.formulas) {
            assertEquals(0, f[1] % 2, "odd hydrogen count");
            assertTrue(f[0] - f[1] / 2.0 + 1 >= 0, "negative double bond equivalent");
        }
        // C6H14 is saturated, C6H16 is not generated (bound) and C1H6 is implausible
        boolean hexane = false;
        for (int[] f : gen.formulas) {
            if (f[0] == 6 && f[1] == 14 && f[2] == 0)
                hexane = true;
            assertFalse(f[0] == 1 && f[1] == 6);
        }
        assertTrue(hexane);
    }

    @Test
    void assignNearestFormula() {
        double ion = BruttoGenerator.calcMass(10, 12, 5) - MassTools.protonMass;
        PeakList pl = new PeakList();
        pl.add(new PeakRow(ion * (1 + 1e-6), 100));
        pl.add(new PeakRow(ion + 0.5, 50));

        int n = new FormulaAssigner(ElementBounds.defaults(), '-').assign(pl, 3.0);
        assertEquals(1, n);
        PeakRow r = pl.rows.get(0);
        assertTrue(r.isAssigned());
        assertEquals("C10H12O5", r.formulaString());
        assertEquals(ion, r.calcMass, 1e-9);
        assertEquals(1.0, r.relError, 1e-3);
        assertFalse(pl.rows.get(1).isAssigned());
        assertTrue(Double.isNaN(pl.rows.get(1).relError));
    }

    @Test
    void ionShift() {
        assertEquals(-MassTools.protonMass, FormulaAssigner.ionShift('-'));
        assertEquals(MassTools.protonMass, FormulaAssigner.ionShift('+'));
        assertEquals(0.0, FormulaAssigner.ionShift('0'));
        assertThrows(IllegalArgumentException.class, () -> FormulaAssigner.ionShift('x'));
    }
}
