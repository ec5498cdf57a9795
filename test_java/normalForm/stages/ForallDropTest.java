package normalForm.stages;

import fol.formula.Formula;
import org.junit.Test;

import static fol.Language.*;
import static org.junit.Assert.*;

public class ForallDropTest {

    private final ForallDrop stage = new ForallDrop();

    @Test
    public void stripsLeadingUniversals() {
        Formula matrix = or(not(pred("P", "x")), pred("Q", "x", "y"));
        assertEquals(matrix, stage.apply(forall("x", forall("y", matrix))));
    }

    @Test
    public void quantifierFreeFormulaIsReturnedAsIs() {
        Formula formula = and(pred("P", "x"), pred("Q", "y"));
        assertSame(formula, stage.apply(formula));
    }

    @Test
    public void nestedUniversalsAreNotLookedFor() {
        Formula formula = forall("x", and(pred("P", "x"), forall("y", pred("Q", "y"))));
        assertEquals(and(pred("P", "x"), forall("y", pred("Q", "y"))), stage.apply(formula));
    }
}
