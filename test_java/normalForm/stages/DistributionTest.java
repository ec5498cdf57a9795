package normalForm.stages;

import fol.formula.Formula;
import normalForm.Shapes;
import org.junit.Test;

import static fol.Language.*;
import static org.junit.Assert.*;

public class DistributionTest {

    private final Distribution stage = new Distribution();

    private final Formula a = pred("A");
    private final Formula b = pred("B");
    private final Formula c = pred("C");
    private final Formula d = pred("D");

    @Test
    public void conjunctionOnTheLeft() {
        assertEquals(and(or(a, c), or(b, c)), stage.apply(or(and(a, b), c)));
    }

    @Test
    public void conjunctionOnTheRight() {
        assertEquals(and(or(a, b), or(a, c)), stage.apply(or(a, and(b, c))));
    }

    @Test
    public void conjunctionsOnBothSides() {
        Formula expected = and(
                and(or(a, c), or(a, d)),
                and(or(b, c), or(b, d)));
        Formula result = stage.apply(or(and(a, b), and(c, d)));
        assertEquals(expected, result);
        assertEquals(8, result.countLiterals());
    }

    @Test
    public void nestedDisjunction() {
        Formula result = stage.apply(or(a, or(not(b), and(c, d))));
        assertEquals(and(or(a, or(not(b), c)), or(a, or(not(b), d))), result);
        assertTrue(Shapes.isCnf(result));
    }

    @Test
    public void blowupIsKept() {
        // (A1 ∧ B1) ∨ (A2 ∧ B2) ∨ (A3 ∧ B3) has 2^3 clauses of 3 literals
        Formula formula = or(or(and(pred("A1"), pred("B1")), and(pred("A2"), pred("B2"))), and(pred("A3"), pred("B3")));
        Formula result = stage.apply(formula);
        assertTrue(Shapes.isCnf(result));
        assertEquals(24, result.countLiterals());
    }

    @Test
    public void literalsAndConjunctionsAreKept() {
        assertEquals(not(a), stage.apply(not(a)));
        assertEquals(and(a, or(b, not(c))), stage.apply(and(a, or(b, not(c)))));
    }
}
