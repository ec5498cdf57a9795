package normalForm.stages;

import fol.formula.Formula;
import java.util.List;
import normalForm.Shapes;
import org.junit.Test;

import static fol.Language.*;
import static org.junit.Assert.*;

public class NegationNormalFormTest {

    private final NegationNormalForm nnf = new NegationNormalForm();

    @Test
    public void doubleNegationCollapses() {
        assertEquals(pred("P", "x"), nnf.apply(not(not(pred("P", "x")))));
        assertEquals(not(pred("P", "x")), nnf.apply(not(not(not(pred("P", "x"))))));
    }

    @Test
    public void deMorgan() {
        assertEquals(or(not(pred("A")), not(pred("B"))), nnf.apply(not(and(pred("A"), pred("B")))));
        assertEquals(and(not(pred("A")), not(pred("B"))), nnf.apply(not(or(pred("A"), pred("B")))));
    }

    @Test
    public void quantifierDuality() {
        assertEquals(exists("x", not(pred("P", "x"))), nnf.apply(not(forall("x", pred("P", "x")))));
        assertEquals(forall("x", not(pred("P", "x"))), nnf.apply(not(exists("x", pred("P", "x")))));
    }

    @Test
    public void recursesIntoRewrittenResults() {
        Formula formula = not(forall("x", not(and(pred("P", "x"), not(exists("y", pred("Q", "x", "y")))))));
        Formula expected = exists("x", and(pred("P", "x"), forall("y", not(pred("Q", "x", "y")))));
        assertEquals(expected, nnf.apply(formula));
    }

    @Test
    public void negatedPredicateIsBaseCase() {
        assertEquals(not(pred("P", "x")), nnf.apply(not(pred("P", "x"))));
    }

    @Test
    public void idempotent() {
        ImplicationElim elim = new ImplicationElim();
        List<Formula> formulas = List.of(
                not(not(pred("P", "x"))),
                not(iff(pred("A"), not(or(pred("B"), pred("C"))))),
                forall("x", implies(pred("P", "x"), not(exists("y", and(pred("Q", "y"), not(pred("R", "x", "y"))))))),
                not(forall("x", not(forall("y", or(not(pred("P", "x")), not(not(pred("Q", "y")))))))));
        for (Formula formula : formulas) {
            Formula once = nnf.apply(elim.apply(formula));
            assertTrue(once.toString(), Shapes.isNnf(once));
            assertEquals(once, nnf.apply(once));
        }
    }
}
