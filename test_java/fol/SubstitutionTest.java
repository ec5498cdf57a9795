package fol;

import fol.formula.Formula;
import fol.term.Constant;
import fol.term.Term;
import fol.term.Variable;
import org.junit.Test;

import static fol.Language.*;
import static org.junit.Assert.*;

public class SubstitutionTest {

    private final Variable x = var("x");
    private final Variable y = var("y");
    private final Constant a = constant("a");

    @Test
    public void replacesOnlyTheGivenVariable() {
        Formula formula = and(pred("R", x, y, x), not(pred("P", y)));
        Formula result = Substitution.substitute(formula, x, a);
        assertEquals(and(pred("R", a, y, a), not(pred("P", y))), result);
    }

    @Test
    public void replacesInsideFunctionArguments() {
        Term skolem = function("$f1", y);
        Formula formula = pred("P", function("g", x, a), x);
        Formula result = Substitution.substitute(formula, x, skolem);
        assertEquals(pred("P", function("g", skolem, a), skolem), result);
    }

    @Test
    public void descendsThroughAllConnectives() {
        Formula formula = forall("y", exists("z", iff(pred("P", "x"), implies(pred("Q", "x"), pred("R", "y", "z")))));
        Formula result = Substitution.substitute(formula, x, a);
        assertEquals(forall("y", exists("z", iff(pred("P", a), implies(pred("Q", a), pred("R", "y", "z"))))), result);
    }

    @Test
    public void descendsIntoQuantifierBindingSameName() {
        // No capture avoidance: callers keep bound names distinct
        Formula formula = and(pred("P", "x"), forall("x", pred("Q", "x")));
        Formula result = Substitution.substitute(formula, x, a);
        assertEquals(and(pred("P", a), forall("x", pred("Q", a))), result);
    }

    @Test
    public void leavesInputUntouched() {
        Formula formula = pred("P", "x", "y");
        Substitution.substitute(formula, x, a);
        assertEquals(pred("P", "x", "y"), formula);
    }

    @Test
    public void missingVariableIsIdentity() {
        Formula formula = pred("P", y, a);
        assertEquals(formula, Substitution.substitute(formula, x, constant("b")));
    }
}
