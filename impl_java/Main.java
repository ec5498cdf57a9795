import static fol.Language.*;

import fol.formula.Formula;
import fol.term.SkolemSymbols;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.List;
import normalForm.CnfConverter;

public class Main {

    public static void main(String[] args) {

        if (args.length > 0) {
            try {
                System.setOut(new PrintStream(new FileOutputStream(args[0]), true));
            } catch (FileNotFoundException e) {
                System.err.println("Could not redirect output to " + args[0] + ", printing to console instead.");
                e.printStackTrace();
            }
        }

        // One generator for the whole run so Skolem symbols never repeat between examples
        final var converter = new CnfConverter(new SkolemSymbols(), System.out);
        for (var formula : examples()) {
            converter.toCNF(formula, true);
            System.out.println("---------------------------------------------------\n");
        }
    }

    private static List<Formula> examples() {
        return List.of(
                // ∀x (P(x) → ∃y (Q(y) ∧ R(x,y)))
                forall("x", implies(
                        pred("P", "x"),
                        exists("y", and(pred("Q", "y"), pred("R", "x", "y"))))),
                // ∃x ∀y ∃z (Loves(y, z) ↔ ¬Knows(x, z))
                exists("x", forall("y", exists("z", iff(
                        pred("Loves", "y", "z"),
                        not(pred("Knows", "x", "z")))))),
                // ¬∃x ((A(x) ∧ B(x)) ∨ (C(x) ∧ D(x)))
                not(exists("x", or(
                        and(pred("A", "x"), pred("B", "x")),
                        and(pred("C", "x"), pred("D", "x"))))));
    }
}
