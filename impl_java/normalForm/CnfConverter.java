package normalForm;

import fol.formula.Formula;
import fol.term.SkolemSymbols;
import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import normalForm.stages.*;

/**
 * Converts first-order formulas to conjunctive normal form by running the rewrite stages in order:
 * implication elimination, negation normal form, Skolemization, universal drop and distribution.
 * <p>
 * Skolem symbols are drawn from the converter's {@link SkolemSymbols}, so they stay unique across
 * every formula converted by the same instance.
 */
public class CnfConverter {
    public static final String ORIGINAL = "Original";

    private final SkolemSymbols symbols;
    private final List<RewriteStage> stages;
    private final PrintStream out;

    public CnfConverter(SkolemSymbols symbols, PrintStream out) {
        this.symbols = symbols;
        this.out = out;
        this.stages = List.of(
                new ImplicationElim(),
                new NegationNormalForm(),
                new Skolemization(symbols),
                new ForallDrop(),
                new Distribution());
    }

    public CnfConverter() {
        this(new SkolemSymbols(), System.out);
    }

    public List<RewriteStage> getStages() {
        return stages;
    }

    public Formula toCNF(Formula formula) {
        return toCNF(formula, false);
    }

    /**
     * @param verbose print the formula before the first stage and after every stage, one line each
     * @return the formula in CNF
     */
    public Formula toCNF(Formula formula, boolean verbose) {
        long issuedBefore = symbols.issued();
        Conversion conversion = convert(formula);
        if (verbose) {
            conversion.steps().forEach((label, step) -> out.println(label + ": " + step));
            out.printf("Literals: %d -> %d, Skolem symbols: %d%n",
                    formula.countLiterals(),
                    conversion.result().countLiterals(),
                    symbols.issued() - issuedBefore);
        }
        return conversion.result();
    }

    /**
     * Run every stage and keep each intermediate result.
     *
     * @return the input under {@link #ORIGINAL}, then each stage's output under its name
     */
    public Conversion convert(Formula formula) {
        Map<String, Formula> steps = new LinkedHashMap<>();
        steps.put(ORIGINAL, formula);
        Formula current = formula;
        for (RewriteStage stage : stages) {
            current = stage.apply(current);
            steps.put(stage.getName(), current);
        }
        return new Conversion(Collections.unmodifiableMap(steps), current);
    }

    public record Conversion(Map<String, Formula> steps, Formula result) {
        public Formula step(String name) {
            return steps.get(name);
        }
    }
}
