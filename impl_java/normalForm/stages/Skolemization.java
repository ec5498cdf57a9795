package normalForm.stages;

import fol.Substitution;
import fol.formula.*;
import fol.term.SkolemSymbols;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces every existential variable with a fresh Skolem term and removes the {@link Exists} node.
 * <p>
 * An existential under no universal gets a fresh constant. One under the universals x1..xn (outermost
 * first) gets a fresh function applied to x1..xn in that order. Universal quantifiers are kept; they
 * are removed by {@link ForallDrop}. The input must be in negation normal form.
 */
public class Skolemization implements RewriteStage {

    private final SkolemSymbols symbols;

    public Skolemization(SkolemSymbols symbols) {
        this.symbols = symbols;
    }

    @Override
    public Formula apply(Formula formula) {
        return skolemize(formula, List.of());
    }

    private Formula skolemize(Formula formula, List<Variable> universals) {
        if (formula instanceof Forall forall) {
            List<Variable> inScope = new ArrayList<>(universals);
            inScope.add(forall.var());
            return new Forall(forall.var(), skolemize(forall.formula(), List.copyOf(inScope)));
        } else if (formula instanceof Exists exists) {
            Term witness = universals.isEmpty()
                    ? symbols.nextConstant()
                    : symbols.nextFunction(universals.stream().map(Term.class::cast).toList());
            Formula body = Substitution.substitute(exists.formula(), exists.var(), witness);
            return skolemize(body, universals);
        } else if (formula instanceof And and) {
            return new And(skolemize(and.left(), universals), skolemize(and.right(), universals));
        } else if (formula instanceof Or or) {
            return new Or(skolemize(or.left(), universals), skolemize(or.right(), universals));
        } else if (formula instanceof Not not) {
            return new Not(skolemize(not.formula(), universals));
        } else if (formula instanceof Predicate || formula instanceof Implies || formula instanceof Iff) {
            return formula;
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    @Override
    public String getName() {
        return "Skolemized";
    }
}
