package fol.formula;

import fol.Substitution;
import fol.term.Term;
import java.util.Set;

public record Not(Formula formula) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public String toString() {
        return "¬" + formula;
    }

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    /**
     * @return true for a negated predicate, the only negation allowed in NNF
     */
    public boolean isLiteral() {
        return formula instanceof Predicate;
    }

    @Override
    public Set<Term> skolemTerms() {
        return formula.skolemTerms();
    }
}
