package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.Set;

public record Exists(Variable var, Formula formula) implements Formula {

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    @Override
    public Formula applySub(Substitution substitution) {
        // The bound variable is not pruned from the substitution: nested quantifiers must not reuse a name
        return new Exists(var, formula.applySub(substitution));
    }

    @Override
    public String toString() {
        return String.format("∃%s.%s", var, formula);
    }

    @Override
    public Set<Term> skolemTerms() {
        return formula.skolemTerms();
    }
}
