package fol.formula;

import fol.Substitution;
import fol.term.Term;
import java.util.HashSet;
import java.util.Set;

/**
 * Material implication. Removed by the first rewrite stage, together with {@link Iff}.
 */
public record Implies(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Implies(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " → " + right + ")";
    }

    @Override
    public int countLiterals() {
        return left.countLiterals() + right.countLiterals();
    }

    @Override
    public Set<Term> skolemTerms() {
        Set<Term> out = new HashSet<>(left.skolemTerms());
        out.addAll(right.skolemTerms());
        return out;
    }
}
