package fol.formula;

import fol.Substitution;
import fol.term.Term;
import java.util.HashSet;
import java.util.Set;

public record Or(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Or(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " ∨ " + right + ")";
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
