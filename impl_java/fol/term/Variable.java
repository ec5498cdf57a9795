package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

public record Variable(String name) implements Term {

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<Term> skolemTerms() {
        return Set.of();
    }
}
