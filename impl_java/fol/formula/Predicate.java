package fol.formula;

import fol.Substitution;
import fol.term.Term;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record Predicate(PSymbol symbol, List<Term> args) implements Formula {

    public Predicate {
        assert symbol.arity() == args.size();
        args = List.copyOf(args);
    }

    public Predicate(String symbolStr, List<Term> args) {
        this(new PSymbol(symbolStr, args.size()), args);
    }

    @Override
    public int countLiterals() {
        return 1; // Each predicate counts as one literal
    }

    @Override
    public Formula applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return symbol.name();
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Term> skolemTerms() {
        Set<Term> out = new HashSet<>();
        for (Term t : args) out.addAll(t.skolemTerms());
        return out;
    }
}
