package fol.formula;

import fol.Substitution;
import fol.term.Term;
import java.util.Set;

public sealed interface Formula permits Predicate, Not, And, Or, Implies, Iff, Forall, Exists {
    /**
     * Apply the substitution to every term in the formula, quantified bodies included.
     *
     * @param substitution variables to replace
     * @return a new formula; this one is left untouched
     */
    Formula applySub(Substitution substitution);

    /**
     * Get a set of skolem terms (generated constants and applied function symbols) inside the formula.
     *
     * @return a set of skolem terms inside the formula
     */
    Set<Term> skolemTerms();

    int countLiterals();
}
