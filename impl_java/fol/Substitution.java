package fol;

import fol.formula.Formula;
import fol.term.Term;
import fol.term.Variable;

import java.util.HashMap;
import java.util.Map;

/**
 * Mapping from variables to the terms that replace them.
 * <p>
 * Applying a substitution replaces every occurrence of a mapped variable, including occurrences
 * below a quantifier that binds the same name. Callers must keep bound variable names distinct.
 */
public class Substitution {
    private final Map<Variable, Term> map;

    public Substitution() {
        this.map = new HashMap<>();
    }

    public static Substitution of(Variable var, Term term) {
        Substitution sub = new Substitution();
        sub.put(var, term);
        return sub;
    }

    /**
     * Replace {@code var} with {@code replacement} throughout {@code formula}.
     *
     * @return a new formula; the input is left untouched
     */
    public static Formula substitute(Formula formula, Variable var, Term replacement) {
        return formula.applySub(of(var, replacement));
    }

    public Term getOrDefault(Variable var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public void put(Variable var, Term term) {
        map.put(var, term);
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
