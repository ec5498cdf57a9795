package fol;

import fol.formula.And;
import fol.formula.Exists;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.term.Constant;
import fol.term.Function;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Language {

    public static Variable var(String name) {
        return new Variable(name);
    }

    public static Constant constant(String name) {
        return new Constant(name);
    }

    public static Function function(String name, Term... args) {
        return new Function(name, List.of(args));
    }

    public static Predicate pred(String name, Term... args) {
        return new Predicate(name, List.of(args));
    }

    /**
     * Shorthand where every argument is a variable, e.g. {@code pred("R", "x", "y")} for R(x, y).
     */
    public static Predicate pred(String name, String firstVar, String... moreVars) {
        List<Term> args = new ArrayList<>();
        args.add(var(firstVar));
        Arrays.stream(moreVars).map(Language::var).forEach(args::add);
        return new Predicate(name, args);
    }

    public static Formula not(Formula formula) {
        return new Not(formula);
    }

    public static Formula and(Formula left, Formula right) {
        return new And(left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return new Or(left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return new Implies(left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return new Iff(left, right);
    }

    public static Formula forall(String var, Formula formula) {
        return new Forall(var(var), formula);
    }

    public static Formula exists(String var, Formula formula) {
        return new Exists(var(var), formula);
    }
}
