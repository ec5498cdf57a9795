package normalForm.stages;

import fol.formula.*;

/**
 * Pushes negations down to the predicates. Expects a formula without {@link Implies} or {@link Iff};
 * any that remain are passed through untouched.
 */
public class NegationNormalForm implements RewriteStage {

    @Override
    public Formula apply(Formula formula) {
        if (formula instanceof Not not) {
            return negate(not.formula());
        } else if (formula instanceof And and) {
            return new And(apply(and.left()), apply(and.right()));
        } else if (formula instanceof Or or) {
            return new Or(apply(or.left()), apply(or.right()));
        } else if (formula instanceof Forall forall) {
            return new Forall(forall.var(), apply(forall.formula()));
        } else if (formula instanceof Exists exists) {
            return new Exists(exists.var(), apply(exists.formula()));
        } else if (formula instanceof Predicate || formula instanceof Implies || formula instanceof Iff) {
            return formula;
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    /**
     * @return the NNF of ¬inner
     */
    private Formula negate(Formula inner) {
        if (inner instanceof Not not) {
            // Double negation: ¬¬A → A
            return apply(not.formula());
        } else if (inner instanceof And and) {
            // De Morgan: ¬(A ∧ B) → ¬A ∨ ¬B
            return new Or(apply(new Not(and.left())), apply(new Not(and.right())));
        } else if (inner instanceof Or or) {
            // De Morgan: ¬(A ∨ B) → ¬A ∧ ¬B
            return new And(apply(new Not(or.left())), apply(new Not(or.right())));
        } else if (inner instanceof Forall forall) {
            // ¬∀x.P → ∃x.¬P
            return new Exists(forall.var(), apply(new Not(forall.formula())));
        } else if (inner instanceof Exists exists) {
            // ¬∃x.P → ∀x.¬P
            return new Forall(exists.var(), apply(new Not(exists.formula())));
        } else if (inner instanceof Predicate || inner instanceof Implies || inner instanceof Iff) {
            return new Not(inner);
        }
        throw new IllegalStateException("Unexpected formula type: " + inner.getClass());
    }

    @Override
    public String getName() {
        return "NNF";
    }
}
