package normalForm.stages;

import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Or;

/**
 * Distributes disjunction over conjunction until no {@link Or} has an {@link And} child.
 * <p>
 * The output can be exponentially larger than the input; every clause is rebuilt, nothing is shared
 * or cached between branches.
 */
public class Distribution implements RewriteStage {

    @Override
    public Formula apply(Formula formula) {
        if (formula instanceof And and) {
            return new And(apply(and.left()), apply(and.right()));
        }
        if (!(formula instanceof Or or)) {
            // Literals, and anything left over by an unmet precondition
            return formula;
        }
        Formula left = apply(or.left());
        Formula right = apply(or.right());
        if (left instanceof And leftAnd) {
            // (A ∧ B) ∨ C → (A ∨ C) ∧ (B ∨ C)
            return new And(apply(new Or(leftAnd.left(), right)), apply(new Or(leftAnd.right(), right)));
        }
        if (right instanceof And rightAnd) {
            // A ∨ (B ∧ C) → (A ∨ B) ∧ (A ∨ C)
            return new And(apply(new Or(left, rightAnd.left())), apply(new Or(left, rightAnd.right())));
        }
        return new Or(left, right);
    }

    @Override
    public String getName() {
        return "CNF";
    }
}
