package normalForm.stages;

import fol.formula.*;

public class ImplicationElim implements RewriteStage {

    @Override
    public Formula apply(Formula formula) {
        if (formula instanceof Predicate) {
            return formula;
        } else if (formula instanceof Not not) {
            return new Not(apply(not.formula()));
        } else if (formula instanceof And and) {
            return new And(apply(and.left()), apply(and.right()));
        } else if (formula instanceof Or or) {
            return new Or(apply(or.left()), apply(or.right()));
        } else if (formula instanceof Implies implies) {
            // A → B ≡ ¬A ∨ B
            return new Or(new Not(apply(implies.left())), apply(implies.right()));
        } else if (formula instanceof Iff iff) {
            // A ↔ B ≡ (¬A ∨ B) ∧ (¬B ∨ A)
            Formula left = apply(iff.left());
            Formula right = apply(iff.right());
            return new And(new Or(new Not(left), right), new Or(new Not(right), left));
        } else if (formula instanceof Forall forall) {
            return new Forall(forall.var(), apply(forall.formula()));
        } else if (formula instanceof Exists exists) {
            return new Exists(exists.var(), apply(exists.formula()));
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    @Override
    public String getName() {
        return "Implications removed";
    }
}
