package normalForm.stages;

import fol.formula.Forall;
import fol.formula.Formula;

/**
 * Strips the chain of leading universal quantifiers, leaving their variables free (implicitly
 * universal). Quantifiers below the first non-{@link Forall} node are not looked for, so the
 * universals have to be in prenex position once the existentials are gone.
 */
public class ForallDrop implements RewriteStage {

    @Override
    public Formula apply(Formula formula) {
        Formula current = formula;
        while (current instanceof Forall forall) {
            current = forall.formula();
        }
        return current;
    }

    @Override
    public String getName() {
        return "Universals dropped";
    }
}
