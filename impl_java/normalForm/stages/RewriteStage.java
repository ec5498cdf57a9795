package normalForm.stages;

import fol.formula.Formula;

public interface RewriteStage {

    /**
     * Rewrites the formula into an equisatisfiable one. The input is never mutated; the result is a
     * freshly built tree that may share unchanged subtrees with it.
     *
     * @param formula the formula to rewrite, satisfying the stage's precondition
     * @return the rewritten formula
     */
    Formula apply(Formula formula);

    /**
     * @return label used when tracing the stage output
     */
    String getName();
}
