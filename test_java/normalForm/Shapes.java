package normalForm;

import fol.formula.*;

/**
 * Structural checks for the postcondition of each rewrite stage.
 */
public final class Shapes {

    private Shapes() {
    }

    public static boolean hasImplications(Formula formula) {
        return count(formula, Implies.class) + count(formula, Iff.class) > 0;
    }

    public static boolean isNnf(Formula formula) {
        if (formula instanceof Not not) return not.isLiteral();
        if (formula instanceof And and) return isNnf(and.left()) && isNnf(and.right());
        if (formula instanceof Or or) return isNnf(or.left()) && isNnf(or.right());
        if (formula instanceof Forall forall) return isNnf(forall.formula());
        if (formula instanceof Exists exists) return isNnf(exists.formula());
        return formula instanceof Predicate;
    }

    /**
     * A conjunction of disjunctions of literals, nested as binary nodes.
     */
    public static boolean isCnf(Formula formula) {
        if (formula instanceof And and) return isCnf(and.left()) && isCnf(and.right());
        return isClause(formula);
    }

    private static boolean isClause(Formula formula) {
        if (formula instanceof Or or) return isClause(or.left()) && isClause(or.right());
        return isLiteral(formula);
    }

    public static boolean isLiteral(Formula formula) {
        return formula instanceof Predicate || formula instanceof Not not && not.isLiteral();
    }

    public static int count(Formula formula, Class<? extends Formula> kind) {
        int own = kind.isInstance(formula) ? 1 : 0;
        if (formula instanceof Not not) return own + count(not.formula(), kind);
        if (formula instanceof And and) return own + count(and.left(), kind) + count(and.right(), kind);
        if (formula instanceof Or or) return own + count(or.left(), kind) + count(or.right(), kind);
        if (formula instanceof Implies implies) return own + count(implies.left(), kind) + count(implies.right(), kind);
        if (formula instanceof Iff iff) return own + count(iff.left(), kind) + count(iff.right(), kind);
        if (formula instanceof Forall forall) return own + count(forall.formula(), kind);
        if (formula instanceof Exists exists) return own + count(exists.formula(), kind);
        return own;
    }
}
