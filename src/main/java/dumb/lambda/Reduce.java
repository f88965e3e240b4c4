package dumb.lambda;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Normal-order (leftmost-outermost) beta reduction, including under abstractions.
 */
public enum Reduce {
    ;

    /** Whether an abstraction is applied anywhere in the term. */
    public static boolean containsRedex(Term term) {
        if (term instanceof Term.App a)
            return a.fun() instanceof Term.Lam || containsRedex(a.fun()) || containsRedex(a.arg());
        if (term instanceof Term.Lam l)
            return containsRedex(l.body());
        return false;
    }

    /** One leftmost-outermost step; a term in normal form is returned as is. */
    public static Term step(Term term) {
        requireNonNull(term);
        if (term instanceof Term.App a) {
            if (a.fun() instanceof Term.Lam l)
                return Terms.subst(l.param(), a.arg(), l.body());
            if (containsRedex(a.fun()))
                return new Term.App(step(a.fun()), a.arg());
            if (containsRedex(a.arg()))
                return new Term.App(a.fun(), step(a.arg()));
            return a;
        }
        if (term instanceof Term.Lam l)
            return containsRedex(l.body()) ? new Term.Lam(l.param(), step(l.body())) : l;
        return term;
    }

    /** Steps until no redex remains or {@code maxSteps} steps have been taken. */
    public static Evaluation normalize(Term term, int maxSteps) {
        checkLimit(maxSteps);
        var t = requireNonNull(term);
        var steps = 0;
        while (containsRedex(t)) {
            if (steps == maxSteps)
                return new Evaluation.LimitExceeded(t, maxSteps);
            t = step(t);
            steps++;
        }
        return new Evaluation.NormalForm(t, steps);
    }

    /**
     * Every intermediate term, starting with {@code term}. The last element still
     * contains a redex when the limit stopped the reduction.
     */
    public static List<Term> trace(Term term, int maxSteps) {
        checkLimit(maxSteps);
        var t = requireNonNull(term);
        var out = new ArrayList<Term>();
        out.add(t);
        while (containsRedex(t) && out.size() <= maxSteps) {
            t = step(t);
            out.add(t);
        }
        return out;
    }

    private static void checkLimit(int maxSteps) {
        if (maxSteps < 0)
            throw new IllegalArgumentException("Step limit must not be negative: " + maxSteps);
    }
}
