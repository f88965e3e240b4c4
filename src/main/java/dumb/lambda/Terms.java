package dumb.lambda;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Variable analysis, fresh names, renaming and capture-avoiding substitution.
 */
public enum Terms {
    ;

    /** Identifiers occurring free in the term, sorted. */
    public static SortedSet<String> freeVars(Term term) {
        var s = new TreeSet<String>();
        collectFree(term, s);
        return Collections.unmodifiableSortedSet(s);
    }

    public static boolean isFreeIn(String id, Term term) {
        requireNonNull(id);
        if (term instanceof Term.Var v) return v.name().equals(id);
        if (term instanceof Term.Lam l) return !l.param().equals(id) && isFreeIn(id, l.body());
        var a = (Term.App) term;
        return isFreeIn(id, a.fun()) || isFreeIn(id, a.arg());
    }

    /** Free and bound identifiers, sorted. */
    public static SortedSet<String> allVars(Term term) {
        var s = new TreeSet<String>();
        collectAll(term, s);
        return Collections.unmodifiableSortedSet(s);
    }

    private static void collectFree(Term term, Set<String> into) {
        if (term instanceof Term.Var v) {
            into.add(v.name());
        } else if (term instanceof Term.Lam l) {
            var inner = new TreeSet<String>();
            collectFree(l.body(), inner);
            inner.remove(l.param());
            into.addAll(inner);
        } else {
            var a = (Term.App) term;
            collectFree(a.fun(), into);
            collectFree(a.arg(), into);
        }
    }

    private static void collectAll(Term term, Set<String> into) {
        if (term instanceof Term.Var v) {
            into.add(v.name());
        } else if (term instanceof Term.Lam l) {
            into.add(l.param());
            collectAll(l.body(), into);
        } else {
            var a = (Term.App) term;
            collectAll(a.fun(), into);
            collectAll(a.arg(), into);
        }
    }

    /**
     * Next name in the renaming series: {@code a..y} step to the following letter,
     * other single characters start a numbered series ({@code z -> z0}), {@code x0..x8}
     * count up, anything else gets a prime.
     */
    public static String successor(String name) {
        requireNonNull(name);
        var n = name.length();
        if (n == 1) {
            var c = name.charAt(0);
            return c >= 'a' && c <= 'y' ? String.valueOf((char) (c + 1)) : name + '0';
        }
        if (n == 2) {
            var d = name.charAt(1);
            if (d >= '0' && d <= '8')
                return name.substring(0, 1) + (char) (d + 1);
        }
        return name + '\'';
    }

    /** A name derived from {@code candidate} that does not occur free in {@code term}. */
    public static String fresh(Term term, String candidate) {
        return fresh(freeVars(term), candidate);
    }

    /** A name derived from {@code candidate} that is not in {@code avoid}. */
    public static String fresh(Set<String> avoid, String candidate) {
        var name = successor(candidate);
        while (avoid.contains(name))
            name = successor(name);
        return name;
    }

    /** Replaces every occurrence of {@code from}, bound or free, by {@code to}. */
    public static Term rename(String from, String to, Term term) {
        if (term instanceof Term.Var v)
            return v.name().equals(from) ? Term.Var.of(to) : v;
        if (term instanceof Term.Lam l)
            return new Term.Lam(l.param().equals(from) ? to : l.param(), rename(from, to, l.body()));
        var a = (Term.App) term;
        return new Term.App(rename(from, to, a.fun()), rename(from, to, a.arg()));
    }

    /** {@code subject[name := replacement]}, renaming binders that would capture a free variable of the replacement. */
    public static Term subst(String name, Term replacement, Term subject) {
        requireNonNull(name);
        requireNonNull(replacement);
        if (subject instanceof Term.Var v)
            return v.name().equals(name) ? replacement : v;
        if (subject instanceof Term.App a)
            return new Term.App(subst(name, replacement, a.fun()), subst(name, replacement, a.arg()));

        var l = (Term.Lam) subject;
        var x = l.param();
        if (x.equals(name))
            return l;
        if (isFreeIn(x, replacement)) {
            var avoid = new TreeSet<>(freeVars(replacement));
            avoid.addAll(allVars(l.body()));
            var x1 = fresh(avoid, x);
            return new Term.Lam(x1, subst(name, replacement, rename(x, x1, l.body())));
        }
        return new Term.Lam(x, subst(name, replacement, l.body()));
    }
}
