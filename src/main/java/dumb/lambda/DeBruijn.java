package dumb.lambda;

import java.util.ArrayDeque;
import java.util.Deque;

import static java.util.Objects.requireNonNull;

/**
 * Nameless form of a term: bound variables become the number of binders between
 * the occurrence and its abstraction, free variables keep their names. Two terms
 * are alpha-equivalent exactly when their nameless forms are equal.
 */
public enum DeBruijn {
    ;

    public static Indexed of(Term term) {
        return index(requireNonNull(term), new ArrayDeque<>());
    }

    public static boolean alphaEquivalent(Term x, Term y) {
        return x == y || of(x).equals(of(y));
    }

    /** @param scope parameters in scope, innermost first */
    private static Indexed index(Term term, Deque<String> scope) {
        if (term instanceof Term.Var v) {
            var i = 0;
            for (var p : scope) {
                if (p.equals(v.name())) return new Indexed.Bound(i);
                i++;
            }
            return new Indexed.Free(v.name());
        }
        if (term instanceof Term.Lam l) {
            scope.push(l.param());
            try {
                return new Indexed.Abs(index(l.body(), scope));
            } finally {
                scope.pop();
            }
        }
        var a = (Term.App) term;
        return new Indexed.Apply(index(a.fun(), scope), index(a.arg(), scope));
    }

    public sealed interface Indexed permits Indexed.Bound, Indexed.Free, Indexed.Abs, Indexed.Apply {

        record Bound(int index) implements Indexed {
            @Override
            public String toString() {
                return Integer.toString(index);
            }
        }

        record Free(String name) implements Indexed {
            @Override
            public String toString() {
                return name;
            }
        }

        record Abs(Indexed body) implements Indexed {
            @Override
            public String toString() {
                return "(λ " + body + ')';
            }
        }

        record Apply(Indexed fun, Indexed arg) implements Indexed {
            @Override
            public String toString() {
                return "(" + fun + ' ' + arg + ')';
            }
        }
    }
}
