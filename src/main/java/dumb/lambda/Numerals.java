package dumb.lambda;

import java.util.OptionalInt;

/**
 * Church numerals: {@code n} is {@code \f.\x.f (f ... (f x))} with {@code n} applications of {@code f}.
 */
public enum Numerals {
    ;

    public static Term church(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Church numerals are non-negative: " + n);
        Term body = Term.var("x");
        var f = Term.var("f");
        for (var i = 0; i < n; i++)
            body = new Term.App(f, body);
        return Term.lam(body, "f", "x");
    }

    /** The number a term encodes, if it is alpha-equivalent to a Church numeral. */
    public static OptionalInt decode(Term term) {
        if (!(term instanceof Term.Lam outer) || !(outer.body() instanceof Term.Lam inner))
            return OptionalInt.empty();
        var f = outer.param();
        var x = inner.param();
        if (f.equals(x))
            return inner.body() instanceof Term.Var v && v.name().equals(x) ? OptionalInt.of(0) : OptionalInt.empty();
        var n = 0;
        var t = inner.body();
        while (t instanceof Term.App a && a.fun() instanceof Term.Var v && v.name().equals(f)) {
            n++;
            t = a.arg();
        }
        return t instanceof Term.Var v && v.name().equals(x) ? OptionalInt.of(n) : OptionalInt.empty();
    }
}
