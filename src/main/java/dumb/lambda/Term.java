package dumb.lambda;

import org.json.JSONObject;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Lambda term: a variable, an abstraction or an application.
 * Terms are immutable; every transformation builds new nodes.
 */
sealed public interface Term permits Term.Var, Term.Lam, Term.App {

    static Var var(String name) {
        return Var.of(name);
    }

    /** Curried abstraction: {@code lam(body, "x", "y")} is {@code \x.\y.body}. */
    static Term lam(Term body, String... params) {
        var t = body;
        for (var i = params.length - 1; i >= 0; i--)
            t = new Lam(params[i], t);
        return t;
    }

    /** Left-associative application of one or more terms. */
    static Term app(Term head, Term... args) {
        var t = head;
        for (var a : args)
            t = new App(t, a);
        return t;
    }

    /** Concrete syntax; applications and abstractions are parenthesized, variables never. */
    String toLambda();

    default Set<String> freeVars() {
        return Terms.freeVars(this);
    }

    default Set<String> vars() {
        return Terms.allVars(this);
    }

    /** Node count. */
    int weight();

    JSONObject toJson();

    record Var(String name) implements Term {
        private static final Map<String, Var> internCache = new ConcurrentHashMap<>(256);

        public Var {
            requireNonNull(name);
            if (name.isEmpty())
                throw new IllegalArgumentException("Variable name must not be empty");
        }

        public static Var of(String name) {
            return internCache.computeIfAbsent(name, Var::new);
        }

        @Override
        public String toLambda() {
            return name;
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return "Var[" + name + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name)
                    .put("lambda", toLambda());
        }
    }

    record Lam(String param, Term body) implements Term {

        public Lam {
            requireNonNull(param);
            requireNonNull(body);
            if (param.isEmpty())
                throw new IllegalArgumentException("Parameter name must not be empty");
        }

        @Override
        public String toLambda() {
            return "(\\" + param + '.' + body.toLambda() + ')';
        }

        @Override
        public int weight() {
            return 1 + body.weight();
        }

        @Override
        public String toString() {
            return "Lam[" + param + ", " + body + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "lam")
                    .put("param", param)
                    .put("body", body.toJson())
                    .put("lambda", toLambda());
        }
    }

    record App(Term fun, Term arg) implements Term {

        public App {
            requireNonNull(fun);
            requireNonNull(arg);
        }

        @Override
        public String toLambda() {
            return "(" + fun.toLambda() + ' ' + arg.toLambda() + ')';
        }

        @Override
        public int weight() {
            return 1 + fun.weight() + arg.weight();
        }

        @Override
        public String toString() {
            return "App[" + fun + ", " + arg + ']';
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "app")
                    .put("fun", fun.toJson())
                    .put("arg", arg.toJson())
                    .put("lambda", toLambda());
        }
    }
}
