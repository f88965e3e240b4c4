package dumb.lambda;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static dumb.lambda.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * One interactive session: an environment, settings and input history.
 * {@link #eval(String)} turns an input line into the text to show for it.
 */
public class Session {
    static final String HELP = """
            term                 reduce to normal form
            NAME = term          define a name (also :let NAME = term)
            :step term           one reduction step
            :trace term          every reduction step
            :show term           print without reducing
            :alpha t1 ~ t2       alpha-equivalence
            :free term           free variables
            :debruijn term       nameless form
            :json term           JSON form
            :env                 list definitions
            :undef NAME          remove a definition
            :load path           read definitions from a file
            :save path           write definitions to a file
            :limit [N]           show or set the step limit
            :history             previous input
            :help                this text
            :quit                leave""";
    private static final int MAX_PREVIEW = 200;

    private final Environment env;
    private final List<String> history = new ArrayList<>();
    private Config config;
    private boolean done;

    public Session(Config config, Environment env) {
        this.config = requireNonNull(config);
        this.env = requireNonNull(env);
    }

    public Config config() {
        return config;
    }

    public Environment environment() {
        return env;
    }

    public List<String> history() {
        return List.copyOf(history);
    }

    public boolean done() {
        return done;
    }

    public String eval(String line) {
        var input = line.strip();
        if (input.isEmpty() || input.startsWith("#")) return "";
        history.add(input);
        debug("eval: " + input);
        try {
            return input.startsWith(":") ? command(input) : evalTermOrDefinition(input);
        } catch (LambdaParser.ParseException e) {
            return err("parse error: " + e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            return err(e.getMessage());
        } catch (StackOverflowError e) {
            Log.warning("Input nested too deeply: " + preview(input));
            return err("term too deep");
        }
    }

    private String command(String input) throws LambdaParser.ParseException, IOException {
        var sp = input.indexOf(' ');
        var cmd = sp < 0 ? input : input.substring(0, sp);
        var arg = sp < 0 ? "" : input.substring(sp + 1).strip();
        return switch (cmd) {
            case ":help", ":h", ":?" -> HELP;
            case ":quit", ":q" -> {
                done = true;
                yield "";
            }
            case ":let" -> define(arg);
            case ":step" -> {
                var t = env.expand(parse(arg));
                yield Reduce.containsRedex(t) ? ok(Reduce.step(t).toLambda()) : ok(t.toLambda()) + " (normal form)";
            }
            case ":trace" -> trace(arg);
            case ":show" -> ok(parse(arg).toLambda());
            case ":alpha" -> {
                var tilde = arg.indexOf('~');
                if (tilde < 0) throw new IllegalArgumentException("usage: :alpha t1 ~ t2");
                var x = env.expand(parse(arg.substring(0, tilde)));
                var y = env.expand(parse(arg.substring(tilde + 1)));
                yield DeBruijn.alphaEquivalent(x, y) ? ok("true") : ok("false");
            }
            case ":free" -> ok(String.join(" ", parse(arg).freeVars()));
            case ":debruijn" -> ok(DeBruijn.of(env.expand(parse(arg))).toString());
            case ":json" -> parse(arg).toJson().toString(2);
            case ":env" -> env.names().stream()
                    .map(n -> name(n) + " = " + env.get(n).map(Term::toLambda).orElse(""))
                    .collect(Collectors.joining("\n"));
            case ":undef" -> env.remove(requireArg(arg, ":undef NAME")) != null ? "" : err("not defined: " + arg);
            case ":load" -> ok(env.load(Path.of(requireArg(arg, ":load path"))) + " definitions loaded");
            case ":save" -> {
                env.save(Path.of(requireArg(arg, ":save path")));
                yield ok(env.size() + " definitions saved");
            }
            case ":limit" -> {
                if (!arg.isEmpty()) config = config.withMaxSteps(parseLimit(arg));
                yield ok(Integer.toString(config.maxSteps()));
            }
            case ":history" -> String.join("\n", history.subList(0, history.size() - 1));
            default -> err("unknown command " + cmd + ", try :help");
        };
    }

    private String evalTermOrDefinition(String input) throws LambdaParser.ParseException {
        return isDefinition(input) ? define(input) : show(Reduce.normalize(env.expand(parse(input)), config.maxSteps()));
    }

    /** A line is a definition when the text before its first {@code =} is a name. */
    private static boolean isDefinition(String input) {
        var eq = input.indexOf('=');
        return eq >= 0 && Environment.isName(input.substring(0, eq).strip());
    }

    private String define(String text) throws LambdaParser.ParseException {
        var d = Environment.Definition.parse(text);
        if (d == null) throw new IllegalArgumentException("expected NAME = term");
        var previous = env.define(d.name(), d.term());
        return previous == null ? name(d.name()) + " defined" : name(d.name()) + " redefined";
    }

    private String show(Evaluation e) {
        if (e instanceof Evaluation.LimitExceeded x)
            return warn("no normal form within " + x.limit() + " steps: " + preview(x.term().toLambda()));
        var t = e.term();
        var sb = new StringBuilder(ok(t.toLambda()));
        env.nameOf(t).ifPresent(n -> sb.append(" = ").append(name(n)));
        Numerals.decode(t).ifPresent(n -> sb.append(" = ").append(name(Integer.toString(n))));
        if (config.showSteps()) sb.append(" (").append(e.steps()).append(e.steps() == 1 ? " step)" : " steps)");
        return sb.toString();
    }

    private String trace(String arg) throws LambdaParser.ParseException {
        var steps = Reduce.trace(env.expand(parse(arg)), config.maxSteps());
        var sb = new StringBuilder();
        for (var i = 0; i < steps.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(i).append(": ").append(ok(steps.get(i).toLambda()));
        }
        if (Reduce.containsRedex(steps.get(steps.size() - 1)))
            sb.append('\n').append(warn("no normal form within " + config.maxSteps() + " steps"));
        return sb.toString();
    }

    private static Term parse(String text) throws LambdaParser.ParseException {
        return LambdaParser.parse(text);
    }

    private static int parseLimit(String arg) {
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + arg);
        }
    }

    private static String requireArg(String arg, String usage) {
        if (arg.isEmpty()) throw new IllegalArgumentException("usage: " + usage);
        return arg;
    }

    private static String preview(String text) {
        return text.length() <= MAX_PREVIEW ? text : text.substring(0, MAX_PREVIEW) + "...";
    }

    private String ok(String s) {
        return Ansi.GREEN.apply(s, config.color());
    }

    private String name(String s) {
        return Ansi.CYAN.apply(s, config.color());
    }

    private String warn(String s) {
        return Ansi.YELLOW.apply(s, config.color());
    }

    private String err(String s) {
        return Ansi.RED.apply("error: " + s, config.color());
    }

    enum Ansi {
        RED("31"), GREEN("32"), YELLOW("33"), CYAN("36");

        private final String code;

        Ansi(String code) {
            this.code = code;
        }

        String apply(String s, boolean enabled) {
            return enabled ? "\u001B[" + code + 'm' + s + "\u001B[0m" : s;
        }
    }
}
