package dumb.lambda;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;

import static dumb.lambda.Log.error;

/**
 * Command-line entry point: reads lines from standard input and prints each result.
 */
public class Repl {
    static final String PROMPT = "λ> ";

    private final Session session;
    private final PrintStream out;

    public Repl(Session session, PrintStream out) {
        this.session = session;
        this.out = out;
    }

    public static void main(String[] args) {
        String configFile = null;
        Integer maxSteps = null;
        Boolean color = null, prelude = null;
        var loads = new ArrayList<String>();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = args[++i];
                    case "-l", "--load" -> loads.add(args[++i]);
                    case "-n", "--max-steps" -> maxSteps = Integer.parseInt(args[++i]);
                    case "--no-color" -> color = false;
                    case "--no-prelude" -> prelude = false;
                    case "-h", "--help" -> {
                        printUsage();
                        return;
                    }
                    default -> Log.warning("Unknown option: " + args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                error(String.format("Error parsing argument for %s: %s", args[i - 1], e.getMessage()));
                printUsage();
                System.exit(1);
            }
        }

        var config = Config.load(Path.of(configFile != null ? configFile : Config.DEFAULT_FILE));
        try {
            if (maxSteps != null) config = config.withMaxSteps(maxSteps);
        } catch (IllegalArgumentException e) {
            error(e.getMessage());
            System.exit(1);
        }
        if (color != null) config = config.withColor(color);
        if (prelude != null) config = config.withPrelude(prelude);

        var env = config.prelude() ? Environment.withPrelude() : new Environment();
        for (var file : loads) {
            try {
                env.load(Path.of(file));
            } catch (IOException e) {
                error("Cannot load " + file + ": " + e.getMessage());
            }
        }

        var out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        try {
            new Repl(new Session(config, env), out).run(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            error("Input error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("""
                Usage: lambda [options]
                  -c, --config FILE     configuration file (default lambda.json)
                  -l, --load FILE       load definitions, may be repeated
                  -n, --max-steps N     reduction step limit
                      --no-color        plain output
                      --no-prelude      start without the standard definitions""");
    }

    /** Runs until end of input or {@code :quit}. */
    public void run(Reader input) throws IOException {
        var reader = input instanceof BufferedReader b ? b : new BufferedReader(input);
        out.println("lambda, :help for commands");
        while (!session.done()) {
            out.print(PROMPT);
            out.flush();
            var line = reader.readLine();
            if (line == null) break;
            var result = session.eval(line);
            if (!result.isEmpty()) out.println(result);
        }
        out.println();
    }
}
