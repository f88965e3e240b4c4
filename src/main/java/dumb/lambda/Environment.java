package dumb.lambda;

import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static dumb.lambda.Log.message;
import static dumb.lambda.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Named terms. A name occurring free in a term stands for its definition; definitions
 * are looked up when a term is expanded, so redefining a name affects the names that
 * refer to it. Not thread-safe.
 */
public class Environment {
    public static final String PRELUDE_RESOURCE = "/prelude.lambda";
    private static final int MAX_PREVIEW = 40;

    private final Map<String, Term> definitions = new TreeMap<>();

    public static Environment withPrelude() {
        var env = new Environment();
        env.loadPrelude();
        return env;
    }

    static boolean isName(String name) {
        if (name.isEmpty() || !LambdaParser.isIdentifierStart(name.charAt(0))) return false;
        return name.chars().allMatch(LambdaParser::isIdentifierPart);
    }

    /** @return the previous definition, if any */
    @Nullable
    public Term define(String name, Term term) {
        requireNonNull(name);
        requireNonNull(term);
        if (!isName(name))
            throw new IllegalArgumentException("Invalid name: '" + name + "'");
        return definitions.put(name, term);
    }

    @Nullable
    public Term remove(String name) {
        return definitions.remove(name);
    }

    public Optional<Term> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public SortedSet<String> names() {
        return new TreeSet<>(definitions.keySet());
    }

    public int size() {
        return definitions.size();
    }

    public void clear() {
        definitions.clear();
    }

    /**
     * Replaces every free name that has a definition by the (expanded) definition.
     * A name is never expanded inside its own definition; it stays free there.
     */
    public Term expand(Term term) {
        return expand(requireNonNull(term), new HashSet<>());
    }

    private Term expand(Term term, Set<String> active) {
        var t = term;
        for (var name : Terms.freeVars(term)) {
            var def = definitions.get(name);
            if (def == null || active.contains(name)) continue;
            active.add(name);
            var replacement = expand(def, active);
            active.remove(name);
            t = Terms.subst(name, replacement, t);
        }
        return t;
    }

    /** The first name, alphabetically, whose expanded definition is alpha-equivalent to the term. */
    public Optional<String> nameOf(Term term) {
        var indexed = DeBruijn.of(term);
        for (var name : definitions.keySet()) {
            if (DeBruijn.of(expand(Term.var(name))).equals(indexed))
                return Optional.of(name);
        }
        return Optional.empty();
    }

    /**
     * Reads {@code NAME = term} lines. Blank lines and {@code #} comments are skipped;
     * malformed lines are logged and skipped.
     *
     * @return number of definitions read
     */
    public int load(Reader source, String origin) throws IOException {
        var count = 0;
        var lineNo = 0;
        var reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            var text = line.strip();
            if (text.isEmpty() || text.startsWith("#")) continue;
            try {
                var d = Definition.parse(text);
                if (d == null) {
                    warning(String.format("%s:%d: expected NAME = term, skipping '%s'", origin, lineNo, preview(text)));
                    continue;
                }
                define(d.name(), d.term());
                count++;
            } catch (LambdaParser.ParseException | IllegalArgumentException e) {
                warning(String.format("%s:%d: %s", origin, lineNo, e.getMessage()));
            }
        }
        return count;
    }

    public int load(Path path) throws IOException {
        if (!Files.exists(path) || !Files.isReadable(path))
            throw new IOException("File not found or not readable: " + path);
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            var n = load(reader, path.toString());
            message("Loaded " + n + " definitions from " + path);
            return n;
        }
    }

    public void loadPrelude() {
        var in = Environment.class.getResourceAsStream(PRELUDE_RESOURCE);
        if (in == null) {
            warning("Prelude resource " + PRELUDE_RESOURCE + " not found");
            return;
        }
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            load(reader, "prelude");
        } catch (IOException e) {
            Log.error("Failed to read prelude", e);
        }
    }

    public void save(Path path) throws IOException {
        var sb = new StringBuilder();
        definitions.forEach((name, term) -> sb.append(name).append(" = ").append(term.toLambda()).append('\n'));
        Files.writeString(path, sb.toString(), StandardCharsets.UTF_8);
        message("Saved " + definitions.size() + " definitions to " + path);
    }

    private static String preview(String text) {
        return text.length() <= MAX_PREVIEW ? text : text.substring(0, MAX_PREVIEW) + "...";
    }

    /** A {@code NAME = term} line. */
    public record Definition(String name, Term term) {

        /** @return null when the text is not of the form {@code NAME = ...} */
        @Nullable
        public static Definition parse(String text) throws LambdaParser.ParseException {
            var eq = text.indexOf('=');
            if (eq < 0) return null;
            var name = text.substring(0, eq).strip();
            if (!isName(name)) return null;
            return new Definition(name, LambdaParser.parse(text.substring(eq + 1)));
        }
    }
}
