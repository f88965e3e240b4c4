package dumb.lambda;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest extends AbstractTest {

    @Test
    void defineAndLookUp() {
        var env = new Environment();
        assertNull(env.define("I", parse("\\x.x")));
        assertEquals(Optional.of(parse("\\x.x")), env.get("I"));
        assertEquals(parse("\\x.x"), env.define("I", parse("\\y.y")));
        assertEquals(1, env.size());
        assertTrue(env.contains("I"));
        assertEquals(parse("\\y.y"), env.remove("I"));
        assertTrue(env.get("I").isEmpty());
    }

    @Test
    void invalidNamesRejected() {
        var env = new Environment();
        assertThrows(IllegalArgumentException.class, () -> env.define("", v("x")));
        assertThrows(IllegalArgumentException.class, () -> env.define("1A", v("x")));
        assertThrows(IllegalArgumentException.class, () -> env.define("a b", v("x")));
    }

    @Test
    void namesAreSorted() {
        var env = new Environment();
        env.define("S", v("s"));
        env.define("I", v("i"));
        env.define("K", v("k"));
        assertEquals(List.of("I", "K", "S"), List.copyOf(env.names()));
    }

    @Test
    void expandReplacesFreeNames() {
        var env = new Environment();
        env.define("I", parse("\\x.x"));
        assertEquals(parse("(\\x.x) y"), env.expand(parse("I y")));
        assertEquals(parse("\\I.I"), env.expand(parse("\\I.I")));
    }

    @Test
    void expandIsTransitiveAndLate() {
        var env = new Environment();
        env.define("TWICE", parse("\\f x.f (f x)"));
        env.define("T", parse("TWICE g"));
        assertEquals(parse("(\\f x.f (f x)) g"), env.expand(v("T")));
        env.define("TWICE", parse("\\f x.x"));
        assertEquals(parse("(\\f x.x) g"), env.expand(v("T")));
    }

    @Test
    void expansionAvoidsCapture() {
        var env = new Environment();
        env.define("K", parse("\\x y.x"));
        var t = env.expand(parse("\\y.K y"));
        assertTrue(t.freeVars().isEmpty());
        assertAlpha("\\a.\\b.a", Reduce.normalize(t, 10).term());
    }

    @Test
    void cyclicDefinitionsTerminate() {
        var env = new Environment();
        env.define("A", parse("B"));
        env.define("B", parse("A"));
        assertEquals(v("A"), env.expand(v("A")));
        env.define("R", parse("R x"));
        assertEquals(parse("R x"), env.expand(v("R")));
    }

    @Test
    void nameOfFindsAlphaEquivalentDefinition() {
        var env = new Environment();
        env.define("ID", parse("\\x.x"));
        env.define("K", parse("\\x y.x"));
        assertEquals(Optional.of("ID"), env.nameOf(parse("\\q.q")));
        assertEquals(Optional.of("K"), env.nameOf(parse("\\a b.a")));
        assertTrue(env.nameOf(parse("\\a b.b")).isEmpty());
    }

    @Test
    void loadSkipsCommentsAndBadLines() throws IOException {
        var env = new Environment();
        var n = env.load(new StringReader("""
                # combinators
                I = \\x.x

                not a definition
                K = \\x y.x   # trailing comment
                X = (
                """), "test");
        assertEquals(2, n);
        assertEquals(List.of("I", "K"), List.copyOf(env.names()));
    }

    @Test
    void saveAndLoad(@TempDir Path dir) throws IOException {
        var env = new Environment();
        env.define("I", parse("\\x.x"));
        env.define("TWO", Numerals.church(2));
        var file = dir.resolve("defs.lambda");
        env.save(file);
        assertTrue(Files.readString(file).contains("I = (\\x.x)"));

        var loaded = new Environment();
        assertEquals(2, loaded.load(file));
        assertEquals(env.get("TWO"), loaded.get("TWO"));
    }

    @Test
    void loadMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> new Environment().load(dir.resolve("missing.lambda")));
    }

    @Test
    void prelude() {
        var env = Environment.withPrelude();
        assertTrue(env.size() > 20);
        for (var name : List.of("I", "K", "S", "Y", "TRUE", "FALSE", "SUCC", "PLUS", "MULT"))
            assertTrue(env.contains(name), name);
        var e = Reduce.normalize(env.expand(parse("SUCC 1")), 100);
        assertEquals(2, Numerals.decode(e.term()).orElse(-1));
    }

    @Test
    void definitionLine() throws LambdaParser.ParseException {
        assertEquals(new Environment.Definition("I", parse("\\x.x")), Environment.Definition.parse("I = \\x.x"));
        assertNull(Environment.Definition.parse("\\x.x"));
        assertNull(Environment.Definition.parse("(a b) = c"));
        assertThrows(LambdaParser.ParseException.class, () -> Environment.Definition.parse("I = ("));
    }
}
