package dumb.lambda;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void defaults() {
        var c = new Config();
        assertEquals(Config.DEFAULT_MAX_STEPS, c.maxSteps());
        assertTrue(c.color());
        assertTrue(c.prelude());
        assertFalse(c.showSteps());
    }

    @Test
    void missingPropertiesTakeDefaults() throws JsonProcessingException {
        assertEquals(new Config(), Config.fromJson("{}"));
        var c = Config.fromJson("{\"maxSteps\": 50, \"unknown\": 1}");
        assertEquals(50, c.maxSteps());
        assertEquals(Config.DEFAULT_COLOR, c.color());
    }

    @Test
    void jsonRoundTrip() throws JsonProcessingException {
        var c = new Config(12, false, false, true);
        assertEquals(c, Config.fromJson(c.toJson()));
    }

    @Test
    void negativeLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Config().withMaxSteps(-1));
        assertThrows(JsonProcessingException.class, () -> Config.fromJson("{\"maxSteps\": -5}"));
    }

    @Test
    void loadFromFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("lambda.json");
        Files.writeString(file, "{\"maxSteps\": 77, \"color\": false}");
        var c = Config.load(file);
        assertEquals(77, c.maxSteps());
        assertFalse(c.color());
    }

    @Test
    void badFilesFallBackToDefaults(@TempDir Path dir) throws IOException {
        assertEquals(new Config(), Config.load(dir.resolve("absent.json")));
        var file = dir.resolve("broken.json");
        Files.writeString(file, "{ maxSteps: ");
        assertEquals(new Config(), Config.load(file));
    }

    @Test
    void withers() {
        var c = new Config().withMaxSteps(3).withColor(false).withPrelude(false).withShowSteps(true);
        assertEquals(new Config(3, false, false, true), c);
    }
}
