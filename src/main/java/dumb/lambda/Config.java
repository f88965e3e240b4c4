package dumb.lambda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.lambda.Log.error;
import static dumb.lambda.Log.message;

/**
 * Settings, read from {@code lambda.json}. Missing properties take their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Config(
        @JsonProperty("maxSteps") int maxSteps,
        @JsonProperty("color") boolean color,
        @JsonProperty("prelude") boolean prelude,
        @JsonProperty("showSteps") boolean showSteps
) {
    public static final String DEFAULT_FILE = "lambda.json";
    public static final int DEFAULT_MAX_STEPS = 1000;
    public static final boolean DEFAULT_COLOR = true;
    public static final boolean DEFAULT_PRELUDE = true;
    public static final boolean DEFAULT_SHOW_STEPS = false;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    @JsonCreator
    public Config(
            @JsonProperty("maxSteps") @Nullable Integer maxSteps,
            @JsonProperty("color") @Nullable Boolean color,
            @JsonProperty("prelude") @Nullable Boolean prelude,
            @JsonProperty("showSteps") @Nullable Boolean showSteps
    ) {
        this(
                maxSteps != null ? maxSteps : DEFAULT_MAX_STEPS,
                color != null ? color : DEFAULT_COLOR,
                prelude != null ? prelude : DEFAULT_PRELUDE,
                showSteps != null ? showSteps : DEFAULT_SHOW_STEPS
        );
    }

    public Config() {
        this(DEFAULT_MAX_STEPS, DEFAULT_COLOR, DEFAULT_PRELUDE, DEFAULT_SHOW_STEPS);
    }

    public Config {
        if (maxSteps < 0)
            throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
    }

    public static Config fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, Config.class);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize configuration", e);
        }
    }

    /** Reads the file if it exists; an unreadable or malformed file is logged and defaults are used. */
    public static Config load(Path path) {
        if (!Files.exists(path)) return new Config();
        try {
            var c = fromJson(Files.readString(path));
            message("Loaded configuration from " + path);
            return c;
        } catch (IOException | IllegalArgumentException e) {
            error("Invalid configuration " + path + ": " + e.getMessage() + "; using defaults");
            return new Config();
        }
    }

    public Config withMaxSteps(int maxSteps) {
        return new Config(maxSteps, color, prelude, showSteps);
    }

    public Config withColor(boolean color) {
        return new Config(maxSteps, color, prelude, showSteps);
    }

    public Config withPrelude(boolean prelude) {
        return new Config(maxSteps, color, prelude, showSteps);
    }

    public Config withShowSteps(boolean showSteps) {
        return new Config(maxSteps, color, prelude, showSteps);
    }
}
