package com.ttennebkram.heightmap.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.heightmap.error.ConfigurationException;
import com.ttennebkram.heightmap.processing.RowScheduler;
import com.ttennebkram.heightmap.stages.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Handles saving and loading {@link HeightMapSettings} as JSON.
 * Each stage writes its own properties into an object keyed by its node type:
 * <pre>
 * {
 *   "bilateralFilter": { "diameter": 5, "sigmaColor": 25.0, "sigmaSpace": 5.0 },
 *   "unsharpMask": { "amount": 1.5 },
 *   "parallelRows": true
 * }
 * </pre>
 * Missing keys fall back to the defaults.
 */
public class SettingsSerializer {

    private static final Logger log = LoggerFactory.getLogger(SettingsSerializer.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final String PARALLEL_ROWS = "parallelRows";

    private SettingsSerializer() {
    }

    /**
     * Save settings to a JSON file.
     */
    public static void save(Path path, HeightMapSettings settings) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJsonObject(settings), writer);
        }
        log.info("Saved height map settings to {}", path);
    }

    /**
     * Load settings from a JSON file.
     *
     * @throws ConfigurationException if the file is not valid settings JSON
     */
    public static HeightMapSettings load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            HeightMapSettings settings = fromJsonElement(parse(reader, path.toString()));
            log.info("Loaded height map settings from {}: {}", path, settings);
            return settings;
        }
    }

    public static String toJson(HeightMapSettings settings) {
        return GSON.toJson(toJsonObject(settings));
    }

    public static HeightMapSettings fromJson(String json) {
        try {
            return fromJsonElement(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed settings JSON: " + e.getMessage(), e);
        }
    }

    static JsonObject toJsonObject(HeightMapSettings settings) {
        RowScheduler scheduler = RowScheduler.sequential();
        JsonObject root = new JsonObject();
        addStage(root, settings.createBilateralFilter(scheduler));
        addStage(root, settings.createUnsharpMask(scheduler));
        root.addProperty(PARALLEL_ROWS, settings.isParallelRows());
        return root;
    }

    private static void addStage(JsonObject root, Stage<?> stage) {
        if (!stage.hasProperties()) {
            return;
        }
        JsonObject props = new JsonObject();
        stage.serializeProperties(props);
        root.add(jsonKey(stage.getNodeType()), props);
    }

    private static HeightMapSettings fromJsonElement(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            throw new ConfigurationException("Settings JSON must be an object");
        }
        JsonObject root = element.getAsJsonObject();
        JsonObject bilateral = getObject(root, "bilateralFilter");
        JsonObject unsharp = getObject(root, "unsharpMask");

        return HeightMapSettings.builder()
                .diameter(getJsonInt(bilateral, "diameter", HeightMapSettings.DEFAULT_DIAMETER))
                .sigmaColor(getJsonDouble(bilateral, "sigmaColor", HeightMapSettings.DEFAULT_SIGMA_COLOR))
                .sigmaSpace(getJsonDouble(bilateral, "sigmaSpace", HeightMapSettings.DEFAULT_SIGMA_SPACE))
                .amount(getJsonDouble(unsharp, "amount", HeightMapSettings.DEFAULT_AMOUNT))
                .parallelRows(getJsonBoolean(root, PARALLEL_ROWS, HeightMapSettings.DEFAULT_PARALLEL_ROWS))
                .build();
    }

    private static JsonElement parse(Reader reader, String source) {
        try {
            return JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed settings JSON in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * "BilateralFilter" -> "bilateralFilter"
     */
    private static String jsonKey(String nodeType) {
        return Character.toLowerCase(nodeType.charAt(0)) + nodeType.substring(1);
    }

    private static JsonObject getObject(JsonObject json, String key) {
        if (!json.has(key)) {
            return new JsonObject();
        }
        JsonElement element = json.get(key);
        if (!element.isJsonObject()) {
            throw new ConfigurationException("\"" + key + "\" must be a JSON object");
        }
        return element.getAsJsonObject();
    }

    /**
     * Helper to safely get an int from JSON.
     * Fractional numbers are rejected rather than truncated.
     */
    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key)) {
            JsonElement element = json.get(key);
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
                throw new ConfigurationException("\"" + key + "\" must be an integer");
            }
            try {
                return element.getAsBigDecimal().intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new ConfigurationException("\"" + key + "\" must be an integer, got " + element, e);
            }
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a double from JSON.
     */
    private static double getJsonDouble(JsonObject json, String key, double defaultValue) {
        if (json.has(key)) {
            try {
                return json.get(key).getAsDouble();
            } catch (RuntimeException e) {
                throw new ConfigurationException("\"" + key + "\" must be a number", e);
            }
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a boolean from JSON.
     */
    private static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key)) {
            JsonElement element = json.get(key);
            if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
                throw new ConfigurationException("\"" + key + "\" must be true or false");
            }
            return element.getAsBoolean();
        }
        return defaultValue;
    }
}
