package com.ttennebkram.heightmap.config;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.heightmap.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class SettingsSerializerTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneObjectPerConfigurableStage() {
        JsonObject json = JsonParser.parseString(SettingsSerializer.toJson(HeightMapSettings.defaults()))
                .getAsJsonObject();

        assertEquals(5, json.getAsJsonObject("bilateralFilter").get("diameter").getAsInt());
        assertEquals(25.0, json.getAsJsonObject("bilateralFilter").get("sigmaColor").getAsDouble());
        assertEquals(5.0, json.getAsJsonObject("bilateralFilter").get("sigmaSpace").getAsDouble());
        assertEquals(1.5, json.getAsJsonObject("unsharpMask").get("amount").getAsDouble());
        assertTrue(json.get("parallelRows").getAsBoolean());
        assertFalse(json.has("gaussianBlur"));
    }

    @Test
    void saveThenLoad() throws Exception {
        HeightMapSettings settings = HeightMapSettings.builder()
                .diameter(3).sigmaColor(10.5).sigmaSpace(2.0).amount(1.25).parallelRows(false).build();
        Path file = tempDir.resolve("settings.json");

        SettingsSerializer.save(file, settings);

        assertEquals(settings, SettingsSerializer.load(file));
    }

    @Test
    void missingKeysUseDefaults() throws Exception {
        Path file = Paths.get(getClass().getResource("/settings/custom.json").toURI());

        HeightMapSettings settings = SettingsSerializer.load(file);

        assertEquals(7, settings.getDiameter());
        assertEquals(40.0, settings.getSigmaColor());
        assertEquals(HeightMapSettings.DEFAULT_SIGMA_SPACE, settings.getSigmaSpace());
        assertEquals(0.75, settings.getAmount());
        assertFalse(settings.isParallelRows());
    }

    @Test
    void emptyObjectIsDefaults() {
        assertEquals(HeightMapSettings.defaults(), SettingsSerializer.fromJson("{}"));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": 4}}"));
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"sigmaSpace\": -1}}"));
    }

    @Test
    void wrongTypesAreRejected() {
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": \"five\"}}"));
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"unsharpMask\": 1.5}"));
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"parallelRows\": \"yes\"}"));
        assertThrows(ConfigurationException.class, () -> SettingsSerializer.fromJson("[1, 2]"));
    }

    @Test
    void fractionalDiameterIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": 5.7}}"));
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": 1e12}}"));
        assertThrows(ConfigurationException.class,
                () -> SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": \"5\"}}"));
    }

    @Test
    void integralDecimalDiameterIsAccepted() {
        assertEquals(7, SettingsSerializer.fromJson("{\"bilateralFilter\": {\"diameter\": 7.0}}").getDiameter());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(ConfigurationException.class, () -> SettingsSerializer.fromJson("{\"unsharpMask\": {"));
    }
}
