package com.ttennebkram.heightmap.config;

import com.ttennebkram.heightmap.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HeightMapSettingsTest {

    @Test
    void defaultsMatchTunedValues() {
        HeightMapSettings settings = HeightMapSettings.defaults();
        assertEquals(5, settings.getDiameter());
        assertEquals(25.0, settings.getSigmaColor());
        assertEquals(5.0, settings.getSigmaSpace());
        assertEquals(1.5, settings.getAmount());
        assertTrue(settings.isParallelRows());
        assertTrue(settings.createScheduler().isParallel());
    }

    @Test
    void toBuilderOverridesOneValue() {
        HeightMapSettings settings = HeightMapSettings.defaults().toBuilder().amount(2.0).parallelRows(false).build();
        assertEquals(2.0, settings.getAmount());
        assertEquals(5, settings.getDiameter());
        assertFalse(settings.createScheduler().isParallel());
        assertNotEquals(HeightMapSettings.defaults(), settings);
    }

    @Test
    void stagesCarrySettings() {
        HeightMapSettings settings = HeightMapSettings.builder().diameter(9).sigmaColor(12.0).amount(0.5).build();
        var bilateral = settings.createBilateralFilter(null);
        assertEquals(9, bilateral.getDiameter());
        assertEquals(12.0, bilateral.getSigmaColor());
        assertEquals(0.5, settings.createUnsharpMask(null).getAmount());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3, 2, 6})
    void rejectsBadDiameter(int diameter) {
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().diameter(diameter).build());
    }

    @Test
    void rejectsBadSigmasAndAmount() {
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().sigmaColor(0).build());
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().sigmaSpace(-2).build());
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().amount(Double.NaN).build());
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().sigmaColor(1e-170).build());
        assertThrows(ConfigurationException.class, () -> HeightMapSettings.builder().sigmaSpace(1e200).build());
    }

    @Test
    void zeroAndNegativeAmountsAreAllowed() {
        assertEquals(0.0, HeightMapSettings.builder().amount(0).build().getAmount());
        assertEquals(-0.5, HeightMapSettings.builder().amount(-0.5).build().getAmount());
    }
}
