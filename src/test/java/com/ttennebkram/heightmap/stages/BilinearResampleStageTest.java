package com.ttennebkram.heightmap.stages;

import com.ttennebkram.heightmap.TestGrids;
import com.ttennebkram.heightmap.error.ConfigurationException;
import com.ttennebkram.heightmap.grid.HeightGrid;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class BilinearResampleStageTest {

    @Nested
    class Interpolation {

        @Test
        @DisplayName("Integer coordinates return the sample itself")
        void exactAtIntegerCoordinates() {
            IntensityGrid image = TestGrids.gradient();
            assertEquals(image.get(2, 3), BilinearResampleStage.bilinearInterpolate(image, 3.0f, 2.0f));
            assertEquals(image.get(4, 4), BilinearResampleStage.bilinearInterpolate(image, 4.0f, 4.0f));
            assertEquals(image.get(0, 0), BilinearResampleStage.bilinearInterpolate(image, 0.0f, 0.0f));
        }

        @Test
        void blendsFourNeighbours() {
            IntensityGrid image = IntensityGrid.of(new int[][]{{0, 100}, {100, 200}});
            assertEquals(100.0f, BilinearResampleStage.bilinearInterpolate(image, 0.5f, 0.5f));
            assertEquals(50.0f, BilinearResampleStage.bilinearInterpolate(image, 0.5f, 0.0f));
            assertEquals(25.0f, BilinearResampleStage.bilinearInterpolate(image, 0.25f, 0.0f));
        }

        @Test
        void lastColumnDoesNotReadPastEdge() {
            IntensityGrid image = IntensityGrid.of(new int[][]{{10, 20, 30}});
            assertEquals(25.0f, BilinearResampleStage.bilinearInterpolate(image, 1.5f, 0.0f));
            assertEquals(30.0f, BilinearResampleStage.bilinearInterpolate(image, 2.0f, 0.0f));
        }

        @ParameterizedTest
        @CsvSource({"-0.5, 0", "0, -0.01", "5, 0", "0, 5", "NaN, 0"})
        void rejectsCoordinatesOutsideGrid(float x, float y) {
            IntensityGrid image = TestGrids.gradient();
            assertThrows(IllegalArgumentException.class,
                    () -> BilinearResampleStage.bilinearInterpolate(image, x, y));
        }
    }

    @Nested
    class Resample {

        @Test
        void upsamplesTwoByTwo() {
            IntensityGrid image = IntensityGrid.of(new int[][]{{0, 100}, {100, 200}});

            HeightGrid heights = BilinearResampleStage.resampleAndScale(image, 1.0f, 3, 3);

            assertArrayEquals(new float[]{0, 50, 100}, heights.toArray()[0]);
            assertArrayEquals(new float[]{50, 100, 150}, heights.toArray()[1]);
            assertArrayEquals(new float[]{100, 150, 200}, heights.toArray()[2]);
        }

        @Test
        void downsampleKeepsCorners() {
            IntensityGrid image = TestGrids.gradient();

            HeightGrid heights = BilinearResampleStage.resampleAndScale(image, 2.0f, 3, 3);

            assertEquals(20.0f, heights.get(0, 0));
            assertEquals(100.0f, heights.get(0, 2));
            assertEquals(60.0f, heights.get(2, 0));
            assertEquals(140.0f, heights.get(2, 2));
            assertEquals(80.0f, heights.get(1, 1));
        }

        @Test
        @DisplayName("1x1 output samples the top-left pixel")
        void singleSampleOutput() {
            HeightGrid heights = BilinearResampleStage.resampleAndScale(TestGrids.gradient(), 3.0f, 1, 1);

            assertEquals(1, heights.width());
            assertEquals(1, heights.height());
            assertEquals(30.0f, heights.get(0, 0));
        }

        @Test
        void singleRowOutputFollowsFirstRow() {
            HeightGrid heights = BilinearResampleStage.resampleAndScale(TestGrids.gradient(), 1.0f, 5, 1);
            assertArrayEquals(new float[]{10, 20, 30, 40, 50}, heights.samples());
        }

        @Test
        void negativeScaleInvertsHeights() {
            HeightGrid heights = BilinearResampleStage.resampleAndScale(TestGrids.gradient(), -1.0f, 5, 5);
            assertEquals(-70.0f, heights.get(4, 4));
        }

        @ParameterizedTest
        @CsvSource({"0, 5", "5, 0", "-3, 5"})
        void rejectsNonPositiveOutputSize(int width, int height) {
            assertThrows(ConfigurationException.class, () -> new BilinearResampleStage(1.0f, width, height));
        }

        @Test
        void serializesOutputParameters() {
            com.google.gson.JsonObject json = new com.google.gson.JsonObject();
            new BilinearResampleStage(13.25f, 64, 32).serializeProperties(json);

            assertEquals(13.25f, json.get("scaleFactor").getAsFloat());
            assertEquals(64, json.get("outputWidth").getAsInt());
            assertEquals(32, json.get("outputHeight").getAsInt());
        }

        @Test
        void metadataComesFromAnnotation() {
            BilinearResampleStage stage = new BilinearResampleStage(1.0f, 4, 4);
            assertEquals("BilinearResample", stage.getNodeType());
            assertEquals("Transform", stage.getCategory());
        }
    }
}
