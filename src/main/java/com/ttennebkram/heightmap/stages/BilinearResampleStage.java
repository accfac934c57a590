package com.ttennebkram.heightmap.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.heightmap.config.ParameterValidator;
import com.ttennebkram.heightmap.grid.HeightGrid;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.RowScheduler;

/**
 * Resample + scale stage.
 * Maps an intensity grid of any size onto an output grid of the requested size with
 * bilinear interpolation, then multiplies each sample by the scale factor to get heights.
 *
 * Output corners line up with input corners. A one-sample output dimension maps every
 * output sample to input coordinate 0 on that axis.
 */
@StageInfo(
    nodeType = "BilinearResample",
    displayName = "Bilinear Resample",
    category = "Transform",
    description = "Bilinear resize to output size, intensity * scaleFactor"
)
public class BilinearResampleStage extends StageBase<HeightGrid> {

    private final float scaleFactor;
    private final int outputWidth;
    private final int outputHeight;

    public BilinearResampleStage(float scaleFactor, int outputWidth, int outputHeight) {
        this(scaleFactor, outputWidth, outputHeight, RowScheduler.sequential());
    }

    public BilinearResampleStage(float scaleFactor, int outputWidth, int outputHeight, RowScheduler scheduler) {
        super(scheduler);
        this.scaleFactor = (float) ParameterValidator.requireFinite("scaleFactor", scaleFactor);
        this.outputWidth = ParameterValidator.requireOutputSize("outputWidth", outputWidth);
        this.outputHeight = ParameterValidator.requireOutputSize("outputHeight", outputHeight);
    }

    public static HeightGrid resampleAndScale(IntensityGrid image, float scaleFactor,
                                              int outputWidth, int outputHeight) {
        return new BilinearResampleStage(scaleFactor, outputWidth, outputHeight).process(image);
    }

    @Override
    public HeightGrid process(IntensityGrid input) {
        IntensityGrid image = requireInput(input);
        float[] heights = new float[outputWidth * outputHeight];

        float xRatio = ratio(image.width(), outputWidth);
        float yRatio = ratio(image.height(), outputHeight);

        scheduler.forEachRow(outputHeight, j -> {
            float y = j * yRatio;
            for (int i = 0; i < outputWidth; i++) {
                float x = i * xRatio;
                heights[j * outputWidth + i] = bilinearInterpolate(image, x, y) * scaleFactor;
            }
        });

        return HeightGrid.fromSamples(outputWidth, outputHeight, heights);
    }

    /**
     * Interpolate the grid at a fractional (x, y) = (col, row) position.
     * At integer coordinates this returns the sample itself.
     *
     * @throws IllegalArgumentException if the position lies outside [0, width) x [0, height)
     */
    public static float bilinearInterpolate(IntensityGrid image, float x, float y) {
        int width = image.width();
        int height = image.height();
        if (!(x >= 0 && x < width && y >= 0 && y < height)) {
            throw new IllegalArgumentException("(" + x + ", " + y + ") outside "
                    + width + "x" + height + " grid");
        }

        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);
        int x1 = Math.min(x0 + 1, width - 1);
        int y1 = Math.min(y0 + 1, height - 1);

        float dx = x - x0;
        float dy = y - y0;

        float topLeft = image.get(y0, x0);
        float topRight = image.get(y0, x1);
        float bottomLeft = image.get(y1, x0);
        float bottomRight = image.get(y1, x1);

        float top = topLeft * (1 - dx) + topRight * dx;
        float bottom = bottomLeft * (1 - dx) + bottomRight * dx;

        return top * (1 - dy) + bottom * dy;
    }

    private static float ratio(int inputSize, int outputSize) {
        if (outputSize == 1) {
            return 0f;
        }
        return (inputSize - 1) / (float) (outputSize - 1);
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("scaleFactor", scaleFactor);
        json.addProperty("outputWidth", outputWidth);
        json.addProperty("outputHeight", outputHeight);
    }
}
