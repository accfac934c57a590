package com.ttennebkram.heightmap.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.RowScheduler;

/**
 * Fixed 3x3 Gaussian blur.
 * Kernel [1 2 1; 2 4 2; 1 2 1] / 16 with integer (truncating) division.
 * Border samples are replicated by clamping indices into the grid, unlike the
 * bilateral filter which skips them. The unsharp mask depends on this policy.
 */
@StageInfo(
    nodeType = "GaussianBlur",
    displayName = "Gaussian Blur 3x3",
    category = "Blur",
    description = "Fixed [1 2 1; 2 4 2; 1 2 1] / 16 kernel, clamped borders"
)
public class GaussianBlurStage extends StageBase<IntensityGrid> {

    private static final int[][] KERNEL = {
        {1, 2, 1},
        {2, 4, 2},
        {1, 2, 1}
    };
    private static final int KERNEL_SUM = 16;

    public GaussianBlurStage() {
        this(RowScheduler.sequential());
    }

    public GaussianBlurStage(RowScheduler scheduler) {
        super(scheduler);
    }

    public static IntensityGrid gaussianBlur(IntensityGrid image) {
        return new GaussianBlurStage().process(image);
    }

    @Override
    public IntensityGrid process(IntensityGrid input) {
        IntensityGrid image = requireInput(input);
        int width = image.width();
        int height = image.height();
        byte[] source = image.samples();
        byte[] result = new byte[width * height];

        scheduler.forEachRow(height, i -> {
            for (int j = 0; j < width; j++) {
                int sum = 0;
                for (int ki = -1; ki <= 1; ki++) {
                    int ni = clamp(i + ki, height - 1);
                    for (int kj = -1; kj <= 1; kj++) {
                        int nj = clamp(j + kj, width - 1);
                        sum += (source[ni * width + nj] & 0xFF) * KERNEL[ki + 1][kj + 1];
                    }
                }
                result[i * width + j] = (byte) (sum / KERNEL_SUM);
            }
        });

        return IntensityGrid.fromSamples(width, height, result);
    }

    private static int clamp(int index, int max) {
        return Math.max(0, Math.min(max, index));
    }

    @Override
    public boolean hasProperties() {
        return false;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        // Fixed kernel, nothing to save
    }
}
