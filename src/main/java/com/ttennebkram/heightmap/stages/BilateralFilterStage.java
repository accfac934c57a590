package com.ttennebkram.heightmap.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.heightmap.config.ParameterValidator;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.RowScheduler;

/**
 * Bilateral filter stage.
 * Edge-preserving smoothing: each neighbour is weighted by both its distance from the
 * centre pixel and its intensity difference from it.
 *
 * Neighbours that fall outside the grid are skipped, so border pixels average over fewer
 * samples than interior ones.
 */
@StageInfo(
    nodeType = "BilateralFilter",
    displayName = "Bilateral Filter",
    category = "Blur",
    description = "Edge-preserving denoise, out-of-bounds neighbours skipped"
)
public class BilateralFilterStage extends StageBase<IntensityGrid> {

    private final int diameter;
    private final double sigmaColor;
    private final double sigmaSpace;

    public BilateralFilterStage(int diameter, double sigmaColor, double sigmaSpace) {
        this(diameter, sigmaColor, sigmaSpace, RowScheduler.sequential());
    }

    public BilateralFilterStage(int diameter, double sigmaColor, double sigmaSpace, RowScheduler scheduler) {
        super(scheduler);
        this.diameter = ParameterValidator.requireDiameter(diameter);
        this.sigmaColor = ParameterValidator.requireSigma("sigmaColor", sigmaColor);
        this.sigmaSpace = ParameterValidator.requireSigma("sigmaSpace", sigmaSpace);
    }

    /**
     * Filter a grid on the calling thread.
     *
     * @param image input grid
     * @param diameter odd neighbourhood span, at least 1
     * @param sigmaColor spread of the intensity weight
     * @param sigmaSpace spread of the spatial weight
     * @return filtered grid with the same dimensions
     */
    public static IntensityGrid bilateralFilter(IntensityGrid image, int diameter,
                                                double sigmaColor, double sigmaSpace) {
        return new BilateralFilterStage(diameter, sigmaColor, sigmaSpace).process(image);
    }

    @Override
    public IntensityGrid process(IntensityGrid input) {
        IntensityGrid image = requireInput(input);
        int width = image.width();
        int height = image.height();
        byte[] source = image.samples();
        byte[] result = new byte[width * height];

        int half = diameter / 2;
        double twoSigmaColorSq = 2 * sigmaColor * sigmaColor;
        double twoSigmaSpaceSq = 2 * sigmaSpace * sigmaSpace;

        scheduler.forEachRow(height, i -> {
            for (int j = 0; j < width; j++) {
                double weightSum = 0.0;
                double pixelSum = 0.0;
                double centerVal = source[i * width + j] & 0xFF;

                for (int k = -half; k <= half; k++) {
                    int ni = i + k;
                    if (ni < 0 || ni >= height) {
                        continue;
                    }
                    for (int l = -half; l <= half; l++) {
                        int nj = j + l;
                        if (nj < 0 || nj >= width) {
                            continue;
                        }

                        double neighborVal = source[ni * width + nj] & 0xFF;
                        double spatialDistSq = k * k + l * l;
                        double intensityDiff = neighborVal - centerVal;
                        double intensityDistSq = intensityDiff * intensityDiff;

                        double weight = Math.exp(-((spatialDistSq / twoSigmaSpaceSq)
                                + (intensityDistSq / twoSigmaColorSq)));
                        weightSum += weight;
                        pixelSum += neighborVal * weight;
                    }
                }
                // Centre pixel always contributes weight 1, so weightSum >= 1
                result[i * width + j] = (byte) Math.rint(pixelSum / weightSum);
            }
        });

        return IntensityGrid.fromSamples(width, height, result);
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("diameter", diameter);
        json.addProperty("sigmaColor", sigmaColor);
        json.addProperty("sigmaSpace", sigmaSpace);
    }

    public int getDiameter() {
        return diameter;
    }

    public double getSigmaColor() {
        return sigmaColor;
    }

    public double getSigmaSpace() {
        return sigmaSpace;
    }
}
