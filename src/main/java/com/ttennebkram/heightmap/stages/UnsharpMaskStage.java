package com.ttennebkram.heightmap.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.heightmap.config.ParameterValidator;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.RowScheduler;

/**
 * Unsharp mask stage.
 * Boosts edges by adding back {@code amount} times the difference between the image
 * and its 3x3 Gaussian blur: {@code clamp(image + (int) (amount * (image - blurred)), 0, 255)}.
 */
@StageInfo(
    nodeType = "UnsharpMask",
    displayName = "Unsharp Mask",
    category = "Sharpen",
    description = "image + amount * (image - blur3x3(image)), clamped to [0, 255]"
)
public class UnsharpMaskStage extends StageBase<IntensityGrid> {

    private final double amount;
    private final GaussianBlurStage blur;

    public UnsharpMaskStage(double amount) {
        this(amount, RowScheduler.sequential());
    }

    public UnsharpMaskStage(double amount, RowScheduler scheduler) {
        super(scheduler);
        this.amount = ParameterValidator.requireFinite("amount", amount);
        this.blur = new GaussianBlurStage(this.scheduler);
    }

    public static IntensityGrid unsharpMask(IntensityGrid image, double amount) {
        return new UnsharpMaskStage(amount).process(image);
    }

    @Override
    public IntensityGrid process(IntensityGrid input) {
        IntensityGrid image = requireInput(input);
        int width = image.width();
        int height = image.height();
        byte[] source = image.samples();
        byte[] blurred = blur.process(image).samples();
        byte[] result = new byte[width * height];

        scheduler.forEachRow(height, i -> {
            for (int j = i * width, end = j + width; j < end; j++) {
                int original = source[j] & 0xFF;
                // Bounding the boost to +/-256 keeps the int sum from wrapping for huge amounts
                double boost = Math.max(-256.0, Math.min(256.0, amount * (original - (blurred[j] & 0xFF))));
                int val = original + (int) boost;
                result[j] = (byte) Math.max(0, Math.min(255, val));
            }
        });

        return IntensityGrid.fromSamples(width, height, result);
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("amount", amount);
    }

    public double getAmount() {
        return amount;
    }
}
