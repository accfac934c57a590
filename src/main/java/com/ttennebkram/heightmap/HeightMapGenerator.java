package com.ttennebkram.heightmap;

import com.ttennebkram.heightmap.config.HeightMapSettings;
import com.ttennebkram.heightmap.config.ParameterValidator;
import com.ttennebkram.heightmap.error.DegenerateInputException;
import com.ttennebkram.heightmap.grid.HeightGrid;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.GridProcessor;
import com.ttennebkram.heightmap.processing.RowScheduler;
import com.ttennebkram.heightmap.stages.BilateralFilterStage;
import com.ttennebkram.heightmap.stages.BilinearResampleStage;
import com.ttennebkram.heightmap.stages.UnsharpMaskStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a grayscale intensity grid into a height map.
 * Stage order is fixed:
 * <ol>
 *   <li>bilateral filter, to remove noise while keeping edges</li>
 *   <li>unsharp mask, to exaggerate height differences at edges</li>
 *   <li>bilinear resample to the output size, times the scale factor</li>
 * </ol>
 * A generator holds no state between runs and can be shared across threads.
 */
public class HeightMapGenerator {

    private static final Logger log = LoggerFactory.getLogger(HeightMapGenerator.class);

    private final HeightMapSettings settings;
    private final RowScheduler scheduler;
    private final BilateralFilterStage bilateralFilter;
    private final UnsharpMaskStage unsharpMask;
    private final GridProcessor enhance;

    public HeightMapGenerator() {
        this(HeightMapSettings.defaults());
    }

    public HeightMapGenerator(HeightMapSettings settings) {
        this(settings, settings.createScheduler());
    }

    public HeightMapGenerator(HeightMapSettings settings, RowScheduler scheduler) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
        this.scheduler = scheduler == null ? RowScheduler.sequential() : scheduler;
        this.bilateralFilter = settings.createBilateralFilter(this.scheduler);
        this.unsharpMask = settings.createUnsharpMask(this.scheduler);
        this.enhance = timed(bilateralFilter::process, bilateralFilter.getDisplayName())
                .andThen(timed(unsharpMask::process, unsharpMask.getDisplayName()));
        log.debug("Pipeline {} [{}] -> {} [{}], {}", bilateralFilter, bilateralFilter.getDescription(),
                unsharpMask, unsharpMask.getDescription(), settings);
    }

    /**
     * Generate a height map with the default settings.
     *
     * @param image grayscale input, at least 1x1
     * @param scaleFactor multiplier from intensity to height units
     * @param outputWidth columns in the result, at least 1
     * @param outputHeight rows in the result, at least 1
     */
    public static HeightGrid generateHeightMap(IntensityGrid image, float scaleFactor,
                                               int outputWidth, int outputHeight) {
        return new HeightMapGenerator().generate(image, scaleFactor, outputWidth, outputHeight);
    }

    /**
     * Run the full pipeline.
     * All arguments are checked before any pixel is touched.
     *
     * @throws com.ttennebkram.heightmap.error.ConfigurationException for an invalid scale or output size
     * @throws DegenerateInputException if the image is null
     */
    public HeightGrid generate(IntensityGrid image, float scaleFactor, int outputWidth, int outputHeight) {
        ParameterValidator.requireFinite("scaleFactor", scaleFactor);
        ParameterValidator.requireOutputSize("outputWidth", outputWidth);
        ParameterValidator.requireOutputSize("outputHeight", outputHeight);
        if (image == null) {
            throw new DegenerateInputException("Input image is null");
        }
        BilinearResampleStage resample = new BilinearResampleStage(scaleFactor, outputWidth, outputHeight, scheduler);

        long start = System.nanoTime();
        IntensityGrid sharpened = enhance.process(image);
        HeightGrid heights = resample.process(sharpened);

        if (log.isDebugEnabled()) {
            log.debug("{} -> {} (scale {}) in {} ms using {}", image, heights, scaleFactor,
                    (System.nanoTime() - start) / 1_000_000, scheduler);
        }
        return heights;
    }

    /**
     * The denoised and sharpened grid the heights are sampled from.
     */
    public IntensityGrid enhance(IntensityGrid image) {
        if (image == null) {
            throw new DegenerateInputException("Input image is null");
        }
        return enhance.process(image);
    }

    public HeightMapSettings getSettings() {
        return settings;
    }

    private static GridProcessor timed(GridProcessor processor, String name) {
        return input -> {
            long start = System.nanoTime();
            IntensityGrid output = processor.process(input);
            if (log.isDebugEnabled()) {
                log.debug("{} on {} took {} us", name, input, (System.nanoTime() - start) / 1_000);
            }
            return output;
        };
    }
}
