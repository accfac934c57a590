package com.ttennebkram.heightmap.stages;

import com.google.gson.JsonObject;
import com.ttennebkram.heightmap.grid.IntensityGrid;

/**
 * One step of the height map pipeline.
 * Each stage encapsulates:
 * - Processing logic (a pure transform of an intensity grid)
 * - Serialization of its parameters (JSON)
 *
 * @param <R> the grid type the stage produces
 */
public interface Stage<R> {

    /**
     * Get the stage type name (e.g., "BilateralFilter", "UnsharpMask").
     */
    String getNodeType();

    /**
     * Get the display name used in log output.
     */
    String getDisplayName();

    /**
     * Get the category (e.g., "Blur", "Sharpen").
     */
    String getCategory();

    /**
     * Get a description of this stage.
     */
    String getDescription();

    /**
     * Process an input grid and return the result.
     *
     * @param input The input grid (not modified)
     * @return A newly allocated output grid
     */
    R process(IntensityGrid input);

    /**
     * Check if this stage has configurable properties.
     * If false, nothing is written to settings JSON.
     */
    default boolean hasProperties() {
        return true;
    }

    /**
     * Serialize stage-specific properties to JSON.
     * Called when saving settings.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);
}
