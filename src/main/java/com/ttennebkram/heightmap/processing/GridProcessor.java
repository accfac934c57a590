package com.ttennebkram.heightmap.processing;

import com.ttennebkram.heightmap.grid.IntensityGrid;

/**
 * A pure intensity-to-intensity transform.
 * Takes a grid and returns a newly allocated grid; the input is never modified.
 */
@FunctionalInterface
public interface GridProcessor {

    /**
     * Process an input grid and return the result.
     *
     * @param input The input grid (read only)
     * @return A new grid owned by the caller
     */
    IntensityGrid process(IntensityGrid input);

    /**
     * Chain another processor after this one.
     */
    default GridProcessor andThen(GridProcessor next) {
        return input -> next.process(process(input));
    }
}
