package com.ttennebkram.heightmap.grid;

import java.util.Arrays;

/**
 * Immutable grid of float heights produced by the resample stage.
 * Same (row, col) row-major layout as {@link IntensityGrid}.
 */
public final class HeightGrid {

    private final int width;
    private final int height;
    private final float[] samples;

    private HeightGrid(int width, int height, float[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Create a grid from row-major heights (copied).
     */
    public static HeightGrid fromSamples(int width, int height, float[] samples) {
        int area = IntensityGrid.area(width, height);
        if (samples == null || samples.length != area) {
            throw new IllegalArgumentException("Expected " + area + " samples for "
                    + width + "x" + height + " grid, got "
                    + (samples == null ? "null" : String.valueOf(samples.length)));
        }
        return new HeightGrid(width, height, samples.clone());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside "
                    + width + "x" + height + " grid");
        }
        return samples[row * width + col];
    }

    /**
     * Copy of the row-major heights.
     */
    public float[] samples() {
        return samples.clone();
    }

    public float[][] toArray() {
        float[][] rows = new float[height][width];
        for (int row = 0; row < height; row++) {
            System.arraycopy(samples, row * width, rows[row], 0, width);
        }
        return rows;
    }

    public float min() {
        float min = Float.POSITIVE_INFINITY;
        for (float v : samples) {
            min = Math.min(min, v);
        }
        return min;
    }

    public float max() {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : samples) {
            max = Math.max(max, v);
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeightGrid)) return false;
        HeightGrid other = (HeightGrid) o;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "HeightGrid[" + width + "x" + height + "]";
    }
}
