package com.ttennebkram.heightmap.grid;

import com.ttennebkram.heightmap.error.DegenerateInputException;

import java.util.Arrays;

/**
 * Immutable grid of unsigned 8-bit intensity samples.
 * Row-major storage, indexed (row, col). Every factory copies its input so a grid
 * never aliases a caller's array or another grid.
 */
public final class IntensityGrid {

    private final int width;
    private final int height;
    private final byte[] samples;

    private IntensityGrid(int width, int height, byte[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Create a grid from row-major samples.
     *
     * @param width number of columns, at least 1
     * @param height number of rows, at least 1
     * @param samples width * height samples, read as unsigned bytes (copied)
     */
    public static IntensityGrid fromSamples(int width, int height, byte[] samples) {
        int area = area(width, height);
        if (samples == null || samples.length != area) {
            throw new IllegalArgumentException("Expected " + area + " samples for "
                    + width + "x" + height + " grid, got "
                    + (samples == null ? "null" : String.valueOf(samples.length)));
        }
        return new IntensityGrid(width, height, samples.clone());
    }

    /**
     * Create a grid from rows of int values in [0, 255].
     */
    public static IntensityGrid of(int[][] rows) {
        checkRows(rows);
        int height = rows.length;
        int width = rows[0].length;
        byte[] samples = new byte[area(width, height)];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int value = rows[row][col];
                if (value < 0 || value > 255) {
                    throw new IllegalArgumentException("Sample (" + row + ", " + col + ") = " + value
                            + " is outside [0, 255]");
                }
                samples[row * width + col] = (byte) value;
            }
        }
        return new IntensityGrid(width, height, samples);
    }

    /**
     * Create a grid from rows of bytes, read as unsigned.
     */
    public static IntensityGrid of(byte[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new DegenerateInputException("Intensity grid has no rows");
        }
        int width = rows[0] == null ? 0 : rows[0].length;
        byte[] samples = new byte[area(width, rows.length)];
        for (int row = 0; row < rows.length; row++) {
            if (rows[row] == null || rows[row].length != width) {
                throw new DegenerateInputException("Intensity grid is ragged at row " + row);
            }
            System.arraycopy(rows[row], 0, samples, row * width, width);
        }
        return new IntensityGrid(width, rows.length, samples);
    }

    /**
     * Create a grid where every sample has the same value.
     */
    public static IntensityGrid uniform(int width, int height, int value) {
        int area = area(width, height);
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Value " + value + " is outside [0, 255]");
        }
        byte[] samples = new byte[area];
        Arrays.fill(samples, (byte) value);
        return new IntensityGrid(width, height, samples);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Unsigned sample value at (row, col), in [0, 255].
     */
    public int get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside "
                    + width + "x" + height + " grid");
        }
        return samples[row * width + col] & 0xFF;
    }

    /**
     * Copy of the row-major samples.
     */
    public byte[] samples() {
        return samples.clone();
    }

    /**
     * Copy of the samples as rows of unsigned ints.
     */
    public int[][] toArray() {
        int[][] rows = new int[height][width];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                rows[row][col] = samples[row * width + col] & 0xFF;
            }
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntensityGrid)) return false;
        IntensityGrid other = (IntensityGrid) o;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "IntensityGrid[" + width + "x" + height + "]";
    }

    private static void checkRows(int[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new DegenerateInputException("Intensity grid has no rows");
        }
        int width = rows[0] == null ? 0 : rows[0].length;
        checkDimensions(width, rows.length);
        for (int row = 1; row < rows.length; row++) {
            if (rows[row] == null || rows[row].length != width) {
                throw new DegenerateInputException("Intensity grid is ragged at row " + row);
            }
        }
    }

    static void checkDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new DegenerateInputException("Grid must be at least 1x1, got " + width + "x" + height);
        }
    }

    /**
     * Sample count of a width x height grid, which must fit in one array.
     */
    static int area(int width, int height) {
        checkDimensions(width, height);
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid " + width + "x" + height + " is too large for one array", e);
        }
    }
}
