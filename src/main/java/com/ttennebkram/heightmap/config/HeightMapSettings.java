package com.ttennebkram.heightmap.config;

import com.ttennebkram.heightmap.processing.RowScheduler;
import com.ttennebkram.heightmap.stages.BilateralFilterStage;
import com.ttennebkram.heightmap.stages.UnsharpMaskStage;

import java.util.Objects;

/**
 * Immutable filter parameters for one height map run.
 * Defaults are the values the pipeline was tuned with; use {@link #builder()} to override them.
 */
public final class HeightMapSettings {

    public static final int DEFAULT_DIAMETER = 5;
    public static final double DEFAULT_SIGMA_COLOR = 25.0;
    public static final double DEFAULT_SIGMA_SPACE = 5.0;
    public static final double DEFAULT_AMOUNT = 1.5;
    public static final boolean DEFAULT_PARALLEL_ROWS = true;

    private static final HeightMapSettings DEFAULTS = builder().build();

    private final int diameter;
    private final double sigmaColor;
    private final double sigmaSpace;
    private final double amount;
    private final boolean parallelRows;

    private HeightMapSettings(Builder builder) {
        this.diameter = builder.diameter;
        this.sigmaColor = builder.sigmaColor;
        this.sigmaSpace = builder.sigmaSpace;
        this.amount = builder.amount;
        this.parallelRows = builder.parallelRows;
    }

    public static HeightMapSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this instance's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .diameter(diameter)
                .sigmaColor(sigmaColor)
                .sigmaSpace(sigmaSpace)
                .amount(amount)
                .parallelRows(parallelRows);
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

    public double getAmount() {
        return amount;
    }

    public boolean isParallelRows() {
        return parallelRows;
    }

    public RowScheduler createScheduler() {
        return parallelRows ? RowScheduler.parallel() : RowScheduler.sequential();
    }

    public BilateralFilterStage createBilateralFilter(RowScheduler scheduler) {
        return new BilateralFilterStage(diameter, sigmaColor, sigmaSpace, scheduler);
    }

    public UnsharpMaskStage createUnsharpMask(RowScheduler scheduler) {
        return new UnsharpMaskStage(amount, scheduler);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeightMapSettings)) return false;
        HeightMapSettings that = (HeightMapSettings) o;
        return diameter == that.diameter
                && Double.compare(that.sigmaColor, sigmaColor) == 0
                && Double.compare(that.sigmaSpace, sigmaSpace) == 0
                && Double.compare(that.amount, amount) == 0
                && parallelRows == that.parallelRows;
    }

    @Override
    public int hashCode() {
        return Objects.hash(diameter, sigmaColor, sigmaSpace, amount, parallelRows);
    }

    @Override
    public String toString() {
        return "HeightMapSettings{diameter=" + diameter
                + ", sigmaColor=" + sigmaColor
                + ", sigmaSpace=" + sigmaSpace
                + ", amount=" + amount
                + ", parallelRows=" + parallelRows + "}";
    }

    /**
     * Builder for {@link HeightMapSettings}. Values are checked in {@link #build()}.
     */
    public static final class Builder {
        private int diameter = DEFAULT_DIAMETER;
        private double sigmaColor = DEFAULT_SIGMA_COLOR;
        private double sigmaSpace = DEFAULT_SIGMA_SPACE;
        private double amount = DEFAULT_AMOUNT;
        private boolean parallelRows = DEFAULT_PARALLEL_ROWS;

        private Builder() {
        }

        public Builder diameter(int diameter) {
            this.diameter = diameter;
            return this;
        }

        public Builder sigmaColor(double sigmaColor) {
            this.sigmaColor = sigmaColor;
            return this;
        }

        public Builder sigmaSpace(double sigmaSpace) {
            this.sigmaSpace = sigmaSpace;
            return this;
        }

        public Builder amount(double amount) {
            this.amount = amount;
            return this;
        }

        public Builder parallelRows(boolean parallelRows) {
            this.parallelRows = parallelRows;
            return this;
        }

        /**
         * @throws com.ttennebkram.heightmap.error.ConfigurationException if any value is invalid
         */
        public HeightMapSettings build() {
            ParameterValidator.requireDiameter(diameter);
            ParameterValidator.requireSigma("sigmaColor", sigmaColor);
            ParameterValidator.requireSigma("sigmaSpace", sigmaSpace);
            ParameterValidator.requireFinite("amount", amount);
            return new HeightMapSettings(this);
        }
    }
}
