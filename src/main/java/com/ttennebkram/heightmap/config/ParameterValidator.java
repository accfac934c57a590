package com.ttennebkram.heightmap.config;

import com.ttennebkram.heightmap.error.ConfigurationException;

/**
 * Argument checks shared by the settings builder and the individual stages.
 * Each check throws {@link ConfigurationException} with the offending value.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    public static int requireDiameter(int diameter) {
        if (diameter < 1 || diameter % 2 == 0) {
            throw new ConfigurationException("Bilateral diameter must be odd and >= 1, got " + diameter);
        }
        return diameter;
    }

    /**
     * A Gaussian spread: positive, finite, and with 2 * sigma^2 still a positive finite double,
     * since that is the divisor the weight is computed with.
     */
    public static double requireSigma(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be a positive finite number, got " + value);
        }
        double twoSigmaSq = 2 * value * value;
        if (!(twoSigmaSq > 0) || Double.isInfinite(twoSigmaSq)) {
            throw new ConfigurationException(name + " = " + value + " is too small or too large to weight with");
        }
        return value;
    }

    public static double requireFinite(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be finite, got " + value);
        }
        return value;
    }

    public static int requireOutputSize(String name, int size) {
        if (size <= 0) {
            throw new ConfigurationException(name + " must be > 0, got " + size);
        }
        return size;
    }
}
