package com.ttennebkram.heightmap.error;

/**
 * Raised when an input grid is missing, empty, ragged, or not a single-channel 8-bit image.
 */
public class DegenerateInputException extends HeightMapException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
