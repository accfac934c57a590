package com.ttennebkram.heightmap.error;

/**
 * Base class for all failures raised by the height map pipeline.
 * Unchecked: callers either fix their arguments or let the failure propagate.
 */
public class HeightMapException extends RuntimeException {

    public HeightMapException(String message) {
        super(message);
    }

    public HeightMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
