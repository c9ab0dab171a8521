package com.anodi.server.ai;

/**
 * Raised when input data is malformed: non-binary pixels, mismatched image
 * dimensions, an empty image set, or histograms that cannot be compared.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
