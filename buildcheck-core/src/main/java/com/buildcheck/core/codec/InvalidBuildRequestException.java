package com.buildcheck.core.codec;

/**
 * Thrown when build JSON cannot be turned into a {@link com.buildcheck.core.model.Build}.
 *
 * <p>Raised at the decoding boundary only: malformed JSON, unexpected keys, or a component
 * placed in a slot of another category. The engine itself never sees malformed input.
 */
public class InvalidBuildRequestException extends RuntimeException {

    public InvalidBuildRequestException(String message) {
        super(message);
    }

    public InvalidBuildRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
