package com.umitunal.qcast.serialization;

/**
 * Thrown when a stored value cannot be encoded or decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
