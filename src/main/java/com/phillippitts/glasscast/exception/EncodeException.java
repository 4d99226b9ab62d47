package com.phillippitts.glasscast.exception;

/**
 * Thrown when an encoder rejects a single frame or chunk.
 * Not fatal: the unit is dropped and a warning is surfaced.
 */
public class EncodeException extends GlassCastException {

    private final String codec;

    public EncodeException(String message, String codec) {
        super(message + " (codec: " + codec + ")");
        this.codec = codec;
    }

    public EncodeException(String message, String codec, Throwable cause) {
        super(message + " (codec: " + codec + ")", cause);
        this.codec = codec;
    }

    public String getCodec() {
        return codec;
    }
}
