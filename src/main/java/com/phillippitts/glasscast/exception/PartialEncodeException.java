package com.phillippitts.glasscast.exception;

import com.phillippitts.glasscast.domain.EncodedAacPacket;

import java.util.List;

/**
 * Thrown when an encoder fails partway through a chunk after it already produced packets.
 * The completed packets carry consumed sequence indices and should still be delivered.
 */
public class PartialEncodeException extends EncodeException {

    private final List<EncodedAacPacket> completed;

    public PartialEncodeException(String message, String codec, List<EncodedAacPacket> completed,
                                  Throwable cause) {
        super(message, codec, cause);
        this.completed = List.copyOf(completed);
    }

    public List<EncodedAacPacket> getCompleted() {
        return completed;
    }
}
