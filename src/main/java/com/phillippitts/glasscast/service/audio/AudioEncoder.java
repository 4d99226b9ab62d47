package com.phillippitts.glasscast.service.audio;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.EncodedAacPacket;

import java.util.List;

/**
 * PCM to AAC encoder bound to one streaming session.
 *
 * Contract:
 * - Output is AAC-LC, 24 kHz, mono, 64 kbps ({@link AacFormat})
 * - The first chunk's format binds the internal resampler for the life of the encoder
 * - Returns zero or more packets per call; an empty list is backpressure, not an error
 * - Not thread-safe; callers feed chunks from a single producer
 */
public interface AudioEncoder extends AutoCloseable {

    /**
     * Encodes one chunk.
     *
     * @param chunk PCM chunk in arrival order
     * @return packets completed by this chunk, possibly empty
     * @throws com.phillippitts.glasscast.exception.EncodeException if the chunk is rejected
     * @throws com.phillippitts.glasscast.exception.PartialEncodeException if encoding fails after
     *         some packets of the chunk were completed; those packets travel with the exception
     */
    List<EncodedAacPacket> encode(AudioChunk chunk);

    /** Releases native resources. Idempotent. */
    @Override
    void close();
}
