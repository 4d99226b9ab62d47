package com.phillippitts.glasscast.service.video;

/**
 * Compresses NV21 frames into JPEG images for on-screen preview.
 */
public interface JpegPreviewEncoder {

    /**
     * Encodes one NV21 frame.
     *
     * @param nv21 semi-planar frame bytes
     * @param width frame width in pixels
     * @param height frame height in pixels
     * @return JPEG file bytes
     * @throws com.phillippitts.glasscast.exception.EncodeException if the image cannot be encoded
     */
    byte[] encode(byte[] nv21, int width, int height);
}
