package com.phillippitts.glasscast.service.video;

import com.phillippitts.glasscast.exception.EncodeException;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMWRITE_JPEG_QUALITY;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imencode;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_YUV2BGR_NV21;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * OpenCV-backed JPEG encoder. Native buffers are released before returning.
 */
public class OpenCvJpegPreviewEncoder implements JpegPreviewEncoder {

    private static final String CODEC = "jpeg";

    private final int quality;

    public OpenCvJpegPreviewEncoder(int quality) {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("JPEG quality must be in 1..100: " + quality);
        }
        this.quality = quality;
    }

    @Override
    public byte[] encode(byte[] nv21, int width, int height) {
        BytePointer source = new BytePointer(nv21);
        Mat yuv = new Mat(height * 3 / 2, width, CV_8UC1, source);
        Mat bgr = new Mat();
        BytePointer jpeg = new BytePointer();
        IntPointer params = new IntPointer(IMWRITE_JPEG_QUALITY, quality);
        try {
            cvtColor(yuv, bgr, COLOR_YUV2BGR_NV21);
            if (!imencode(".jpg", bgr, jpeg, params)) {
                throw new EncodeException("imencode returned false for " + width + "x" + height, CODEC);
            }
            byte[] out = new byte[(int) jpeg.limit()];
            jpeg.get(out);
            return out;
        } catch (EncodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EncodeException("JPEG preview encoding failed: " + e.getMessage(), CODEC, e);
        } finally {
            params.close();
            jpeg.close();
            bgr.close();
            yuv.close();
            source.close();
        }
    }

    public int getQuality() {
        return quality;
    }
}
