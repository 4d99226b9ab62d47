package com.phillippitts.glasscast.service.transport.rtmp;

import com.phillippitts.glasscast.config.transport.RtmpProperties;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.exception.TransportExceptionBuilder;
import com.phillippitts.glasscast.util.LogSanitizer;
import com.phillippitts.glasscast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.FrameRecorder;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * H.264 in FLV over RTMP via JavaCV's {@link FFmpegFrameRecorder}.
 *
 * <p>Frames are handed over as I420 planes with no intermediate conversion. Failures raised by
 * the codec are reported as {@link EncodeException}; anything else (handshake, socket write) as
 * {@link TransportException}.
 */
public class FfmpegRtmpPublisher implements VideoPublisher {

    private static final Logger LOG = LogManager.getLogger(FfmpegRtmpPublisher.class);

    private static final String CODEC = "h264";

    private final FFmpegFrameRecorder recorder;
    private final String endpoint;
    private final int width;
    private final int height;
    private final AtomicBoolean released = new AtomicBoolean();

    public FfmpegRtmpPublisher(String publishUrl, int width, int height, RtmpProperties props) {
        this.endpoint = LogSanitizer.redactCredentials(publishUrl);
        this.width = width;
        this.height = height;
        this.recorder = new FFmpegFrameRecorder(publishUrl, width, height, 0);
        configure(recorder, props);
    }

    private static void configure(FFmpegFrameRecorder recorder, RtmpProperties props) {
        int fps = props.getFrameRate();
        recorder.setFormat("flv");
        recorder.setVideoCodec(avcodec.AV_CODEC_ID_H264);
        recorder.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);
        recorder.setVideoBitrate(props.getTargetBitrate());
        recorder.setFrameRate(fps);
        recorder.setGopSize(fps * props.getGopSeconds());

        recorder.setVideoOption("preset", props.getEncoderPreset());
        recorder.setVideoOption("tune", "zerolatency");
        recorder.setVideoOption("bf", "0");
        recorder.setOption("keyint_min", String.valueOf(fps * props.getGopSeconds()));
        recorder.setOption("sc_threshold", "0");
        // microseconds
        recorder.setOption("rw_timeout", String.valueOf(props.getIoTimeoutMs() * 1000L));
    }

    @Override
    public void start() {
        long startNanos = System.nanoTime();
        try {
            recorder.start();
            LOG.info("RTMP publisher connected to {} ({}x{}) in {}ms",
                    endpoint, width, height, TimeUtils.elapsedMillis(startNanos));
        } catch (FrameRecorder.Exception e) {
            throw TransportExceptionBuilder.create("RTMP connect failed")
                    .endpoint(endpoint)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(startNanos))
                    .metadata("width", width)
                    .metadata("height", height)
                    .build();
        }
    }

    @Override
    public void publish(byte[] i420, int frameWidth, int frameHeight, long timestampMicros) {
        try {
            recorder.setTimestamp(timestampMicros);
            recorder.recordImage(frameWidth, frameHeight, Frame.DEPTH_UBYTE, 1, frameWidth,
                    avutil.AV_PIX_FMT_YUV420P, ByteBuffer.wrap(i420));
        } catch (FrameRecorder.Exception e) {
            throw classify(e, timestampMicros);
        }
    }

    private RuntimeException classify(FrameRecorder.Exception e, long timestampMicros) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.contains("avcodec") || message.contains("sws_")) {
            return new EncodeException("Frame at " + timestampMicros + "us rejected: " + message, CODEC, e);
        }
        return TransportExceptionBuilder.create("RTMP write failed")
                .endpoint(endpoint)
                .cause(e)
                .metadata("timestampUs", timestampMicros)
                .build();
    }

    @Override
    public void stop() {
        if (released.get()) {
            return;
        }
        try {
            recorder.stop();
            LOG.info("RTMP publisher closed gracefully");
        } catch (FrameRecorder.Exception e) {
            LOG.warn("RTMP publisher did not close cleanly: {}", e.getMessage());
        } finally {
            forceRelease();
        }
    }

    @Override
    public void forceRelease() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        try {
            recorder.release();
        } catch (FrameRecorder.Exception e) {
            LOG.warn("Failed to release RTMP publisher resources: {}", e.getMessage());
        }
    }
}
