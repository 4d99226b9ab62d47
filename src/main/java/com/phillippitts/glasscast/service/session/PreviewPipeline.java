package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.service.transport.StreamingStatsTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Local JPEG preview only; nothing leaves the process except {@code PreviewFrameEvent}s.
 */
public class PreviewPipeline implements StreamingPipeline {

    private static final Logger LOG = LogManager.getLogger(PreviewPipeline.class);

    static final String NAME = "preview";

    private final PreviewTap preview;
    private final StreamingStatsTracker stats;
    private volatile Listener listener;

    PreviewPipeline(PreviewTap preview, StreamingStatsTracker stats) {
        this.preview = Objects.requireNonNull(preview, "preview must not be null");
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void start(Listener pipelineListener) {
        this.listener = Objects.requireNonNull(pipelineListener, "listener must not be null");
        preview.reset();
        stats.reset();
        stats.markConnected();
    }

    @Override
    public boolean streamsOnStart() {
        return false;
    }

    @Override
    public void onVideoFrame(RawVideoFrame frame) {
        byte[] jpeg = tapPreview(preview, frame, listener);
        if (jpeg != null) {
            stats.record(jpeg.length);
        }
    }

    /**
     * Offers a frame to the tap and reports the result.
     *
     * @return the JPEG that was emitted, or {@code null}
     */
    static byte[] tapPreview(PreviewTap tap, RawVideoFrame frame, Listener listener) {
        try {
            byte[] jpeg = tap.offer(frame);
            if (jpeg != null) {
                listener.onPreviewFrame(frame.width(), frame.height(), jpeg);
            }
            return jpeg;
        } catch (EncodeException e) {
            LOG.warn("Preview frame dropped: {}", e.getMessage());
            listener.onEncodeWarning(e);
            return null;
        }
    }

    @Override
    public void stop(Duration budget) {
        stats.reset();
    }

    @Override
    public StreamingStats recomputeStats() {
        return stats.recompute();
    }
}
