package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.RawVideoFrame;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.metrics.StreamingMetrics;
import com.phillippitts.glasscast.service.transport.rtmp.RtmpStatus;
import com.phillippitts.glasscast.service.transport.rtmp.RtmpTransportSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * I420 frames → RTMP push, with an optional JPEG preview tap on the same frames.
 */
public class RtmpVideoPipeline implements StreamingPipeline {

    private static final Logger LOG = LogManager.getLogger(RtmpVideoPipeline.class);

    static final String NAME = "rtmp";

    private final RtmpTransportSession transport;
    private final PreviewTap preview;
    private final StreamingMetrics metrics;
    private volatile Listener listener;

    /**
     * @param preview preview tap, or {@code null} to push video only
     */
    RtmpVideoPipeline(RtmpTransportSession transport, PreviewTap preview, StreamingMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.preview = preview;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RtmpVideoPipeline(RtmpTransportSession transport, StreamingMetrics metrics) {
        this(transport, null, metrics);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void start(Listener pipelineListener) {
        this.listener = Objects.requireNonNull(pipelineListener, "listener must not be null");
        if (preview != null) {
            preview.reset();
        }
        transport.start(new RtmpTransportSession.Listener() {
            @Override
            public void onStatusChanged(RtmpStatus status) {
                LOG.debug("RTMP status: {}", status);
            }

            @Override
            public void onTransportError(TransportException error) {
                pipelineListener.onTransportFailure(error);
            }

            @Override
            public void onEncodeWarning(EncodeException warning) {
                pipelineListener.onEncodeWarning(warning);
            }

            @Override
            public void onFramePublished(int bytes) {
                metrics.videoFrameSent();
            }
        });
    }

    @Override
    public boolean streamsOnStart() {
        return false;
    }

    @Override
    public void onVideoFrame(RawVideoFrame frame) {
        if (preview != null) {
            PreviewPipeline.tapPreview(preview, frame, listener);
        }
        if (!transport.feedFrame(frame)) {
            metrics.videoFrameDropped();
        }
    }

    @Override
    public void stop(Duration budget) {
        transport.stop(budget);
    }

    @Override
    public StreamingStats recomputeStats() {
        return transport.recomputeStats();
    }
}
