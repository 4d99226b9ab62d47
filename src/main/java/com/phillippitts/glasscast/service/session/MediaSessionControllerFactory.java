package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.config.session.PreviewProperties;
import com.phillippitts.glasscast.config.session.SessionProperties;
import com.phillippitts.glasscast.config.transport.AudioGatewayProperties;
import com.phillippitts.glasscast.config.transport.RtmpProperties;
import com.phillippitts.glasscast.domain.StreamingMode;
import com.phillippitts.glasscast.service.audio.AudioEncoderFactory;
import com.phillippitts.glasscast.service.metrics.StreamingMetrics;
import com.phillippitts.glasscast.service.source.FrameSource;
import com.phillippitts.glasscast.service.transport.StreamingStatsTracker;
import com.phillippitts.glasscast.service.transport.audio.AudioTransportSession;
import com.phillippitts.glasscast.service.transport.rtmp.RtmpTransportSession;
import com.phillippitts.glasscast.service.transport.rtmp.VideoPublisherFactory;
import com.phillippitts.glasscast.service.video.JpegPreviewEncoder;
import jakarta.annotation.PreDestroy;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds controllers with the pipeline for a {@link StreamingMode} and keeps track of them.
 *
 * <p>Every controller gets its own transport session and encoder; only the HTTP client, the
 * frame source and the codec factories are shared. All live controllers are shut down with the
 * application context.
 */
@Component
public class MediaSessionControllerFactory {

    private static final Logger LOG = LogManager.getLogger(MediaSessionControllerFactory.class);

    private final FrameSource source;
    private final SessionProperties sessionProps;
    private final AudioGatewayProperties gatewayProps;
    private final RtmpProperties rtmpProps;
    private final PreviewProperties previewProps;
    private final OkHttpClient httpClient;
    private final AudioEncoderFactory audioEncoderFactory;
    private final VideoPublisherFactory videoPublisherFactory;
    private final JpegPreviewEncoder jpegEncoder;
    private final ApplicationEventPublisher publisher;
    private final StreamingMetrics metrics;

    private final Map<String, MediaSessionController> controllers = new ConcurrentHashMap<>();

    // CHECKSTYLE.OFF: ParameterNumber - Spring constructor injection of independent collaborators
    public MediaSessionControllerFactory(FrameSource source,
                                         SessionProperties sessionProps,
                                         AudioGatewayProperties gatewayProps,
                                         RtmpProperties rtmpProps,
                                         PreviewProperties previewProps,
                                         OkHttpClient httpClient,
                                         AudioEncoderFactory audioEncoderFactory,
                                         VideoPublisherFactory videoPublisherFactory,
                                         JpegPreviewEncoder jpegEncoder,
                                         ApplicationEventPublisher publisher,
                                         StreamingMetrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.sessionProps = Objects.requireNonNull(sessionProps);
        this.gatewayProps = Objects.requireNonNull(gatewayProps);
        this.rtmpProps = Objects.requireNonNull(rtmpProps);
        this.previewProps = Objects.requireNonNull(previewProps);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.audioEncoderFactory = Objects.requireNonNull(audioEncoderFactory);
        this.videoPublisherFactory = Objects.requireNonNull(videoPublisherFactory);
        this.jpegEncoder = Objects.requireNonNull(jpegEncoder);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }
    // CHECKSTYLE.ON: ParameterNumber

    /**
     * Creates and registers an idle controller for the given mode.
     */
    public MediaSessionController create(StreamingMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        MediaSessionController controller = new MediaSessionController(
                mode, source, pipelineFor(mode), sessionProps, publisher, metrics);
        controllers.put(controller.getId(), controller);
        LOG.info("Created {} controller {}", mode, controller.getId());
        return controller;
    }

    StreamingPipeline pipelineFor(StreamingMode mode) {
        return switch (mode) {
            case AUDIO_GATEWAY -> new AudioGatewayPipeline(
                    new AudioTransportSession(httpClient, gatewayProps), audioEncoderFactory, metrics);
            case RTMP_VIDEO -> new RtmpVideoPipeline(
                    new RtmpTransportSession(rtmpProps, videoPublisherFactory),
                    previewProps.isEnabled() ? newPreviewTap() : null,
                    metrics);
            case PREVIEW -> new PreviewPipeline(newPreviewTap(), new StreamingStatsTracker());
        };
    }

    private PreviewTap newPreviewTap() {
        return new PreviewTap(jpegEncoder, previewProps.getMaxFps());
    }

    public Optional<MediaSessionController> find(String id) {
        return Optional.ofNullable(controllers.get(id));
    }

    /**
     * Stops the controller and forgets it.
     *
     * @return {@code true} if a controller with that id existed
     */
    public boolean remove(String id) {
        MediaSessionController controller = controllers.remove(id);
        if (controller == null) {
            return false;
        }
        controller.shutdown();
        LOG.info("Removed controller {}", id);
        return true;
    }

    public Collection<MediaSessionController> controllers() {
        return List.copyOf(controllers.values());
    }

    @PreDestroy
    public void shutdownAll() {
        List<String> ids = new ArrayList<>(controllers.keySet());
        if (!ids.isEmpty()) {
            LOG.info("Shutting down {} media session controller(s)", ids.size());
        }
        for (String id : ids) {
            remove(id);
        }
    }
}
