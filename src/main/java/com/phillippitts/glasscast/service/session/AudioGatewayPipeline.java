package com.phillippitts.glasscast.service.session;

import com.phillippitts.glasscast.domain.AdtsFrame;
import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.EncodedAacPacket;
import com.phillippitts.glasscast.domain.StreamingStats;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.PartialEncodeException;
import com.phillippitts.glasscast.exception.TransportException;
import com.phillippitts.glasscast.service.audio.AdtsFramer;
import com.phillippitts.glasscast.service.audio.AudioEncoder;
import com.phillippitts.glasscast.service.audio.AudioEncoderFactory;
import com.phillippitts.glasscast.service.metrics.StreamingMetrics;
import com.phillippitts.glasscast.service.transport.audio.AudioTransportSession;
import com.phillippitts.glasscast.service.transport.audio.TransportStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * PCM chunks → AAC packets → ADTS frames → audio gateway WebSocket.
 *
 * <p>A fresh encoder is created on every start and closed once the transport has stopped, so its
 * resampler lives exactly as long as one transport session. Every packet an encoder call yields
 * is framed and sent on its own, each taking the next chunk index.
 */
public class AudioGatewayPipeline implements StreamingPipeline {

    private static final Logger LOG = LogManager.getLogger(AudioGatewayPipeline.class);

    static final String NAME = "audio-gateway";

    private final AudioTransportSession transport;
    private final AudioEncoderFactory encoderFactory;
    private final StreamingMetrics metrics;

    private final Object encoderLock = new Object();
    private AudioEncoder encoder;
    private volatile Listener listener;

    public AudioGatewayPipeline(AudioTransportSession transport,
                                AudioEncoderFactory encoderFactory,
                                StreamingMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.encoderFactory = Objects.requireNonNull(encoderFactory, "encoderFactory must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void start(Listener pipelineListener) {
        this.listener = Objects.requireNonNull(pipelineListener, "listener must not be null");
        synchronized (encoderLock) {
            closeEncoder();
            encoder = encoderFactory.create();
        }
        transport.start(new AudioTransportSession.Listener() {
            @Override
            public void onStatusChanged(TransportStatus status) {
                LOG.debug("Audio gateway status: {}", status);
            }

            @Override
            public void onTransportError(TransportException error) {
                pipelineListener.onTransportFailure(error);
            }
        });
    }

    @Override
    public boolean streamsOnStart() {
        return true;
    }

    @Override
    public void onAudioChunk(AudioChunk chunk) {
        List<EncodedAacPacket> packets;
        synchronized (encoderLock) {
            if (encoder == null) {
                return;
            }
            try {
                packets = encoder.encode(chunk);
            } catch (PartialEncodeException e) {
                LOG.warn("Audio chunk partially encoded, sending {} packet(s): {}",
                        e.getCompleted().size(), e.getMessage());
                listener.onEncodeWarning(e);
                packets = e.getCompleted();
            } catch (EncodeException e) {
                LOG.warn("Audio chunk dropped: {}", e.getMessage());
                listener.onEncodeWarning(e);
                return;
            }
        }
        for (EncodedAacPacket packet : packets) {
            AdtsFrame frame = AdtsFramer.frame(packet);
            if (transport.sendAudio(frame)) {
                metrics.audioChunkSent(frame.length());
            }
        }
    }

    @Override
    public void stop(Duration budget) {
        transport.stop(budget);
        synchronized (encoderLock) {
            closeEncoder();
        }
    }

    private void closeEncoder() {
        if (encoder != null) {
            encoder.close();
            encoder = null;
        }
    }

    @Override
    public StreamingStats recomputeStats() {
        return transport.recomputeStats();
    }
}
