package com.phillippitts.glasscast.config.pipeline;

import com.phillippitts.glasscast.config.session.PreviewProperties;
import com.phillippitts.glasscast.config.transport.AudioGatewayProperties;
import com.phillippitts.glasscast.config.transport.RtmpProperties;
import com.phillippitts.glasscast.service.audio.AudioEncoderFactory;
import com.phillippitts.glasscast.service.audio.FfmpegAacEncoder;
import com.phillippitts.glasscast.service.transport.rtmp.FfmpegRtmpPublisher;
import com.phillippitts.glasscast.service.transport.rtmp.VideoPublisherFactory;
import com.phillippitts.glasscast.service.video.JpegPreviewEncoder;
import com.phillippitts.glasscast.service.video.OpenCvJpegPreviewEncoder;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Wires the native codecs and the shared HTTP client.
 *
 * <p>Codec beans are factories: each session gets its own encoder or publisher instance.
 */
@Configuration
public class MediaPipelineConfig {

    /**
     * Shared OkHttp client for gateway WebSockets. Read timeout is disabled; liveness comes from
     * WebSocket pings.
     */
    @Bean
    public OkHttpClient gatewayHttpClient(AudioGatewayProperties props) {
        return new OkHttpClient.Builder()
                .pingInterval(props.getPingIntervalSeconds(), TimeUnit.SECONDS)
                .connectTimeout(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    public AudioEncoderFactory audioEncoderFactory() {
        return FfmpegAacEncoder::new;
    }

    @Bean
    public VideoPublisherFactory videoPublisherFactory(RtmpProperties props) {
        return (url, width, height) -> new FfmpegRtmpPublisher(url, width, height, props);
    }

    @Bean
    public JpegPreviewEncoder jpegPreviewEncoder(PreviewProperties props) {
        return new OpenCvJpegPreviewEncoder(props.getJpegQuality());
    }
}
