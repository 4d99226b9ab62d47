package com.phillippitts.glasscast.service.audio;

import com.phillippitts.glasscast.domain.AudioChunk;
import com.phillippitts.glasscast.domain.EncodedAacPacket;
import com.phillippitts.glasscast.exception.EncodeException;
import com.phillippitts.glasscast.exception.PartialEncodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bytedeco.ffmpeg.avcodec.AVCodec;
import org.bytedeco.ffmpeg.avcodec.AVCodecContext;
import org.bytedeco.ffmpeg.avcodec.AVPacket;
import org.bytedeco.ffmpeg.avutil.AVChannelLayout;
import org.bytedeco.ffmpeg.avutil.AVDictionary;
import org.bytedeco.ffmpeg.avutil.AVFrame;
import org.bytedeco.ffmpeg.swresample.SwrContext;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.javacpp.PointerPointer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.ffmpeg.global.avcodec.AV_CODEC_ID_AAC;
import static org.bytedeco.ffmpeg.global.avcodec.av_packet_alloc;
import static org.bytedeco.ffmpeg.global.avcodec.av_packet_free;
import static org.bytedeco.ffmpeg.global.avcodec.av_packet_unref;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_alloc_context3;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_find_encoder;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_free_context;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_open2;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_receive_packet;
import static org.bytedeco.ffmpeg.global.avcodec.avcodec_send_frame;
import static org.bytedeco.ffmpeg.global.avutil.AVERROR_EAGAIN;
import static org.bytedeco.ffmpeg.global.avutil.AVERROR_EOF;
import static org.bytedeco.ffmpeg.global.avutil.AV_ROUND_UP;
import static org.bytedeco.ffmpeg.global.avutil.AV_SAMPLE_FMT_FLTP;
import static org.bytedeco.ffmpeg.global.avutil.AV_SAMPLE_FMT_S16;
import static org.bytedeco.ffmpeg.global.avutil.av_channel_layout_copy;
import static org.bytedeco.ffmpeg.global.avutil.av_channel_layout_default;
import static org.bytedeco.ffmpeg.global.avutil.av_channel_layout_uninit;
import static org.bytedeco.ffmpeg.global.avutil.av_frame_alloc;
import static org.bytedeco.ffmpeg.global.avutil.av_frame_free;
import static org.bytedeco.ffmpeg.global.avutil.av_frame_get_buffer;
import static org.bytedeco.ffmpeg.global.avutil.av_frame_make_writable;
import static org.bytedeco.ffmpeg.global.avutil.av_opt_set_chlayout;
import static org.bytedeco.ffmpeg.global.avutil.av_opt_set_int;
import static org.bytedeco.ffmpeg.global.avutil.av_opt_set_sample_fmt;
import static org.bytedeco.ffmpeg.global.avutil.av_rescale_rnd;
import static org.bytedeco.ffmpeg.global.avutil.av_strerror;
import static org.bytedeco.ffmpeg.global.swresample.swr_alloc;
import static org.bytedeco.ffmpeg.global.swresample.swr_convert;
import static org.bytedeco.ffmpeg.global.swresample.swr_free;
import static org.bytedeco.ffmpeg.global.swresample.swr_get_delay;
import static org.bytedeco.ffmpeg.global.swresample.swr_init;

/**
 * AAC-LC encoder on top of FFmpeg's native {@code aac} encoder.
 *
 * <p>Input PCM is resampled to 24 kHz mono float planar by a single {@code SwrContext} that is
 * created from the first chunk's format and reused for the whole session. Rebuilding it per chunk
 * would reset the resampler's filter history and the encoder would see discontinuities.
 *
 * <p>Resampled samples accumulate until a full AAC frame (1024 samples) is available; each frame
 * may complete zero or more packets.
 */
public class FfmpegAacEncoder implements AudioEncoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegAacEncoder.class);

    private static final String CODEC = "aac";
    // FF_PROFILE_AAC_LOW
    private static final int AAC_LOW = 1;

    private AVCodecContext context;
    private AVFrame frame;
    private AVPacket packet;
    private SwrContext resampler;
    private final int frameSize;

    private int inputSampleRate = -1;
    private int inputChannels = -1;

    private float[] pending = new float[AacFormat.SAMPLES_PER_FRAME * 4];
    private int pendingCount;
    private long nextPts;
    private long packetIndex;
    private boolean closed;

    public FfmpegAacEncoder() {
        AVCodec codec = avcodec_find_encoder(AV_CODEC_ID_AAC);
        if (codec == null) {
            throw new EncodeException("FFmpeg build has no AAC encoder", CODEC);
        }
        try {
            context = avcodec_alloc_context3(codec);
            context.sample_fmt(AV_SAMPLE_FMT_FLTP);
            context.sample_rate(AacFormat.TARGET_SAMPLE_RATE);
            av_channel_layout_default(context.ch_layout(), AacFormat.TARGET_CHANNELS);
            context.bit_rate(AacFormat.TARGET_BIT_RATE);
            context.profile(AAC_LOW);
            context.time_base().num(1).den(AacFormat.TARGET_SAMPLE_RATE);
            check(avcodec_open2(context, codec, (AVDictionary) null), "avcodec_open2");

            frameSize = context.frame_size() > 0 ? context.frame_size() : AacFormat.SAMPLES_PER_FRAME;
            frame = av_frame_alloc();
            frame.nb_samples(frameSize);
            frame.format(context.sample_fmt());
            frame.sample_rate(context.sample_rate());
            check(av_channel_layout_copy(frame.ch_layout(), context.ch_layout()), "av_channel_layout_copy");
            check(av_frame_get_buffer(frame, 0), "av_frame_get_buffer");
            packet = av_packet_alloc();
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        LOG.debug("AAC encoder opened: {} Hz, {} ch, {} bps, frame={} samples",
                AacFormat.TARGET_SAMPLE_RATE, AacFormat.TARGET_CHANNELS, AacFormat.TARGET_BIT_RATE, frameSize);
    }

    @Override
    public List<EncodedAacPacket> encode(AudioChunk chunk) {
        if (closed) {
            throw new IllegalStateException("Encoder is closed");
        }
        bindResampler(chunk);
        int inSamples = chunk.frameCount();
        if (inSamples == 0) {
            return List.of();
        }

        append(resample(chunk.pcm(), inSamples));

        List<EncodedAacPacket> out = new ArrayList<>();
        try {
            while (pendingCount >= frameSize) {
                sendFrame();
                drainPackets(out);
            }
        } catch (EncodeException e) {
            if (out.isEmpty()) {
                throw e;
            }
            throw new PartialEncodeException("encode failed after " + out.size() + " packet(s)",
                    CODEC, out, e);
        }
        return out;
    }

    private void bindResampler(AudioChunk chunk) {
        if (resampler != null) {
            if (chunk.sampleRate() != inputSampleRate || chunk.channelCount() != inputChannels) {
                throw new EncodeException("PCM format changed from " + inputSampleRate + " Hz/" + inputChannels
                        + " ch to " + chunk.sampleRate() + " Hz/" + chunk.channelCount()
                        + " ch; resampler is bound to the first format", CODEC);
            }
            return;
        }

        SwrContext swr = swr_alloc();
        AVChannelLayout inLayout = new AVChannelLayout();
        try {
            av_channel_layout_default(inLayout, chunk.channelCount());
            av_opt_set_chlayout(swr, "in_chlayout", inLayout, 0);
            av_opt_set_int(swr, "in_sample_rate", chunk.sampleRate(), 0);
            av_opt_set_sample_fmt(swr, "in_sample_fmt", AV_SAMPLE_FMT_S16, 0);
            av_opt_set_chlayout(swr, "out_chlayout", context.ch_layout(), 0);
            av_opt_set_int(swr, "out_sample_rate", AacFormat.TARGET_SAMPLE_RATE, 0);
            av_opt_set_sample_fmt(swr, "out_sample_fmt", AV_SAMPLE_FMT_FLTP, 0);
            int ret = swr_init(swr);
            if (ret < 0) {
                swr_free(swr);
                throw new EncodeException("swr_init failed: " + errorString(ret), CODEC);
            }
        } finally {
            av_channel_layout_uninit(inLayout);
            inLayout.close();
        }
        resampler = swr;
        inputSampleRate = chunk.sampleRate();
        inputChannels = chunk.channelCount();
        LOG.info("AAC resampler bound: {} Hz/{} ch -> {} Hz/{} ch",
                inputSampleRate, inputChannels, AacFormat.TARGET_SAMPLE_RATE, AacFormat.TARGET_CHANNELS);
    }

    private float[] resample(byte[] pcm, int inSamples) {
        long delay = swr_get_delay(resampler, inputSampleRate);
        int maxOut = (int) av_rescale_rnd(delay + inSamples, AacFormat.TARGET_SAMPLE_RATE,
                inputSampleRate, AV_ROUND_UP);

        try (BytePointer in = new BytePointer(pcm);
             FloatPointer out = new FloatPointer(maxOut);
             PointerPointer<BytePointer> inPlanes = new PointerPointer<BytePointer>(in);
             PointerPointer<FloatPointer> outPlanes = new PointerPointer<FloatPointer>(out)) {
            int converted = swr_convert(resampler, outPlanes, maxOut, inPlanes, inSamples);
            if (converted < 0) {
                throw new EncodeException("swr_convert failed: " + errorString(converted), CODEC);
            }
            float[] samples = new float[converted];
            out.get(samples);
            return samples;
        }
    }

    private void append(float[] samples) {
        if (pendingCount + samples.length > pending.length) {
            float[] grown = new float[Math.max(pending.length * 2, pendingCount + samples.length)];
            System.arraycopy(pending, 0, grown, 0, pendingCount);
            pending = grown;
        }
        System.arraycopy(samples, 0, pending, pendingCount, samples.length);
        pendingCount += samples.length;
    }

    private void sendFrame() {
        check(av_frame_make_writable(frame), "av_frame_make_writable");
        new FloatPointer(frame.data(0)).put(pending, 0, frameSize);
        frame.pts(nextPts);
        nextPts += frameSize;

        pendingCount -= frameSize;
        System.arraycopy(pending, frameSize, pending, 0, pendingCount);

        check(avcodec_send_frame(context, frame), "avcodec_send_frame");
    }

    private void drainPackets(List<EncodedAacPacket> out) {
        while (true) {
            int ret = avcodec_receive_packet(context, packet);
            if (ret == AVERROR_EAGAIN() || ret == AVERROR_EOF()) {
                return;
            }
            check(ret, "avcodec_receive_packet");
            try {
                byte[] payload = new byte[packet.size()];
                BytePointer data = packet.data();
                data.capacity(payload.length);
                data.get(payload);
                out.add(new EncodedAacPacket(payload, AacFormat.TARGET_SAMPLE_RATE,
                        AacFormat.TARGET_CHANNELS, packetIndex++));
            } finally {
                av_packet_unref(packet);
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (packet != null) {
            av_packet_free(packet);
            packet = null;
        }
        if (frame != null) {
            av_frame_free(frame);
            frame = null;
        }
        if (resampler != null) {
            swr_free(resampler);
            resampler = null;
        }
        if (context != null) {
            avcodec_free_context(context);
            context = null;
        }
        LOG.debug("AAC encoder closed after {} packets", packetIndex);
    }

    private static void check(int ret, String call) {
        if (ret < 0) {
            throw new EncodeException(call + " failed: " + errorString(ret), CODEC);
        }
    }

    private static String errorString(int code) {
        byte[] buf = new byte[128];
        av_strerror(code, buf, buf.length);
        int len = 0;
        while (len < buf.length && buf[len] != 0) {
            len++;
        }
        return new String(buf, 0, len, StandardCharsets.US_ASCII) + " (" + code + ")";
    }
}
