package com.phillippitts.glasscast.service.transport.rtmp;

/**
 * Creates a publisher once the first frame has fixed the stream dimensions.
 */
@FunctionalInterface
public interface VideoPublisherFactory {

    VideoPublisher create(String publishUrl, int width, int height);
}
