package com.phillippitts.glasscast.service.session.event;

/**
 * A JPEG preview of the current video frame.
 *
 * @param controllerId id of the controller
 * @param width frame width in pixels
 * @param height frame height in pixels
 * @param jpeg encoded image, owned by the event
 */
public record PreviewFrameEvent(String controllerId, int width, int height, byte[] jpeg) {}
