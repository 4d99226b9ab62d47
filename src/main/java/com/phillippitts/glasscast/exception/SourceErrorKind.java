package com.phillippitts.glasscast.exception;

/**
 * Classifies frame source failures and carries the message shown to users.
 */
public enum SourceErrorKind {
    INTERNAL_ERROR("An internal error occurred. Please try again."),
    DEVICE_NOT_FOUND("Device not found. Please ensure your device is connected."),
    DEVICE_NOT_CONNECTED("Device not connected. Please check your connection and try again."),
    TIMEOUT("The operation timed out. Please try again."),
    VIDEO_STREAMING_ERROR("Video streaming failed. Please try again."),
    AUDIO_STREAMING_ERROR("Audio streaming failed. Please try again."),
    PERMISSION_DENIED("Permission denied. Please grant the necessary permissions.");

    private final String userMessage;

    SourceErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
