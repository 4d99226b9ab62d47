package com.phillippitts.glasscast.service.source;

public enum SourceState {
    STARTING,
    STREAMING,
    STOPPED,
    ERROR
}
