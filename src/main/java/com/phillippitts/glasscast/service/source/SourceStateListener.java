package com.phillippitts.glasscast.service.source;

@FunctionalInterface
public interface SourceStateListener {

    void onStateChanged(SourceStateEvent event);
}
