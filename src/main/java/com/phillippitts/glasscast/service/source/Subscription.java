package com.phillippitts.glasscast.service.source;

/**
 * Cancels a frame or state subscription. Idempotent.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
