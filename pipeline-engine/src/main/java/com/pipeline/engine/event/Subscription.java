package com.pipeline.engine.event;

/**
 * Handle returned by {@link PipelineEventBus#subscribe}. Closing it stops delivery.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
