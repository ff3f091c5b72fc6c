package com.pipeline.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process fan-out of scheduler events.
 *
 * Every subscriber gets its own single-threaded delivery queue: publishing never blocks
 * the publisher, each subscriber sees events in publication order, and a slow or
 * throwing subscriber does not affect the others.
 */
public class PipelineEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventBus.class);

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicInteger subscriberSequence = new AtomicInteger();

    // ========== Subscription ==========

    public Subscription subscribe(PipelineEventListener listener) {
        Subscriber subscriber = new Subscriber(listener, subscriberSequence.incrementAndGet());
        subscribers.add(subscriber);
        log.debug("Subscriber {} registered", subscriber.id);
        return subscriber;
    }

    public Subscription onProgress(Consumer<TaskProgressEvent> callback) {
        return subscribe(new PipelineEventListener() {
            @Override
            public void onProgress(TaskProgressEvent event) {
                callback.accept(event);
            }
        });
    }

    public Subscription onStatusChange(Consumer<TaskStatusEvent> callback) {
        return subscribe(new PipelineEventListener() {
            @Override
            public void onStatusChange(TaskStatusEvent event) {
                callback.accept(event);
            }
        });
    }

    public Subscription onPipelineComplete(Runnable callback) {
        return subscribe(new PipelineEventListener() {
            @Override
            public void onPipelineComplete() {
                callback.run();
            }
        });
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    // ========== Publication ==========

    public void publishProgress(TaskProgressEvent event) {
        for (Subscriber subscriber : subscribers) {
            subscriber.deliver("progress", listener -> listener.onProgress(event));
        }
    }

    public void publishStatusChange(TaskStatusEvent event) {
        for (Subscriber subscriber : subscribers) {
            subscriber.deliver("statusChange", listener -> listener.onStatusChange(event));
        }
    }

    public void publishPipelineComplete() {
        for (Subscriber subscriber : subscribers) {
            subscriber.deliver("pipelineComplete", PipelineEventListener::onPipelineComplete);
        }
    }

    public void publishProjectFinished(ProjectFinishedEvent event) {
        for (Subscriber subscriber : subscribers) {
            subscriber.deliver("projectFinished", listener -> listener.onProjectFinished(event));
        }
    }

    /**
     * Wait until every event published so far has been delivered.
     *
     * @return true if all subscriber queues drained within the timeout
     */
    public boolean awaitDelivery(Duration timeout) throws InterruptedException {
        List<Subscriber> snapshot = List.copyOf(subscribers);
        CountDownLatch latch = new CountDownLatch(snapshot.size());
        for (Subscriber subscriber : snapshot) {
            if (!subscriber.marker(latch::countDown)) {
                latch.countDown();
            }
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        for (Subscriber subscriber : subscribers) {
            subscriber.close();
        }
    }

    private final class Subscriber implements Subscription {
        private final PipelineEventListener listener;
        private final int id;
        private final ExecutorService queue;

        Subscriber(PipelineEventListener listener, int id) {
            this.listener = listener;
            this.id = id;
            this.queue = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "pipeline-events-" + id);
                thread.setDaemon(true);
                return thread;
            });
        }

        void deliver(String eventName, Consumer<PipelineEventListener> action) {
            try {
                queue.execute(() -> {
                    try {
                        action.accept(listener);
                    } catch (Exception e) {
                        log.warn("Subscriber {} failed handling {}: {}", id, eventName, e.getMessage(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Subscriber {} closed, dropping {}", id, eventName);
            }
        }

        boolean marker(Runnable action) {
            try {
                queue.execute(action);
                return true;
            } catch (RejectedExecutionException e) {
                log.debug("Subscriber {} closed, nothing to drain", id);
                return false;
            }
        }

        @Override
        public void close() {
            if (subscribers.remove(this)) {
                log.debug("Subscriber {} removed", id);
            }
            queue.shutdown();
        }
    }
}
