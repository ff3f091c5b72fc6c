package com.pipeline.api.rest;

import com.pipeline.engine.event.PipelineEventListener;
import com.pipeline.engine.event.ProjectFinishedEvent;
import com.pipeline.engine.event.Subscription;
import com.pipeline.engine.event.TaskProgressEvent;
import com.pipeline.engine.event.TaskStatusEvent;
import com.pipeline.engine.service.PipelineQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * Server-Sent Events stream of scheduler events.
 *
 * Event names: {@code progress}, {@code status}, {@code pipeline-complete},
 * {@code project-finished}. Each connection is its own event bus subscriber and
 * is dropped once a send fails.
 */
@RestController
@RequestMapping("/api/v1/queue")
public class QueueEventsController {

    private static final Logger log = LoggerFactory.getLogger(QueueEventsController.class);

    private final PipelineQueueService queueService;

    public QueueEventsController(PipelineQueueService queueService) {
        this.queueService = queueService;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents() {
        SseEmitter emitter = new SseEmitter(0L);
        EmitterListener listener = new EmitterListener(emitter);
        Subscription subscription = queueService.subscribe(listener);
        listener.subscription = subscription;

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        log.debug("Event stream opened");
        return emitter;
    }

    private static final class EmitterListener implements PipelineEventListener {
        private final SseEmitter emitter;
        private volatile Subscription subscription;

        EmitterListener(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onProgress(TaskProgressEvent event) {
            send("progress", event);
        }

        @Override
        public void onStatusChange(TaskStatusEvent event) {
            send("status", event);
        }

        @Override
        public void onPipelineComplete() {
            send("pipeline-complete", Map.of());
        }

        @Override
        public void onProjectFinished(ProjectFinishedEvent event) {
            send("project-finished", event);
        }

        private void send(String name, Object data) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Event stream closed while sending {}: {}", name, e.getMessage());
                Subscription current = subscription;
                if (current != null) {
                    current.close();
                }
                emitter.completeWithError(e);
            }
        }
    }
}
