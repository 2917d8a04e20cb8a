package com.workflowplatform.orchestrator.publisher;

import com.workflowplatform.common.event.ExecutionEventPublisher;
import com.workflowplatform.common.model.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process implementation of {@link ExecutionEventPublisher}.
 *
 * <p>Events are multicast to whoever is subscribed to {@link #events()} at emission time.
 * A transport layer (WebSocket, SSE) subscribes here; there is no replay, late subscribers
 * read history from the execution repository instead.
 */
@Component
public class SinkExecutionEventPublisher implements ExecutionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SinkExecutionEventPublisher.class);

    private final Sinks.Many<ExecutionEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(ExecutionEvent event) {
        Sinks.EmitResult result;
        // parallel stages publish from several threads; serialize to avoid FAIL_NON_SERIALIZED
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Execution event dropped (non-critical). executionId={} eventType={} result={}",
                event.executionId(), event.eventType().value(), result);
        } else {
            log.debug("Execution event published. executionId={} eventType={} agentId={}",
                event.executionId(), event.eventType().value(), event.agentId());
        }
    }

    public Flux<ExecutionEvent> events() {
        return sink.asFlux();
    }

    public Flux<ExecutionEvent> events(String executionId) {
        return sink.asFlux().filter(e -> executionId.equals(e.executionId()));
    }

    public int currentSubscriberCount() {
        return sink.currentSubscriberCount();
    }
}
