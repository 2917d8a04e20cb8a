package com.workflowplatform.orchestrator.publisher;

import com.workflowplatform.common.model.ExecutionEvent;
import com.workflowplatform.common.model.ExecutionEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SinkExecutionEventPublisherTest {

    private final SinkExecutionEventPublisher publisher = new SinkExecutionEventPublisher();

    private static ExecutionEvent event(String executionId, ExecutionEventType type) {
        return ExecutionEvent.of(executionId, type, null, Map.of(), Instant.now());
    }

    @Test
    @DisplayName("publishing without subscribers is a no-op")
    void noSubscribers() {
        assertDoesNotThrow(() -> publisher.publish(event("exec-1", ExecutionEventType.EXECUTION_STARTED)));
        assertEquals(0, publisher.currentSubscriberCount());
    }

    @Test
    @DisplayName("subscribers receive events filtered by execution id")
    void filteredStream() {
        StepVerifier.create(publisher.events("exec-1").take(2))
            .then(() -> {
                publisher.publish(event("exec-1", ExecutionEventType.EXECUTION_STARTED));
                publisher.publish(event("exec-2", ExecutionEventType.EXECUTION_STARTED));
                publisher.publish(event("exec-1", ExecutionEventType.EXECUTION_COMPLETED));
            })
            .assertNext(e -> assertEquals(ExecutionEventType.EXECUTION_STARTED, e.eventType()))
            .assertNext(e -> assertEquals(ExecutionEventType.EXECUTION_COMPLETED, e.eventType()))
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }
}
