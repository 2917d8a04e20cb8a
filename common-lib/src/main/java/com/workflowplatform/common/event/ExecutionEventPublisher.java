package com.workflowplatform.common.event;

import com.workflowplatform.common.model.ExecutionEvent;

/**
 * Broadcasts execution lifecycle events to live subscribers.
 *
 * <p>Delivery is best-effort: subscribers that are absent or slow lose events, and the
 * persisted event log remains the source of truth.
 */
public interface ExecutionEventPublisher {

    /**
     * Implementations MUST be non-blocking and MUST NOT throw.
     *
     * @param event the event to broadcast
     */
    void publish(ExecutionEvent event);
}
