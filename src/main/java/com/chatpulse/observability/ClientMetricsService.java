package com.chatpulse.observability;

import com.chatpulse.connection.ConnectionManager;
import com.chatpulse.event.ClientErrorEvent;
import com.chatpulse.event.ConnectionEvent;
import com.chatpulse.event.ConnectionEventType;
import com.chatpulse.event.OperationEvent;
import com.chatpulse.queue.RetryQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer view of the client:
 * <ul>
 *   <li><b>chatpulse.operations.delivered / .failed / .retried</b> (counters) from OperationEvents</li>
 *   <li><b>chatpulse.connection.reconnects</b> (counter): scheduled reconnect attempts</li>
 *   <li><b>chatpulse.errors</b> (counter, tagged by kind): published error events</li>
 *   <li><b>chatpulse.queue.size</b> (gauge): operations owned by the retry queue</li>
 *   <li><b>chatpulse.connection.ready</b> (gauge 0/1)</li>
 * </ul>
 *
 * <p>Gauges are evaluated on scrape; counters are driven by application events.
 */
@Service
public class ClientMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter operationsDelivered;
    private final Counter operationsFailed;
    private final Counter operationsRetried;
    private final Counter reconnects;

    public ClientMetricsService(
            MeterRegistry meterRegistry, RetryQueue<?> retryQueue, ConnectionManager connectionManager) {
        this.meterRegistry = meterRegistry;
        this.operationsDelivered = Counter.builder("chatpulse.operations.delivered")
                .description("Operations acknowledged by the service")
                .register(meterRegistry);
        this.operationsFailed = Counter.builder("chatpulse.operations.failed")
                .description("Operations dropped after exhausting their attempts")
                .register(meterRegistry);
        this.operationsRetried = Counter.builder("chatpulse.operations.retried")
                .description("Failed delivery attempts scheduled for retry")
                .register(meterRegistry);
        this.reconnects = Counter.builder("chatpulse.connection.reconnects")
                .description("Reconnect attempts scheduled after a connection loss")
                .register(meterRegistry);

        meterRegistry.gauge("chatpulse.queue.size", retryQueue, queue -> queue.size());
        meterRegistry.gauge("chatpulse.connection.ready", connectionManager, manager -> manager.isReady() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onOperationEvent(OperationEvent event) {
        switch (event.getEventType()) {
            case DELIVERED -> operationsDelivered.increment();
            case FAILED -> operationsFailed.increment();
            case RETRY_SCHEDULED -> operationsRetried.increment();
            default -> {
                // queued and cancelled are not counted
            }
        }
    }

    @EventListener
    @Order(20)
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.getEventType() == ConnectionEventType.RECONNECTING) {
            reconnects.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onClientError(ClientErrorEvent event) {
        meterRegistry
                .counter("chatpulse.errors", "kind", event.getKind().name(), "code", event.getErrorCode().getCode())
                .increment();
    }
}
